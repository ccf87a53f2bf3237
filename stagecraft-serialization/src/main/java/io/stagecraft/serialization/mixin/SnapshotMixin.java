package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/// Wire layout shared by `TopologySnapshot` and `StateSnapshot`.
@JsonPropertyOrder({"version", "meta", "resources"})
public abstract class SnapshotMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract Map<String, String> meta();
}
