package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/// Wire layout of `HostRef`: `logicalId` is always written, even when empty.
@JsonPropertyOrder({"logicalId", "labels"})
public abstract class HostRefMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract Map<String, String> labels();
}
