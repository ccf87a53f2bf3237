package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/// Wire layout shared by `ResourceSpec` and `ResourceState`.
///
/// `data` is always written (JSON `null` when absent); `meta` only when non-empty.
@JsonPropertyOrder({"ref", "data", "meta"})
public abstract class ResourceEntryMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract Map<String, String> meta();
}
