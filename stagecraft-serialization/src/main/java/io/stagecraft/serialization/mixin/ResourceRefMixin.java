package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Wire layout of `ResourceRef`: `namespace` is omitted when empty.
@JsonPropertyOrder({"kind", "name", "provider", "namespace"})
public abstract class ResourceRefMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract String namespace();
}
