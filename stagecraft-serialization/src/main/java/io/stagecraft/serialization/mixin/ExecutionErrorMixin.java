package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Wire layout of `ExecutionError`.
@JsonPropertyOrder({"code", "message"})
public abstract class ExecutionErrorMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract String code();
}
