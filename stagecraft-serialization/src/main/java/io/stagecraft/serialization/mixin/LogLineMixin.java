package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Wire layout of `LogLine`.
@JsonPropertyOrder({"time", "stream", "message"})
public abstract class LogLineMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract String time();
}
