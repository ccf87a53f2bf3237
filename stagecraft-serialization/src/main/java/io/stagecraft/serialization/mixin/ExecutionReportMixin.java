package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/// Wire layout of `ExecutionReport`.
@JsonPropertyOrder({"planId", "status", "steps", "meta"})
public abstract class ExecutionReportMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract Map<String, String> meta();
}
