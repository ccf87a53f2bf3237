package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/// Wire layout of `StepExecution`: timestamps, error, logs and meta are optional.
@JsonPropertyOrder({
    "stepId", "host", "status", "startedAt", "completedAt", "error", "logs", "meta"
})
public abstract class StepExecutionMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract String startedAt();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract String completedAt();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    abstract Object error();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract List<?> logs();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract Map<String, String> meta();
}
