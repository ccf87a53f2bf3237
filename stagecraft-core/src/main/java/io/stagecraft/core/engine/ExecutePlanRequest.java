package io.stagecraft.core.engine;

import io.stagecraft.core.plan.Plan;
import java.util.Objects;

/// Input of {@link Engine#executePlan(ExecutePlanRequest)}.
///
/// @param plan    the plan to execute, not null
/// @param options execution options, defaults to {@link ExecOptions#defaults()}
public record ExecutePlanRequest(Plan plan, ExecOptions options) {

    public ExecutePlanRequest {
        Objects.requireNonNull(plan, "plan must not be null");
        options = options != null ? options : ExecOptions.defaults();
    }
}
