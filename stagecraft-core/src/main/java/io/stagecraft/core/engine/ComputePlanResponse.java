package io.stagecraft.core.engine;

import io.stagecraft.core.plan.Plan;
import java.util.Objects;

/// Output of {@link Engine#computePlan(ComputePlanRequest)}.
///
/// @param plan the computed plan, not null
public record ComputePlanResponse(Plan plan) {

    public ComputePlanResponse {
        Objects.requireNonNull(plan, "plan must not be null");
    }
}
