package io.stagecraft.core.engine;

import io.stagecraft.core.plan.HostPlan;
import io.stagecraft.core.report.ExecutionReport;

/// Runs one {@link HostPlan}, typically on (or on behalf of) the target host.
///
/// @see io.stagecraft.core.agent.HostPlanAgent for the in-process implementation
@FunctionalInterface
public interface HostPlanExecutor {

    /// @param hostPlan the host plan, not null
    /// @return report covering the executed steps, never null
    /// @throws EngineException if the host plan cannot be executed at all
    ExecutionReport execute(HostPlan hostPlan) throws EngineException;
}
