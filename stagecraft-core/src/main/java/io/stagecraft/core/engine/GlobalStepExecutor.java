package io.stagecraft.core.engine;

import io.stagecraft.core.plan.PlanStep;
import io.stagecraft.core.report.StepExecution;

/// Runs a host-agnostic step, such as a build or a migration driven from the
/// orchestrator.
@FunctionalInterface
public interface GlobalStepExecutor {

    /// @param step the global step, not null
    /// @return the execution record, never null
    /// @throws EngineException if the step cannot be executed at all
    StepExecution execute(PlanStep step) throws EngineException;
}
