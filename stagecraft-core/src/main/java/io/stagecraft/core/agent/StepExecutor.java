package io.stagecraft.core.agent;

import io.stagecraft.core.plan.HostPlanStep;
import io.stagecraft.core.plan.HostRef;

/// Executes a single host plan step of one action type.
///
/// Implementations receive the step with its opaque inputs untouched and decide
/// themselves how to decode them.
///
/// @see StepExecutorRegistry for registration by action
@FunctionalInterface
public interface StepExecutor {

    /// Executes one step.
    ///
    /// @param step the step, not null
    /// @param host the host the step runs on, not null
    /// @throws StepExecutionException if the step fails
    void execute(HostPlanStep step, HostRef host) throws StepExecutionException;
}
