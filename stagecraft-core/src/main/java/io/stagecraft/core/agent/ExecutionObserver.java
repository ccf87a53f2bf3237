package io.stagecraft.core.agent;

import io.stagecraft.core.plan.HostPlanStep;
import io.stagecraft.core.report.StepExecution;

/// Receives progress callbacks from {@link HostPlanAgent}.
///
/// Exceptions thrown by an observer are logged and never affect execution.
public interface ExecutionObserver {

    /// Called before a step's executor is invoked.
    default void onStepStarted(String planId, HostPlanStep step) {}

    /// Called after a step's record is final.
    default void onStepCompleted(String planId, StepExecution execution) {}
}
