package io.stagecraft.core.agent;

import io.stagecraft.core.plan.StepAction;
import java.util.Optional;

/// Registry for {@link StepExecutor} instances, keyed by {@link StepAction}.
///
/// Executors are registered once at startup and looked up by the step's action at
/// execution time.
///
/// @implNote Thread-safety is implementation-specific.
/// @see DefaultStepExecutorRegistry for the default implementation
public interface StepExecutorRegistry {

    /// Registers an executor for an action.
    ///
    /// @apiNote **Side effects**: overwrites any previously registered executor for the
    /// same action.
    ///
    /// @param action   the action, not null
    /// @param executor the executor, not null
    void register(StepAction action, StepExecutor executor);

    /// Returns the executor registered for an action.
    ///
    /// @param action the action, not null
    /// @return the executor, or empty if none is registered
    Optional<StepExecutor> getExecutor(StepAction action);

    /// Returns whether an executor is registered for an action.
    ///
    /// @param action the action, not null
    /// @return true if registered
    default boolean hasExecutor(StepAction action) {
        return getExecutor(action).isPresent();
    }
}
