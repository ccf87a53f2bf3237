package io.stagecraft.core.agent;

import io.stagecraft.core.plan.StepAction;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Default mutable implementation of {@link StepExecutorRegistry}.
///
/// @implNote Not thread-safe for concurrent registration. Safe for concurrent
/// lookup once registration is complete.
public class DefaultStepExecutorRegistry implements StepExecutorRegistry {

    private final Map<StepAction, StepExecutor> executors = new EnumMap<>(StepAction.class);

    @Override
    public void register(StepAction action, StepExecutor executor) {
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        executors.put(action, executor);
    }

    /// Registers the same executor for every action.
    ///
    /// @param executor the executor, not null
    public void registerForAllActions(StepExecutor executor) {
        for (StepAction action : StepAction.values()) {
            register(action, executor);
        }
    }

    @Override
    public Optional<StepExecutor> getExecutor(StepAction action) {
        return Optional.ofNullable(executors.get(action));
    }
}
