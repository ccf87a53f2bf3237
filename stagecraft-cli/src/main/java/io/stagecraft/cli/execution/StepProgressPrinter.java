package io.stagecraft.cli.execution;

import io.stagecraft.core.agent.ExecutionObserver;
import io.stagecraft.core.plan.HostPlanStep;
import io.stagecraft.core.report.StepExecution;
import java.io.PrintStream;
import java.util.Objects;

/// Execution observer that prints one line per step transition.
///
/// ### Output Format
/// ```
///   -> render (render_compose)
///   [OK] render
///   [SKIP] smoke: no executor registered for action "noop"
///   [FAIL] apply: apply_compose inputs validation failed: pull is required ...
/// ```
///
/// @implNote **Not thread-safe**. Lines may interleave if host plans run in parallel.
public class StepProgressPrinter implements ExecutionObserver {

    private final PrintStream out;

    /// @param out stream to print to (stderr in the CLI, so stdout stays pure JSON), not null
    public StepProgressPrinter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public void onStepStarted(String planId, HostPlanStep step) {
        out.println("  -> " + step.id() + " (" + step.action().wireValue() + ")");
    }

    @Override
    public void onStepCompleted(String planId, StepExecution execution) {
        String marker =
                switch (execution.status()) {
                    case SUCCEEDED -> "[OK]";
                    case FAILED -> "[FAIL]";
                    case SKIPPED -> "[SKIP]";
                    default -> "[" + execution.status().wireValue() + "]";
                };
        StringBuilder line = new StringBuilder("  ").append(marker).append(' ').append(execution.stepId());
        if (execution.error() != null) {
            line.append(": ").append(execution.error().message());
        }
        out.println(line);
    }
}
