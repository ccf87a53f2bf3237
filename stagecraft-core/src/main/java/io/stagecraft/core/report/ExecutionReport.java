package io.stagecraft.core.report;

import io.stagecraft.core.util.Immutables;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Portable result of executing a plan or a host plan.
///
/// This is the contract an executor must populate; the engine core owns only the
/// schema, never the execution itself.
///
/// @param planId identifier of the executed plan
/// @param status overall status, not null
/// @param steps  per-step records in execution order, never null after construction
/// @param meta   annotations, never null after construction
public record ExecutionReport(
        String planId, ExecutionStatus status, List<StepExecution> steps, Map<String, String> meta) {

    public ExecutionReport {
        planId = Immutables.orEmpty(planId);
        Objects.requireNonNull(status, "status must not be null");
        steps = Immutables.copyOf(steps);
        meta = Immutables.copyOf(meta);
    }

    /// Creates a report without annotations.
    public static ExecutionReport of(
            String planId, ExecutionStatus status, List<StepExecution> steps) {
        return new ExecutionReport(planId, status, steps, Map.of());
    }

    /// Looks up the record of one step.
    ///
    /// @param stepId step identifier
    /// @return the record, or empty when the step was not reported
    public Optional<StepExecution> step(String stepId) {
        return steps.stream().filter(s -> s.stepId().equals(stepId)).findFirst();
    }

    /// Concatenates several reports of the same plan.
    ///
    /// Steps keep the order of the input reports; the status is the most severe
    /// input status.
    ///
    /// @param planId plan identifier
    /// @param reports reports to merge, in order, not null
    /// @return merged report, never null
    public static ExecutionReport merge(String planId, List<ExecutionReport> reports) {
        ExecutionStatus status = ExecutionStatus.SUCCEEDED;
        List<StepExecution> steps = new ArrayList<>();
        for (ExecutionReport report : reports) {
            status = status.combine(report.status());
            steps.addAll(report.steps());
        }
        return of(planId, status, steps);
    }
}
