package io.stagecraft.core.report;

import io.stagecraft.core.plan.HostRef;
import io.stagecraft.core.util.Immutables;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Execution record of one step, as produced by an executor.
///
/// Timestamps are plain strings (RFC 3339 by convention) rather than time values so
/// reports stay deterministic in tests and portable across processes and languages.
///
/// @param stepId      the executed step
/// @param host        where it ran; empty logical id for global steps
/// @param status      step status, not null
/// @param startedAt   start timestamp, empty when not started
/// @param completedAt completion timestamp, empty when not completed
/// @param error       failure details, null when the step did not fail or skip
/// @param logs        optional output lines, never null after construction
/// @param meta        annotations, never null after construction
public record StepExecution(
        String stepId,
        HostRef host,
        StepStatus status,
        String startedAt,
        String completedAt,
        ExecutionError error,
        List<LogLine> logs,
        Map<String, String> meta) {

    public StepExecution {
        stepId = Immutables.orEmpty(stepId);
        host = host != null ? host : HostRef.global();
        Objects.requireNonNull(status, "status must not be null");
        startedAt = Immutables.orEmpty(startedAt);
        completedAt = Immutables.orEmpty(completedAt);
        logs = Immutables.copyOf(logs);
        meta = Immutables.copyOf(meta);
    }

    /// Creates a succeeded record.
    public static StepExecution succeeded(
            String stepId, HostRef host, String startedAt, String completedAt) {
        return new StepExecution(
                stepId, host, StepStatus.SUCCEEDED, startedAt, completedAt, null, null, null);
    }

    /// Creates a failed record.
    public static StepExecution failed(
            String stepId,
            HostRef host,
            String startedAt,
            String completedAt,
            ExecutionError error) {
        return new StepExecution(
                stepId, host, StepStatus.FAILED, startedAt, completedAt, error, null, null);
    }

    /// Creates a skipped record; skipped steps carry no timestamps.
    public static StepExecution skipped(String stepId, HostRef host, ExecutionError error) {
        return new StepExecution(stepId, host, StepStatus.SKIPPED, "", "", error, null, null);
    }

    /// Returns a copy with the given log lines attached.
    ///
    /// @param lines log lines, may be null
    /// @return new record, never null
    public StepExecution withLogs(List<LogLine> lines) {
        return new StepExecution(
                stepId, host, status, startedAt, completedAt, error, lines, meta);
    }
}
