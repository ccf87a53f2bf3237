package io.stagecraft.core.report;

import io.stagecraft.core.util.WireEnum;

/// Overall outcome of executing a plan or host plan.
public enum ExecutionStatus implements WireEnum {
    /// All steps completed successfully (or were deliberately not run).
    SUCCEEDED("succeeded", 0),
    /// At least one step failed.
    FAILED("failed", 2),
    /// Nothing failed, but some steps could not run.
    PARTIAL("partial", 1);

    private final String wireValue;
    private final int severity;

    ExecutionStatus(String wireValue, int severity) {
        this.wireValue = wireValue;
        this.severity = severity;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    /// Combines two statuses: {@code FAILED} dominates {@code PARTIAL}, which dominates
    /// {@code SUCCEEDED}.
    ///
    /// @param other status to combine with, not null
    /// @return the more severe of the two
    public ExecutionStatus combine(ExecutionStatus other) {
        return severity >= other.severity ? this : other;
    }
}
