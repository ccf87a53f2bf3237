package io.stagecraft.core.report;

import io.stagecraft.core.util.WireEnum;

/// Lifecycle status of a single step execution.
public enum StepStatus implements WireEnum {
    /// Not started yet.
    PENDING("pending"),
    /// Currently executing.
    RUNNING("running"),
    /// Completed successfully.
    SUCCEEDED("succeeded"),
    /// Failed.
    FAILED("failed"),
    /// Not executed.
    SKIPPED("skipped");

    private final String wireValue;

    StepStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    /// Returns whether the status is final.
    ///
    /// @return true for succeeded, failed and skipped
    public boolean terminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
