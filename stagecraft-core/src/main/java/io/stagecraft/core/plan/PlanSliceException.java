package io.stagecraft.core.plan;

import java.io.Serial;

/// Thrown when a plan cannot be partitioned into host plans.
///
/// Slicing is all-or-nothing: when this is thrown, no host plan or global step
/// list escapes. Messages name the offending step and host IDs verbatim so that
/// multi-host failures are traceable in production logs.
///
/// @see PlanSlicer#slice(Plan)
public class PlanSliceException extends Exception {

    @Serial private static final long serialVersionUID = 3904522178660935177L;

    private final String stepId;

    /// Creates exception with message.
    ///
    /// @param stepId the step that failed validation
    /// @param message description of the violation
    public PlanSliceException(String stepId, String message) {
        super(message);
        this.stepId = stepId;
    }

    /// Returns the step that failed validation.
    ///
    /// @return step id, never null
    public String getStepId() {
        return stepId;
    }
}
