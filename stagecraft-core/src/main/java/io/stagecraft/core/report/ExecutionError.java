package io.stagecraft.core.report;

import io.stagecraft.core.util.Immutables;

/// Machine-readable failure attached to a {@link StepExecution}.
///
/// @param code    stable error code such as `EXECUTION_ERROR`; empty when absent
/// @param message human-readable description, never null after construction
public record ExecutionError(String code, String message) {

    /// No executor is registered for the step's action.
    public static final String NO_EXECUTOR = "NO_EXECUTOR";
    /// The step executor reported a failure.
    public static final String EXECUTION_ERROR = "EXECUTION_ERROR";
    /// A global step the host plan waits for did not succeed.
    public static final String GLOBAL_DEPENDENCY_UNMET = "GLOBAL_DEPENDENCY_UNMET";
    /// An earlier step failed and execution stopped.
    public static final String UPSTREAM_FAILED = "UPSTREAM_FAILED";
    /// The step was excluded by a step filter.
    public static final String FILTERED = "FILTERED";
    /// Dry-run: nothing was executed.
    public static final String DRY_RUN = "DRY_RUN";

    public ExecutionError {
        code = Immutables.orEmpty(code);
        message = Immutables.orEmpty(message);
    }
}
