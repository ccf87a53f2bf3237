package io.stagecraft.core.agent;

import java.io.Serial;

/// Raised by a {@link StepExecutor} when a step fails.
///
/// The agent records the message as an `EXECUTION_ERROR` on the step and stops
/// executing the host plan.
public class StepExecutionException extends Exception {
    @Serial private static final long serialVersionUID = -2381946601533180417L;

    public StepExecutionException(String message) {
        super(message);
    }

    public StepExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
