package io.stagecraft.core.engine;

import java.io.Serial;

/// Raised when the engine or one of its collaborators cannot complete a request.
///
/// Step-level failures are not exceptions: they are recorded in the
/// {@link io.stagecraft.core.report.ExecutionReport}. This exception signals that no
/// meaningful response could be produced at all.
public class EngineException extends Exception {
    @Serial private static final long serialVersionUID = 4127351290665830174L;

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
