package io.stagecraft.core.agent;

import io.stagecraft.core.engine.EngineException;
import java.io.Serial;

/// Raised when a host plan is structurally unexecutable, for example when a step's
/// local dependency has not completed by the time the step is reached.
public class AgentExecutionException extends EngineException {
    @Serial private static final long serialVersionUID = 7719503648129001286L;

    public AgentExecutionException(String message) {
        super(message);
    }
}
