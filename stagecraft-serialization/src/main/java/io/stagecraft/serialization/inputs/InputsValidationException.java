package io.stagecraft.serialization.inputs;

import java.io.Serial;

/// Raised when typed step inputs fail normalisation or validation.
public class InputsValidationException extends Exception {
    @Serial private static final long serialVersionUID = 5512093164470719232L;

    public InputsValidationException(String message) {
        super(message);
    }

    public InputsValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /// Prefixes the message with the offending field.
    ///
    /// @param field field name, e.g. `workdir` or `overlays[2].path`
    /// @param cause the underlying failure
    /// @return new exception, never null
    static InputsValidationException forField(String field, InputsValidationException cause) {
        return new InputsValidationException(field + ": " + cause.getMessage(), cause);
    }
}
