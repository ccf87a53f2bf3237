package io.stagecraft.cli.exception;

import java.io.Serial;

/// Thrown when a command's input file is not specified or cannot be read.
///
/// @see io.stagecraft.cli.commands.StagecraftCommand
public class InputFileException extends Exception {

    @Serial private static final long serialVersionUID = 4471956012389104527L;

    /// Creates an exception with the specified detail message.
    ///
    /// @param message description of the problem, not null
    public InputFileException(String message) {
        super(message);
    }

    /// Creates an exception wrapping an I/O failure.
    ///
    /// @param message description of the problem, not null
    /// @param cause   the underlying failure
    public InputFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
