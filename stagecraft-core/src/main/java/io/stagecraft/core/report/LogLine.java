package io.stagecraft.core.report;

import io.stagecraft.core.util.Immutables;
import java.util.Objects;

/// A single line of step output.
///
/// @param time    optional RFC 3339 timestamp, empty when absent
/// @param stream  output stream, not null
/// @param message one line of text, never null after construction
public record LogLine(String time, LogStream stream, String message) {

    public LogLine {
        time = Immutables.orEmpty(time);
        Objects.requireNonNull(stream, "stream must not be null");
        message = Immutables.orEmpty(message);
    }

    public static LogLine system(String message) {
        return new LogLine("", LogStream.SYSTEM, message);
    }
}
