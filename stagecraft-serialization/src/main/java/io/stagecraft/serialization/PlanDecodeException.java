package io.stagecraft.serialization;

import java.io.Serial;
import java.util.Objects;

/// Raised when a document fails strict decoding.
///
/// Fatal to the single decode call; nothing is partially returned.
public class PlanDecodeException extends Exception {
    @Serial private static final long serialVersionUID = -7781215031849230566L;

    /// Why a document was rejected.
    public enum Reason {
        /// A field name is not part of the target schema.
        UNKNOWN_FIELD,
        /// Content follows the single top-level JSON value.
        TRAILING_CONTENT,
        /// Malformed JSON, a type mismatch, an unknown enum spelling or a duplicate key.
        MALFORMED,
        /// The document's `version` is not the supported schema version.
        VERSION_MISMATCH
    }

    private final Reason reason;
    private final String field;

    public PlanDecodeException(Reason reason, String message) {
        this(reason, message, "", null);
    }

    public PlanDecodeException(Reason reason, String message, String field, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.field = field != null ? field : "";
    }

    public Reason getReason() {
        return reason;
    }

    /// Returns the offending field name, when the reason concerns one field.
    ///
    /// @return field name, or empty
    public String getField() {
        return field;
    }
}
