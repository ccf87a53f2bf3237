package io.stagecraft.core.resource;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// Provider-owned JSON payload carried through the engine without interpretation.
///
/// Holds the compact JSON text of a single value. The core never parses it: the
/// slicer copies the reference as is, and only the planner that produced it and the
/// executor that consumes it know its schema. The wire codec writes the text back
/// verbatim, which keeps payload bytes stable across a slice/encode/decode cycle.
///
/// A JSON `null` (or an absent payload) is represented by {@link #NULL}.
///
/// @param json compact JSON text of one value, never null or blank
public record OpaquePayload(String json) {

    /// The JSON `null` payload.
    public static final OpaquePayload NULL = new OpaquePayload("null");

    public OpaquePayload {
        Objects.requireNonNull(json, "json must not be null");
        json = json.strip();
        if (json.isEmpty()) {
            throw new IllegalArgumentException("json must not be blank");
        }
    }

    /// Wraps JSON text, mapping null or blank text to {@link #NULL}.
    ///
    /// @param json JSON text, may be null
    /// @return payload, never null
    public static OpaquePayload of(String json) {
        if (json == null || json.isBlank()) {
            return NULL;
        }
        return new OpaquePayload(json);
    }

    /// Returns whether this payload is the JSON `null` value.
    ///
    /// @return true for {@link #NULL}
    public boolean absent() {
        return "null".equals(json);
    }

    /// Returns the payload encoded as UTF-8.
    ///
    /// @return fresh byte array, never null
    public byte[] bytes() {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return json;
    }
}
