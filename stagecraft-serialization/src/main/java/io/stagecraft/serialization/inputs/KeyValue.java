package io.stagecraft.serialization.inputs;

import io.stagecraft.core.util.Immutables;

/// A key/value entry, used where order must be canonical (build args, labels,
/// compose variables, HTTP headers).
///
/// @param key   entry key, required
/// @param value entry value, may be empty
public record KeyValue(String key, String value) {

    public KeyValue {
        key = Immutables.orEmpty(key);
        value = Immutables.orEmpty(value);
    }

    KeyValue trimmed() {
        return new KeyValue(InputsNormalizer.trim(key), InputsNormalizer.trim(value));
    }
}
