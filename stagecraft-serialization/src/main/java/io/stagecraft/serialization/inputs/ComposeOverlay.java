package io.stagecraft.serialization.inputs;

import io.stagecraft.core.util.Immutables;

/// A named compose overlay file, applied in name order.
///
/// @param name overlay name, the sort key
/// @param path relative overlay path
public record ComposeOverlay(String name, String path) {

    public ComposeOverlay {
        name = Immutables.orEmpty(name);
        path = Immutables.orEmpty(path);
    }
}
