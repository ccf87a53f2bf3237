package io.stagecraft.core.resource;

import io.stagecraft.core.util.Immutables;
import java.util.Map;
import java.util.Objects;

/// An observed resource in a {@link StateSnapshot}.
///
/// @param ref  resource identity, not null
/// @param data provider/runtime-specific observed payload, never null after construction
/// @param meta safe annotations, never null after construction
public record ResourceState(ResourceRef ref, OpaquePayload data, Map<String, String> meta) {

    public ResourceState {
        Objects.requireNonNull(ref, "ref must not be null");
        data = data != null ? data : OpaquePayload.NULL;
        meta = Immutables.copyOf(meta);
    }
}
