package io.stagecraft.core.resource;

import io.stagecraft.core.util.Immutables;
import java.util.Map;
import java.util.Objects;

/// A desired resource in a {@link TopologySnapshot}.
///
/// @param ref  resource identity, not null
/// @param data provider/runtime-specific desired payload, never null after construction
/// @param meta safe annotations, never null after construction
public record ResourceSpec(ResourceRef ref, OpaquePayload data, Map<String, String> meta) {

    public ResourceSpec {
        Objects.requireNonNull(ref, "ref must not be null");
        data = data != null ? data : OpaquePayload.NULL;
        meta = Immutables.copyOf(meta);
    }
}
