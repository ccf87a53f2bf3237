package io.stagecraft.core.util;

import java.util.Optional;

/// Enumerations with a stable, lower-case wire spelling.
///
/// The wire value is part of the cross-process contract and never changes with a
/// constant rename. Serializers write {@link #wireValue()}; decoders resolve with
/// {@link #fromWire(Class, String)} and treat an empty result as a decode error.
public interface WireEnum {

    /// Returns the value written to and read from the wire.
    ///
    /// @return wire spelling, never null
    String wireValue();

    /// Resolves a wire spelling to its constant.
    ///
    /// @param type enum class, not null
    /// @param wireValue spelling to resolve, may be null
    /// @param <E> enum type
    /// @return the matching constant, or empty when none matches
    static <E extends Enum<E> & WireEnum> Optional<E> fromWire(Class<E> type, String wireValue) {
        if (wireValue == null) {
            return Optional.empty();
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.wireValue().equals(wireValue)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
