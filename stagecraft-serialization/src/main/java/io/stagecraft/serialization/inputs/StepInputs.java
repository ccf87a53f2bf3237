package io.stagecraft.serialization.inputs;

/// Typed, strictly-decoded inputs of one step action.
///
/// ### Contracts
/// - Producers call {@link #normalize()}, then {@link #validate()}, then encode
/// - Consumers strict-decode, then call {@link #validate()}; they do not normalise
///
/// @param <T> the implementing record
public interface StepInputs<T extends StepInputs<T>> {

    /// Returns a canonical copy: strings trimmed, set-like lists sorted, paths normalised.
    ///
    /// @return normalised copy, never null
    /// @throws InputsValidationException if a path cannot be normalised
    T normalize() throws InputsValidationException;

    /// Checks required fields and value constraints.
    ///
    /// @throws InputsValidationException on the first violated rule
    void validate() throws InputsValidationException;
}
