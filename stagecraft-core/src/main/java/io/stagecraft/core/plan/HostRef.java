package io.stagecraft.core.plan;

import io.stagecraft.core.util.Immutables;
import java.util.Map;

/// Identifies the execution target of a step.
///
/// An empty {@code logicalId} marks a step as global: it has no host affinity
/// and is sequenced by the controller/CLI instead of being sliced into a
/// {@link HostPlan}.
///
/// @param logicalId stable logical host identifier, empty for global steps
/// @param labels    free-form host labels, never null after construction
public record HostRef(String logicalId, Map<String, String> labels) {

    public HostRef {
        logicalId = Immutables.orEmpty(logicalId);
        labels = Immutables.copyOf(labels);
    }

    /// Creates a host reference without labels.
    ///
    /// @param logicalId host identifier, may be empty
    /// @return new reference, never null
    public static HostRef of(String logicalId) {
        return new HostRef(logicalId, Map.of());
    }

    /// Returns the reference used by global steps.
    ///
    /// @return reference with an empty logical id, never null
    public static HostRef global() {
        return new HostRef("", Map.of());
    }

    /// Returns whether this reference names a concrete host.
    ///
    /// @return false for global steps
    public boolean hasLogicalId() {
        return !logicalId.isEmpty();
    }
}
