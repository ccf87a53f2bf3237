package io.stagecraft.core.resource;

import io.stagecraft.core.util.Immutables;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/// Observed runtime state, as reported by a state inspector.
///
/// Same ordering rules as {@link TopologySnapshot}.
///
/// @param version   snapshot schema version, never null after construction
/// @param meta      annotations, never null after construction
/// @param resources observed resources, never null after construction
public record StateSnapshot(
        String version, Map<String, String> meta, List<ResourceState> resources) {

    /// Current state snapshot schema version.
    public static final String SCHEMA_VERSION = "v1";

    public StateSnapshot {
        version = Immutables.orEmpty(version);
        meta = Immutables.copyOf(meta);
        resources = Immutables.copyOf(resources);
    }

    /// Creates a current-version snapshot without annotations.
    ///
    /// @param resources observed resources, may be null
    /// @return new snapshot, never null
    public static StateSnapshot of(List<ResourceState> resources) {
        return new StateSnapshot(SCHEMA_VERSION, Map.of(), resources);
    }

    /// Returns an empty current-version snapshot.
    ///
    /// @return snapshot with no resources, never null
    public static StateSnapshot empty() {
        return of(List.of());
    }

    /// Returns a copy whose resources are ordered by kind, then name.
    ///
    /// @return sorted snapshot, never null
    public StateSnapshot sorted() {
        List<ResourceState> ordered = new ArrayList<>(resources);
        ordered.sort(Comparator.comparing(ResourceState::ref, ResourceRef.KIND_THEN_NAME));
        return new StateSnapshot(version, meta, ordered);
    }
}
