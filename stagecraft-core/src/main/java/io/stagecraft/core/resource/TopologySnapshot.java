package io.stagecraft.core.resource;

import io.stagecraft.core.util.Immutables;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/// Desired state handed to a planner.
///
/// Resource order is significant: a plan's identifier is derived from snapshot
/// content, so planners must receive (or produce) resources in a deterministic
/// order. {@link #sorted()} yields the canonical kind-then-name order.
///
/// @param version   snapshot schema version, never null after construction
/// @param meta      small stable annotations, never null after construction
/// @param resources provider-neutral desired resources, never null after construction
public record TopologySnapshot(
        String version, Map<String, String> meta, List<ResourceSpec> resources) {

    /// Current topology snapshot schema version.
    public static final String SCHEMA_VERSION = "v1";

    public TopologySnapshot {
        version = Immutables.orEmpty(version);
        meta = Immutables.copyOf(meta);
        resources = Immutables.copyOf(resources);
    }

    /// Creates a current-version snapshot without annotations.
    ///
    /// @param resources desired resources, may be null
    /// @return new snapshot, never null
    public static TopologySnapshot of(List<ResourceSpec> resources) {
        return new TopologySnapshot(SCHEMA_VERSION, Map.of(), resources);
    }

    /// Returns a copy whose resources are ordered by kind, then name.
    ///
    /// @return sorted snapshot, never null
    public TopologySnapshot sorted() {
        List<ResourceSpec> ordered = new ArrayList<>(resources);
        ordered.sort(Comparator.comparing(ResourceSpec::ref, ResourceRef.KIND_THEN_NAME));
        return new TopologySnapshot(version, meta, ordered);
    }
}
