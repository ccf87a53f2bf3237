package io.stagecraft.core.plan;

import io.stagecraft.core.util.Immutables;
import java.util.List;
import java.util.Map;

/// The ordered, dependency-annotated, host-tagged list of deployment operations.
///
/// A plan is produced once by a planner and is immutable input to the
/// {@link PlanSlicer}. Its {@code id} should be derived from the planning inputs
/// (e.g. a canonical hash) so that identical inputs yield identical plans; this
/// type does not enforce how.
///
/// ### Contracts
/// - {@code version} must equal {@link #SCHEMA_VERSION} on the wire
/// - steps are emitted in a stable order; consumers rely on {@link PlanStep#index()}
///
/// @param version schema version, never null after construction
/// @param id      plan identifier, never null after construction
/// @param summary human-readable summary, empty when absent
/// @param steps   plan steps, never null after construction
/// @param meta    annotations, never null after construction
/// @see PlanSlicer for partitioning into host plans
public record Plan(
        String version, String id, String summary, List<PlanStep> steps, Map<String, String> meta) {

    /// Plan schema version; treat as wire contract.
    public static final String SCHEMA_VERSION = "v1";

    public Plan {
        version = Immutables.orEmpty(version);
        id = Immutables.orEmpty(id);
        summary = Immutables.orEmpty(summary);
        steps = Immutables.copyOf(steps);
        meta = Immutables.copyOf(meta);
    }

    /// Creates a current-version plan without summary or annotations.
    ///
    /// @param id plan identifier
    /// @param steps plan steps, may be null
    /// @return new plan, never null
    public static Plan of(String id, List<PlanStep> steps) {
        return new Plan(SCHEMA_VERSION, id, "", steps, Map.of());
    }
}
