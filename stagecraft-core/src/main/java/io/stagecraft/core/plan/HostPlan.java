package io.stagecraft.core.plan;

import io.stagecraft.core.util.Immutables;
import java.util.List;
import java.util.Map;

/// The portable, self-contained sub-plan dispatched to one host.
///
/// An agent receiving a host plan needs no global topology or state and no view of
/// other hosts: every {@link HostPlanStep#dependsOn()} entry resolves inside
/// {@link #steps()}. Dependencies on global steps are not part of the host plan; the
/// controller tracks them through {@link SliceResult#globalDependencyRefs()}.
///
/// @param version schema version, never null after construction
/// @param planId  identifier of the plan this was sliced from
/// @param host    the execution target; an empty logical id is rejected by agents
/// @param steps   steps in canonical order, never null after construction
/// @param meta    annotations, never null after construction
public record HostPlan(
        String version,
        String planId,
        HostRef host,
        List<HostPlanStep> steps,
        Map<String, String> meta) {

    /// Host plan schema version; treat as wire contract.
    public static final String SCHEMA_VERSION = "v1";

    public HostPlan {
        version = Immutables.orEmpty(version);
        planId = Immutables.orEmpty(planId);
        host = host != null ? host : HostRef.global();
        steps = Immutables.copyOf(steps);
        meta = Immutables.copyOf(meta);
    }
}
