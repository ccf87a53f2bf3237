package io.stagecraft.core.plan;

import io.stagecraft.core.resource.OpaquePayload;
import io.stagecraft.core.resource.ResourceRef;
import io.stagecraft.core.util.Immutables;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A step inside a {@link HostPlan}.
///
/// Same shape as {@link PlanStep} minus the host, which is carried once by the
/// enclosing host plan. {@code dependsOn} only names steps of the same host plan;
/// an empty list is written as an absent field.
///
/// @param id        step identifier
/// @param index     total order inherited from the source plan
/// @param action    operation to perform, not null
/// @param target    resource the step acts on
/// @param inputs    opaque provider payload
/// @param dependsOn host-local dependencies, sorted, never null after construction
/// @param meta      annotations, never null after construction
public record HostPlanStep(
        String id,
        int index,
        StepAction action,
        ResourceRef target,
        OpaquePayload inputs,
        List<String> dependsOn,
        Map<String, String> meta) {

    /// Same canonical order as {@link PlanStep#CANONICAL_ORDER}.
    public static final Comparator<HostPlanStep> CANONICAL_ORDER =
            Comparator.comparingInt(HostPlanStep::index).thenComparing(HostPlanStep::id);

    public HostPlanStep {
        id = Immutables.orEmpty(id);
        Objects.requireNonNull(action, "action must not be null");
        target = target != null ? target : ResourceRef.none();
        inputs = inputs != null ? inputs : OpaquePayload.NULL;
        dependsOn = Immutables.copyOf(dependsOn);
        meta = Immutables.copyOf(meta);
    }
}
