package io.stagecraft.core.plan;

import io.stagecraft.core.resource.OpaquePayload;
import io.stagecraft.core.resource.ResourceRef;
import io.stagecraft.core.util.Immutables;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A single operation within a {@link Plan}.
///
/// ### Contracts
/// - {@code id} is unique within its plan
/// - {@code index} is the total creation order across the full plan
/// - {@code dependsOn} lists step IDs of the same plan, in producer order
/// - {@code inputs} is owned by the producing provider; nothing in the core reads it
///
/// @param id        stable step identifier, never null after construction
/// @param index     total order across the plan
/// @param action    operation to perform, not null
/// @param target    resource the step acts on, never null after construction
/// @param host      execution target; empty logical id for global steps
/// @param inputs    opaque provider payload, never null after construction
/// @param dependsOn IDs of steps that must complete first, never null after construction
/// @param meta      annotations, never null after construction
/// @see HostPlanStep for the sliced, host-local form
public record PlanStep(
        String id,
        int index,
        StepAction action,
        ResourceRef target,
        HostRef host,
        OpaquePayload inputs,
        List<String> dependsOn,
        Map<String, String> meta) {

    /// The canonical step order: {@code index}, then {@code id}, both ascending.
    public static final Comparator<PlanStep> CANONICAL_ORDER =
            Comparator.comparingInt(PlanStep::index).thenComparing(PlanStep::id);

    public PlanStep {
        id = Immutables.orEmpty(id);
        Objects.requireNonNull(action, "action must not be null");
        target = target != null ? target : ResourceRef.none();
        host = host != null ? host : HostRef.global();
        inputs = inputs != null ? inputs : OpaquePayload.NULL;
        dependsOn = Immutables.copyOf(dependsOn);
        meta = Immutables.copyOf(meta);
    }

    /// Starts a builder for a step with the given id, index and action.
    ///
    /// @param id step identifier
    /// @param index total plan order
    /// @param action operation to perform
    /// @return new builder, never null
    public static Builder builder(String id, int index, StepAction action) {
        return new Builder(id, index, action);
    }

    /// Returns whether this step has no host affinity.
    ///
    /// @return true when {@code host.logicalId} is empty
    public boolean global() {
        return !host.hasLogicalId();
    }

    /// Fluent builder; keeps test and planner code readable when most fields are defaults.
    public static final class Builder {
        private final String id;
        private final int index;
        private final StepAction action;
        private ResourceRef target;
        private HostRef host;
        private OpaquePayload inputs;
        private List<String> dependsOn = List.of();
        private Map<String, String> meta = Map.of();

        private Builder(String id, int index, StepAction action) {
            this.id = id;
            this.index = index;
            this.action = action;
        }

        public Builder target(ResourceRef target) {
            this.target = target;
            return this;
        }

        public Builder host(HostRef host) {
            this.host = host;
            return this;
        }

        public Builder host(String logicalId) {
            this.host = HostRef.of(logicalId);
            return this;
        }

        public Builder inputs(OpaquePayload inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder inputs(String json) {
            this.inputs = OpaquePayload.of(json);
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            this.dependsOn = List.of(stepIds);
            return this;
        }

        public Builder dependsOn(List<String> stepIds) {
            this.dependsOn = stepIds;
            return this;
        }

        public Builder meta(Map<String, String> meta) {
            this.meta = meta;
            return this;
        }

        public PlanStep build() {
            return new PlanStep(id, index, action, target, host, inputs, dependsOn, meta);
        }
    }
}
