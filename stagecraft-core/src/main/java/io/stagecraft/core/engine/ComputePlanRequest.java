package io.stagecraft.core.engine;

import io.stagecraft.core.resource.StateSnapshot;
import io.stagecraft.core.resource.TopologySnapshot;
import java.util.Objects;

/// Input of {@link Engine#computePlan(ComputePlanRequest)}.
///
/// @param topology desired topology, not null
/// @param state    observed state, defaults to an empty snapshot
/// @param options  planning options, defaults to {@link PlanOptions#defaults()}
public record ComputePlanRequest(
        TopologySnapshot topology, StateSnapshot state, PlanOptions options) {

    public ComputePlanRequest {
        Objects.requireNonNull(topology, "topology must not be null");
        state = state != null ? state : StateSnapshot.empty();
        options = options != null ? options : PlanOptions.defaults();
    }
}
