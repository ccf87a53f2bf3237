package io.stagecraft.core.engine;

import io.stagecraft.core.plan.Plan;
import io.stagecraft.core.resource.StateSnapshot;
import io.stagecraft.core.resource.TopologySnapshot;

/// Computes a {@link Plan} from desired and observed state.
@FunctionalInterface
public interface Planner {

    /// @param topology desired topology, not null
    /// @param state    observed state, not null
    /// @param options  planning options, not null
    /// @return the plan, never null
    /// @throws EngineException if no plan can be produced
    Plan plan(TopologySnapshot topology, StateSnapshot state, PlanOptions options)
            throws EngineException;
}
