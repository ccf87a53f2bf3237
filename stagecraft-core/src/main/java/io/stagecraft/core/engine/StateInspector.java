package io.stagecraft.core.engine;

import io.stagecraft.core.plan.HostRef;
import io.stagecraft.core.resource.StateSnapshot;

/// Reads the observed state of a host for one runtime.
@FunctionalInterface
public interface StateInspector {

    /// @param host    host to inspect, not null
    /// @param runtime runtime name, not null
    /// @return observed state, never null
    /// @throws EngineException if inspection fails
    StateSnapshot inspect(HostRef host, String runtime) throws EngineException;
}
