package io.stagecraft.core.engine;

import io.stagecraft.core.plan.HostRef;
import io.stagecraft.core.util.Immutables;
import java.util.Objects;

/// Input of {@link Engine#inspectState(InspectStateRequest)}.
///
/// @param host    host to inspect, not null
/// @param runtime runtime name the inspector is registered under (e.g. `compose`)
public record InspectStateRequest(HostRef host, String runtime) {

    public InspectStateRequest {
        Objects.requireNonNull(host, "host must not be null");
        runtime = Immutables.orEmpty(runtime);
    }
}
