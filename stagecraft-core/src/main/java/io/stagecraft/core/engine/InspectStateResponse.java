package io.stagecraft.core.engine;

import io.stagecraft.core.resource.StateSnapshot;
import java.util.Objects;

/// Output of {@link Engine#inspectState(InspectStateRequest)}.
///
/// @param state observed state, not null
public record InspectStateResponse(StateSnapshot state) {

    public InspectStateResponse {
        Objects.requireNonNull(state, "state must not be null");
    }
}
