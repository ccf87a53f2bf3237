package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/// Wire layout of `HostPlan`.
@JsonPropertyOrder({"version", "planId", "host", "steps", "meta"})
public abstract class HostPlanMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract Map<String, String> meta();
}
