package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/// Wire layout of `HostPlanStep`; same rules as {@link PlanStepMixin} without `host`.
@JsonPropertyOrder({"id", "index", "action", "target", "inputs", "dependsOn", "meta"})
public abstract class HostPlanStepMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract List<String> dependsOn();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract Map<String, String> meta();
}
