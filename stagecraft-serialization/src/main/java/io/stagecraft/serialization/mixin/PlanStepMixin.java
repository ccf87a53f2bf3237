package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/// Wire layout of `PlanStep`.
///
/// `inputs` is always written; a step without inputs carries `"inputs":null`.
@JsonPropertyOrder({"id", "index", "action", "target", "host", "inputs", "dependsOn", "meta"})
public abstract class PlanStepMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract List<String> dependsOn();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract Map<String, String> meta();
}
