package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/// Wire layout of `SliceResult`: only `hostPlans` is always written.
@JsonPropertyOrder({"hostPlans", "globalSteps", "globalStepIds", "globalDependencyRefs"})
public abstract class SliceResultMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract List<?> globalSteps();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract List<String> globalStepIds();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract Map<String, List<String>> globalDependencyRefs();
}
