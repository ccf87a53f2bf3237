package io.stagecraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/// Wire layout of `Plan`.
@JsonPropertyOrder({"version", "id", "summary", "steps", "meta"})
public abstract class PlanMixin {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract String summary();

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    abstract Map<String, String> meta();
}
