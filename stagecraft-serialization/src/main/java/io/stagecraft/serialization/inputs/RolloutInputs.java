package io.stagecraft.serialization.inputs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.stagecraft.core.util.Immutables;
import java.util.List;

/// Inputs of a `rollout` step.
@JsonPropertyOrder({"mode", "batch_size", "targets"})
public record RolloutInputs(
        String mode,
        @JsonProperty("batch_size") @JsonInclude(JsonInclude.Include.NON_NULL) Integer batchSize,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> targets)
        implements StepInputs<RolloutInputs> {

    public RolloutInputs {
        mode = Immutables.orEmpty(mode);
        targets = Immutables.copyOf(targets);
    }

    @Override
    public RolloutInputs normalize() {
        return new RolloutInputs(
                InputsNormalizer.trim(mode), batchSize, InputsNormalizer.trimAndSort(targets));
    }

    @Override
    public void validate() throws InputsValidationException {
        InputsNormalizer.requireNonEmpty(mode, "mode is required");
        InputsNormalizer.requirePositiveIfPresent(batchSize, "batch_size");
        InputsNormalizer.requireNoBlankEntries(targets, "targets");
    }
}
