package io.stagecraft.serialization.inputs;

import static io.stagecraft.serialization.inputs.InputsNormalizer.requireNonEmpty;
import static io.stagecraft.serialization.inputs.InputsNormalizer.trim;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.stagecraft.core.util.Immutables;
import java.util.ArrayList;
import java.util.List;

/// Inputs of a `render_compose` step: exactly one of {@code baseComposePath} or
/// {@code baseComposeInline}.
@JsonPropertyOrder({
    "environment",
    "base_compose_path",
    "base_compose_inline",
    "overlays",
    "variables",
    "output_path",
    "expected_compose_hash_alg",
    "expected_compose_hash"
})
public record RenderComposeInputs(
        String environment,
        @JsonProperty("base_compose_path") @JsonInclude(JsonInclude.Include.NON_EMPTY)
                String baseComposePath,
        @JsonProperty("base_compose_inline") @JsonInclude(JsonInclude.Include.NON_EMPTY)
                String baseComposeInline,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ComposeOverlay> overlays,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<KeyValue> variables,
        @JsonProperty("output_path") String outputPath,
        @JsonProperty("expected_compose_hash_alg") @JsonInclude(JsonInclude.Include.NON_EMPTY)
                String expectedComposeHashAlg,
        @JsonProperty("expected_compose_hash") @JsonInclude(JsonInclude.Include.NON_EMPTY)
                String expectedComposeHash)
        implements StepInputs<RenderComposeInputs> {

    public RenderComposeInputs {
        environment = Immutables.orEmpty(environment);
        baseComposePath = Immutables.orEmpty(baseComposePath);
        baseComposeInline = Immutables.orEmpty(baseComposeInline);
        overlays = Immutables.copyOf(overlays);
        variables = Immutables.copyOf(variables);
        outputPath = Immutables.orEmpty(outputPath);
        expectedComposeHashAlg = Immutables.orEmpty(expectedComposeHashAlg);
        expectedComposeHash = Immutables.orEmpty(expectedComposeHash);
    }

    @Override
    public RenderComposeInputs normalize() throws InputsValidationException {
        List<ComposeOverlay> sortedOverlays =
                InputsNormalizer.sortByKey(overlays, ComposeOverlay::name);
        List<ComposeOverlay> normalizedOverlays = new ArrayList<>(sortedOverlays.size());
        for (int i = 0; i < sortedOverlays.size(); i++) {
            ComposeOverlay overlay = sortedOverlays.get(i);
            normalizedOverlays.add(
                    new ComposeOverlay(
                            trim(overlay.name()),
                            InputsNormalizer.normalizePath(
                                    overlay.path(), "overlays[" + i + "].path")));
        }

        List<KeyValue> trimmedVariables = new ArrayList<>(variables.size());
        for (KeyValue variable : variables) {
            trimmedVariables.add(variable.trimmed());
        }

        String basePath = trim(baseComposePath);
        if (!basePath.isEmpty()) {
            basePath = InputsNormalizer.normalizePath(basePath, "base_compose_path");
        }

        return new RenderComposeInputs(
                trim(environment),
                basePath,
                trim(baseComposeInline),
                normalizedOverlays,
                InputsNormalizer.sortByKey(trimmedVariables, KeyValue::key),
                InputsNormalizer.normalizePath(outputPath, "output_path"),
                trim(expectedComposeHashAlg),
                trim(expectedComposeHash));
    }

    @Override
    public void validate() throws InputsValidationException {
        requireNonEmpty(environment, "environment is required");
        requireNonEmpty(outputPath, "output_path is required");
        if (baseComposePath.isEmpty() == baseComposeInline.isEmpty()) {
            throw new InputsValidationException(
                    "exactly one of base_compose_path or base_compose_inline must be provided");
        }
        InputsNormalizer.validateExpectedHash(expectedComposeHashAlg, expectedComposeHash);
        for (ComposeOverlay overlay : overlays) {
            requireNonEmpty(overlay.name(), "overlays.name is required");
            requireNonEmpty(overlay.path(), "overlays.path is required");
        }
        for (KeyValue variable : variables) {
            requireNonEmpty(variable.key(), "variables.key is required");
        }
    }
}
