package io.stagecraft.serialization.inputs;

import static io.stagecraft.serialization.inputs.InputsNormalizer.requireNonEmpty;
import static io.stagecraft.serialization.inputs.InputsNormalizer.trim;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.stagecraft.core.util.Immutables;
import java.util.List;

/// Inputs of an `apply_compose` step.
///
/// {@code pull} and {@code detach} are tri-state on the wire: a producer must set them
/// explicitly, so `null` fails validation.
@JsonPropertyOrder({
    "environment",
    "compose_path",
    "project_name",
    "pull",
    "detach",
    "services",
    "expected_compose_hash_alg",
    "expected_compose_hash"
})
public record ApplyComposeInputs(
        String environment,
        @JsonProperty("compose_path") String composePath,
        @JsonProperty("project_name") String projectName,
        Boolean pull,
        Boolean detach,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> services,
        @JsonProperty("expected_compose_hash_alg") @JsonInclude(JsonInclude.Include.NON_EMPTY)
                String expectedComposeHashAlg,
        @JsonProperty("expected_compose_hash") @JsonInclude(JsonInclude.Include.NON_EMPTY)
                String expectedComposeHash)
        implements StepInputs<ApplyComposeInputs> {

    public ApplyComposeInputs {
        environment = Immutables.orEmpty(environment);
        composePath = Immutables.orEmpty(composePath);
        projectName = Immutables.orEmpty(projectName);
        services = Immutables.copyOf(services);
        expectedComposeHashAlg = Immutables.orEmpty(expectedComposeHashAlg);
        expectedComposeHash = Immutables.orEmpty(expectedComposeHash);
    }

    @Override
    public ApplyComposeInputs normalize() throws InputsValidationException {
        return new ApplyComposeInputs(
                trim(environment),
                InputsNormalizer.normalizePath(composePath, "compose_path"),
                trim(projectName),
                pull,
                detach,
                InputsNormalizer.trimAndSort(services),
                trim(expectedComposeHashAlg),
                trim(expectedComposeHash));
    }

    @Override
    public void validate() throws InputsValidationException {
        requireNonEmpty(environment, "environment is required");
        requireNonEmpty(composePath, "compose_path is required");
        requireNonEmpty(projectName, "project_name is required");
        if (pull == null) {
            throw new InputsValidationException("pull is required (producer must set explicitly)");
        }
        if (detach == null) {
            throw new InputsValidationException("detach is required (producer must set explicitly)");
        }
        InputsNormalizer.requireNoBlankEntries(services, "services");
        InputsNormalizer.validateExpectedHash(expectedComposeHashAlg, expectedComposeHash);
    }
}
