package io.stagecraft.serialization.inputs;

import static io.stagecraft.serialization.inputs.InputsNormalizer.normalizePath;
import static io.stagecraft.serialization.inputs.InputsNormalizer.requireNoBlankEntries;
import static io.stagecraft.serialization.inputs.InputsNormalizer.requireNonEmpty;
import static io.stagecraft.serialization.inputs.InputsNormalizer.trim;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.stagecraft.core.util.Immutables;
import java.util.ArrayList;
import java.util.List;

/// Inputs of a `build` step.
///
/// @param provider   build provider id, required
/// @param workdir    relative working directory, required
/// @param target     optional build target stage
/// @param dockerfile relative Dockerfile path, required (no implicit default)
/// @param context    relative build context, required (no implicit default)
/// @param tags       image tags, sorted
/// @param buildArgs  build arguments, sorted by key
/// @param labels     image labels, sorted by key
@JsonPropertyOrder({
    "provider", "workdir", "target", "dockerfile", "context", "tags", "build_args", "labels"
})
public record BuildInputs(
        String provider,
        String workdir,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) String target,
        String dockerfile,
        String context,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> tags,
        @JsonProperty("build_args") @JsonInclude(JsonInclude.Include.NON_EMPTY)
                List<KeyValue> buildArgs,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<KeyValue> labels)
        implements StepInputs<BuildInputs> {

    public BuildInputs {
        provider = Immutables.orEmpty(provider);
        workdir = Immutables.orEmpty(workdir);
        target = Immutables.orEmpty(target);
        dockerfile = Immutables.orEmpty(dockerfile);
        context = Immutables.orEmpty(context);
        tags = Immutables.copyOf(tags);
        buildArgs = Immutables.copyOf(buildArgs);
        labels = Immutables.copyOf(labels);
    }

    @Override
    public BuildInputs normalize() throws InputsValidationException {
        String normalizedWorkdir = trim(workdir);
        String normalizedDockerfile = trim(dockerfile);
        String normalizedContext = trim(context);
        if (!normalizedWorkdir.isEmpty()) {
            normalizedWorkdir = normalizePath(normalizedWorkdir, "workdir");
        }
        if (!normalizedDockerfile.isEmpty()) {
            normalizedDockerfile = normalizePath(normalizedDockerfile, "dockerfile");
        }
        if (!normalizedContext.isEmpty()) {
            normalizedContext = normalizePath(normalizedContext, "context");
        }
        return new BuildInputs(
                trim(provider),
                normalizedWorkdir,
                trim(target),
                normalizedDockerfile,
                normalizedContext,
                InputsNormalizer.trimAndSort(tags),
                normalizeEntries(buildArgs),
                normalizeEntries(labels));
    }

    @Override
    public void validate() throws InputsValidationException {
        requireNonEmpty(provider, "provider is required");
        requireNonEmpty(workdir, "workdir is required");
        requireNonEmpty(dockerfile, "dockerfile is required (producer must set explicitly)");
        requireNonEmpty(context, "context is required (producer must set explicitly)");
        requireNoBlankEntries(tags, "tags");
        for (KeyValue arg : buildArgs) {
            requireNonEmpty(arg.key(), "build_args.key is required");
        }
        for (KeyValue label : labels) {
            requireNonEmpty(label.key(), "labels.key is required");
        }
    }

    private static List<KeyValue> normalizeEntries(List<KeyValue> entries) {
        List<KeyValue> trimmed = new ArrayList<>(entries.size());
        for (KeyValue entry : entries) {
            trimmed.add(entry.trimmed());
        }
        return InputsNormalizer.sortByKey(trimmed, KeyValue::key);
    }
}
