package io.stagecraft.serialization.inputs;

import static io.stagecraft.serialization.inputs.InputsNormalizer.requireNonEmpty;
import static io.stagecraft.serialization.inputs.InputsNormalizer.trim;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.stagecraft.core.util.Immutables;
import java.util.List;

/// Inputs of a `migrate` step.
///
/// {@code args} is passed to the migration engine in the given order and is never sorted.
@JsonPropertyOrder({
    "database", "strategy", "engine", "path", "conn_env", "timeout_seconds", "args"
})
public record MigrateInputs(
        String database,
        String strategy,
        String engine,
        String path,
        @JsonProperty("conn_env") String connEnv,
        @JsonProperty("timeout_seconds") @JsonInclude(JsonInclude.Include.NON_NULL)
                Integer timeoutSeconds,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> args)
        implements StepInputs<MigrateInputs> {

    public MigrateInputs {
        database = Immutables.orEmpty(database);
        strategy = Immutables.orEmpty(strategy);
        engine = Immutables.orEmpty(engine);
        path = Immutables.orEmpty(path);
        connEnv = Immutables.orEmpty(connEnv);
        args = Immutables.copyOf(args);
    }

    @Override
    public MigrateInputs normalize() throws InputsValidationException {
        return new MigrateInputs(
                trim(database),
                trim(strategy),
                trim(engine),
                InputsNormalizer.normalizePath(path, "path"),
                trim(connEnv),
                timeoutSeconds,
                InputsNormalizer.trimAll(args));
    }

    @Override
    public void validate() throws InputsValidationException {
        requireNonEmpty(database, "database is required");
        requireNonEmpty(strategy, "strategy is required");
        requireNonEmpty(engine, "engine is required");
        requireNonEmpty(path, "path is required");
        requireNonEmpty(connEnv, "conn_env is required");
        InputsNormalizer.requirePositiveIfPresent(timeoutSeconds, "timeout_seconds");
    }
}
