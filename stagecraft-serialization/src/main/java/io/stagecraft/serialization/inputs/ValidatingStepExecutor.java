package io.stagecraft.serialization.inputs;

import io.stagecraft.core.agent.StepExecutionException;
import io.stagecraft.core.agent.StepExecutor;
import io.stagecraft.core.plan.HostPlanStep;
import io.stagecraft.core.plan.HostRef;
import io.stagecraft.core.plan.StepAction;
import io.stagecraft.serialization.PlanDecodeException;
import io.stagecraft.serialization.StrictPlanCodec;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// {@link StepExecutor} that strictly decodes and validates a step's typed inputs and
/// performs nothing else.
///
/// Lets a host plan run end to end (slice, encode, decode, execute, report) without
/// touching Docker, databases or the network. Actions without a typed input schema
/// (`create`, `update`, `delete`, `noop`) pass unchecked.
///
/// @implNote Stateless and thread-safe.
public class ValidatingStepExecutor implements StepExecutor {

    private static final Logger logger = Logger.getLogger(ValidatingStepExecutor.class.getName());

    private static final Map<StepAction, Class<? extends StepInputs<?>>> SCHEMAS =
            new EnumMap<>(StepAction.class);

    static {
        SCHEMAS.put(StepAction.BUILD, BuildInputs.class);
        SCHEMAS.put(StepAction.MIGRATE, MigrateInputs.class);
        SCHEMAS.put(StepAction.APPLY_COMPOSE, ApplyComposeInputs.class);
        SCHEMAS.put(StepAction.HEALTH_CHECK, HealthCheckInputs.class);
        SCHEMAS.put(StepAction.RENDER_COMPOSE, RenderComposeInputs.class);
        SCHEMAS.put(StepAction.ROLLOUT, RolloutInputs.class);
    }

    private final StrictPlanCodec codec;

    public ValidatingStepExecutor(StrictPlanCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /// Returns the typed input schema of an action.
    ///
    /// @param action step action, not null
    /// @return the inputs record type, or empty for actions without a schema
    public static Optional<Class<? extends StepInputs<?>>> schemaFor(StepAction action) {
        return Optional.ofNullable(SCHEMAS.get(action));
    }

    @Override
    public void execute(HostPlanStep step, HostRef host) throws StepExecutionException {
        Class<? extends StepInputs<?>> schema = SCHEMAS.get(step.action());
        if (schema == null) {
            logger.fine("No input schema for action " + step.action() + ", step " + step.id() + " passes");
            return;
        }

        String action = step.action().wireValue();
        StepInputs<?> inputs;
        try {
            inputs = codec.decodeStrict(step.inputs().bytes(), schema);
        } catch (PlanDecodeException e) {
            throw new StepExecutionException("invalid " + action + " inputs: " + e.getMessage(), e);
        }
        try {
            inputs.validate();
        } catch (InputsValidationException e) {
            throw new StepExecutionException(
                    action + " inputs validation failed: " + e.getMessage(), e);
        }
        logger.info(
                "Step " + step.id() + " on " + host.logicalId() + ": " + action + " inputs valid");
    }
}
