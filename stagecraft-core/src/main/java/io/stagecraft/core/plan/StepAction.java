package io.stagecraft.core.plan;

import io.stagecraft.core.util.WireEnum;

/// Operation a {@link PlanStep} performs.
///
/// The first group is provider-neutral resource lifecycle; the second covers the
/// compose-based deployment pipeline. Wire spellings are part of the plan schema.
public enum StepAction implements WireEnum {
    /// Creates a resource.
    CREATE("create"),
    /// Updates a resource.
    UPDATE("update"),
    /// Deletes a resource.
    DELETE("delete"),
    /// Performs no operation.
    NOOP("noop"),

    /// Renders compose artifacts for deployment.
    RENDER_COMPOSE("render_compose"),
    /// Applies a rendered compose file.
    APPLY_COMPOSE("apply_compose"),
    /// Performs a rollout deployment.
    ROLLOUT("rollout"),

    /// Builds container images.
    BUILD("build"),
    /// Runs database migrations.
    MIGRATE("migrate"),
    /// Checks service health.
    HEALTH_CHECK("health_check");

    private final String wireValue;

    StepAction(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
