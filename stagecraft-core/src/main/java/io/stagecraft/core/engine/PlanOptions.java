package io.stagecraft.core.engine;

/// Planning knobs. Reserved; currently carries no settings.
public record PlanOptions() {

    private static final PlanOptions DEFAULTS = new PlanOptions();

    public static PlanOptions defaults() {
        return DEFAULTS;
    }
}
