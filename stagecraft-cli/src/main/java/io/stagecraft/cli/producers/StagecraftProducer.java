package io.stagecraft.cli.producers;

import io.stagecraft.cli.execution.StepProgressPrinter;
import io.stagecraft.core.agent.DefaultStepExecutorRegistry;
import io.stagecraft.core.agent.HostPlanAgent;
import io.stagecraft.core.plan.PlanSlicer;
import io.stagecraft.serialization.StrictPlanCodec;
import io.stagecraft.serialization.inputs.ValidatingStepExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// CDI producer for the codec, slicer and local host-plan agent used by the commands.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `stagecraft.agent.progress` | Boolean | `true` | Print per-step progress to stderr |
///
/// @implNote Produced beans are `@Singleton` because the codec and slicer are final
/// classes and cannot be proxied. All of them are thread-safe.
@ApplicationScoped
public class StagecraftProducer {

    private static final Logger logger = Logger.getLogger(StagecraftProducer.class.getName());

    @Inject
    @ConfigProperty(name = "stagecraft.agent.progress", defaultValue = "true")
    boolean printProgress;

    @Produces
    @Singleton
    public StrictPlanCodec strictPlanCodec() {
        return new StrictPlanCodec();
    }

    @Produces
    @Singleton
    public PlanSlicer planSlicer() {
        return new PlanSlicer();
    }

    /// Produces an agent whose every action is handled by a {@link ValidatingStepExecutor}:
    /// inputs are strictly decoded and validated, nothing is deployed.
    ///
    /// @param codec codec used to decode step inputs, not null
    /// @return configured agent, never null
    @Produces
    @Singleton
    public HostPlanAgent hostPlanAgent(StrictPlanCodec codec) {
        DefaultStepExecutorRegistry registry = new DefaultStepExecutorRegistry();
        registry.registerForAllActions(new ValidatingStepExecutor(codec));

        HostPlanAgent agent = new HostPlanAgent(registry);
        if (printProgress) {
            agent.addObserver(new StepProgressPrinter(System.err));
        }
        logger.info("Configured HostPlanAgent with ValidatingStepExecutor for all actions");
        return agent;
    }
}
