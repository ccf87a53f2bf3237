package io.stagecraft.core.agent;

import io.stagecraft.core.engine.HostPlanExecutor;
import io.stagecraft.core.plan.HostPlan;
import io.stagecraft.core.plan.HostPlanStep;
import io.stagecraft.core.plan.HostRef;
import io.stagecraft.core.report.ExecutionError;
import io.stagecraft.core.report.ExecutionReport;
import io.stagecraft.core.report.ExecutionStatus;
import io.stagecraft.core.report.StepExecution;
import io.stagecraft.core.report.StepStatus;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Executes a {@link HostPlan} step by step on the host it targets.
///
/// ### Execution Flow
/// For each step, in the host plan's canonical order:
/// - Every local dependency must already have completed, otherwise an
///   {@link AgentExecutionException} is thrown and no report is produced
/// - No executor registered for the action: the step is skipped with
///   {@link ExecutionError#NO_EXECUTOR} and the report becomes `partial`
/// - The executor throws: the step fails with {@link ExecutionError#EXECUTION_ERROR},
///   the report becomes `failed` and the remaining steps are not reported
/// - Otherwise the step succeeds
///
/// A skipped step counts as completed for the steps that depend on it.
///
/// @implNote Thread-safe for observer registration. Concurrent {@link #execute} calls
/// are safe as long as the registered executors are.
/// @see StepExecutorRegistry for executor lookup
public class HostPlanAgent implements HostPlanExecutor {

    private static final Logger logger = Logger.getLogger(HostPlanAgent.class.getName());

    private final StepExecutorRegistry registry;
    private final Clock clock;
    private final List<ExecutionObserver> observers = new CopyOnWriteArrayList<>();

    /// Creates an agent using the system UTC clock.
    ///
    /// @param registry executors by action, not null
    public HostPlanAgent(StepExecutorRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    /// Creates an agent.
    ///
    /// @param registry executors by action, not null
    /// @param clock    source of step timestamps, not null
    public HostPlanAgent(StepExecutorRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Registers an observer; duplicates are allowed.
    ///
    /// @param observer the observer, not null
    public void addObserver(ExecutionObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer must not be null"));
    }

    @Override
    public ExecutionReport execute(HostPlan hostPlan) throws AgentExecutionException {
        Objects.requireNonNull(hostPlan, "hostPlan must not be null");
        HostRef host = hostPlan.host();
        List<HostPlanStep> steps = new ArrayList<>(hostPlan.steps());
        steps.sort(HostPlanStep.CANONICAL_ORDER);

        ExecutionStatus status = ExecutionStatus.SUCCEEDED;
        List<StepExecution> records = new ArrayList<>(steps.size());
        Set<String> completed = new HashSet<>();

        for (HostPlanStep step : steps) {
            for (String dep : step.dependsOn()) {
                if (!completed.contains(dep)) {
                    throw new AgentExecutionException(
                            "step \"" + step.id() + "\" depends on \"" + dep + "\" which has not completed");
                }
            }

            StepExecution record = runStep(hostPlan.planId(), step, host);
            if (record.status() == StepStatus.FAILED) {
                status = ExecutionStatus.FAILED;
            } else if (record.status() == StepStatus.SKIPPED) {
                status = status.combine(ExecutionStatus.PARTIAL);
            }

            completed.add(step.id());
            records.add(record);
            notifyCompleted(hostPlan.planId(), record);

            if (record.status() == StepStatus.FAILED) {
                logger.warning(
                        "Step " + step.id() + " failed on host " + host.logicalId() + ", stopping");
                break;
            }
        }

        return ExecutionReport.of(hostPlan.planId(), status, records);
    }

    private StepExecution runStep(String planId, HostPlanStep step, HostRef host) {
        StepExecutor executor = registry.getExecutor(step.action()).orElse(null);
        if (executor == null) {
            logger.warning("No executor registered for action " + step.action() + ", skipping " + step.id());
            return StepExecution.skipped(
                    step.id(),
                    host,
                    new ExecutionError(
                            ExecutionError.NO_EXECUTOR,
                            "no executor registered for action \"" + step.action().wireValue() + "\""));
        }

        notifyStarted(planId, step);
        String startedAt = now();
        logger.fine("Executing step " + step.id() + " (" + step.action() + ")");
        try {
            executor.execute(step, host);
            return StepExecution.succeeded(step.id(), host, startedAt, now());
        } catch (StepExecutionException e) {
            return StepExecution.failed(
                    step.id(),
                    host,
                    startedAt,
                    now(),
                    new ExecutionError(ExecutionError.EXECUTION_ERROR, e.getMessage()));
        }
    }

    private String now() {
        return DateTimeFormatter.ISO_INSTANT.format(clock.instant());
    }

    private void notifyStarted(String planId, HostPlanStep step) {
        for (ExecutionObserver observer : observers) {
            try {
                observer.onStepStarted(planId, step);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Execution observer failed on step start", e);
            }
        }
    }

    private void notifyCompleted(String planId, StepExecution execution) {
        for (ExecutionObserver observer : observers) {
            try {
                observer.onStepCompleted(planId, execution);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Execution observer failed on step completion", e);
            }
        }
    }
}
