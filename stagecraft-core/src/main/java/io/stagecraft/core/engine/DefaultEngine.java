package io.stagecraft.core.engine;

import io.stagecraft.core.plan.HostPlan;
import io.stagecraft.core.plan.HostPlanStep;
import io.stagecraft.core.plan.HostRef;
import io.stagecraft.core.plan.Plan;
import io.stagecraft.core.plan.PlanSliceException;
import io.stagecraft.core.plan.PlanSlicer;
import io.stagecraft.core.plan.PlanStep;
import io.stagecraft.core.plan.SliceResult;
import io.stagecraft.core.report.ExecutionError;
import io.stagecraft.core.report.ExecutionReport;
import io.stagecraft.core.report.ExecutionStatus;
import io.stagecraft.core.report.StepExecution;
import io.stagecraft.core.report.StepStatus;
import io.stagecraft.core.resource.StateSnapshot;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Default {@link Engine} composed from explicitly injected collaborators.
///
/// ### Execution Flow
/// 1. Slice the plan with {@link PlanSlicer}
/// 2. Run global steps sequentially in canonical order; after the first failure the
///    remaining global steps are skipped with {@link ExecutionError#UPSTREAM_FAILED}
/// 3. Dispatch host plans in host-id order (concurrently when
///    {@link ExecOptions#maxParallel()} is greater than one)
/// 4. Merge all step records into one report: global steps first, then hosts in
///    host-id order
///
/// ### Global-dependency gate
/// A host plan is never dispatched while any global step it references did not
/// succeed. Every step of a gated host plan is reported skipped with
/// {@link ExecutionError#GLOBAL_DEPENDENCY_UNMET}.
///
/// ### Status aggregation
/// - `failed` when any step failed
/// - `partial` when a step was skipped for any reason other than dry-run or filtering
/// - `succeeded` otherwise
///
/// @implNote Thread-safe once built. Host plan executors must tolerate concurrent
/// calls when {@code maxParallel > 1}.
public final class DefaultEngine implements Engine {

    private static final Logger logger = Logger.getLogger(DefaultEngine.class.getName());

    private final Planner planner;
    private final Map<String, StateInspector> stateInspectors;
    private final HostPlanExecutor hostPlanExecutor;
    private final GlobalStepExecutor globalStepExecutor;
    private final PlanSlicer slicer;

    private DefaultEngine(Builder builder) {
        this.planner = builder.planner;
        this.stateInspectors = Map.copyOf(builder.stateInspectors);
        this.hostPlanExecutor = builder.hostPlanExecutor;
        this.globalStepExecutor = builder.globalStepExecutor;
        this.slicer = builder.slicer;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public ComputePlanResponse computePlan(ComputePlanRequest request) throws EngineException {
        Objects.requireNonNull(request, "request must not be null");
        if (planner == null) {
            throw new EngineException("no planner configured");
        }

        Plan plan = planner.plan(request.topology(), request.state(), request.options());
        if (plan == null) {
            throw new EngineException("planner returned no plan");
        }
        if (!Plan.SCHEMA_VERSION.equals(plan.version())) {
            throw new EngineException(
                    "planner returned plan version \""
                            + plan.version()
                            + "\", expected \""
                            + Plan.SCHEMA_VERSION
                            + "\"");
        }
        logger.info("Computed plan " + plan.id() + " with " + plan.steps().size() + " step(s)");
        return new ComputePlanResponse(plan);
    }

    @Override
    public ExecutePlanResponse executePlan(ExecutePlanRequest request) throws EngineException {
        Objects.requireNonNull(request, "request must not be null");
        Plan plan = request.plan();
        ExecOptions options = request.options();

        SliceResult slice;
        try {
            slice = slicer.slice(plan);
        } catch (PlanSliceException e) {
            throw new EngineException("cannot slice plan \"" + plan.id() + "\": " + e.getMessage(), e);
        }

        logger.info(
                "Executing plan "
                        + plan.id()
                        + ": "
                        + slice.globalSteps().size()
                        + " global step(s), "
                        + slice.hostPlans().size()
                        + " host plan(s)"
                        + (options.dryRun() ? " [dry-run]" : ""));

        List<StepExecution> records = new ArrayList<>();
        ExecutionStatus status = ExecutionStatus.SUCCEEDED;

        Set<String> succeededGlobals = new HashSet<>();
        records.addAll(runGlobalSteps(slice.globalSteps(), options, succeededGlobals));

        Map<String, Callable<ExecutionReport>> dispatches = new LinkedHashMap<>();
        Map<String, ExecutionReport> hostReports = new TreeMap<>();
        for (String hostId : slice.hostIds()) {
            HostPlan hostPlan = slice.hostPlans().get(hostId);
            if (options.dryRun()) {
                hostReports.put(hostId, skipAll(hostPlan, ExecutionError.DRY_RUN, "dry-run"));
                continue;
            }

            List<String> unmet = new ArrayList<>();
            for (String globalId : slice.globalDependenciesOf(hostId)) {
                if (!succeededGlobals.contains(globalId)) {
                    unmet.add(globalId);
                }
            }
            if (!unmet.isEmpty()) {
                logger.warning(
                        "Host plan " + hostId + " not dispatched, unmet global steps: " + unmet);
                hostReports.put(
                        hostId,
                        skipAll(
                                hostPlan,
                                ExecutionError.GLOBAL_DEPENDENCY_UNMET,
                                "global step(s) " + unmet + " did not succeed"));
                continue;
            }

            dispatches.put(hostId, () -> dispatch(hostPlan, options));
        }

        hostReports.putAll(runHostPlans(dispatches, options.maxParallel()));

        for (ExecutionReport hostReport : hostReports.values()) {
            status = status.combine(hostReport.status());
            records.addAll(hostReport.steps());
        }
        status = status.combine(aggregate(records));

        logger.info("Plan " + plan.id() + " finished with status " + status.wireValue());
        return new ExecutePlanResponse(ExecutionReport.of(plan.id(), status, records));
    }

    @Override
    public InspectStateResponse inspectState(InspectStateRequest request) throws EngineException {
        Objects.requireNonNull(request, "request must not be null");
        StateInspector inspector = stateInspectors.get(request.runtime());
        if (inspector == null) {
            throw new EngineException(
                    "no state inspector registered for runtime \"" + request.runtime() + "\"");
        }
        StateSnapshot state = inspector.inspect(request.host(), request.runtime());
        if (state == null) {
            throw new EngineException(
                    "state inspector for runtime \"" + request.runtime() + "\" returned no state");
        }
        return new InspectStateResponse(state);
    }

    // -----------------------------------------------------------------------
    // Global steps
    // -----------------------------------------------------------------------

    private List<StepExecution> runGlobalSteps(
            List<PlanStep> globalSteps, ExecOptions options, Set<String> succeeded)
            throws EngineException {
        List<StepExecution> records = new ArrayList<>(globalSteps.size());
        String failedStepId = null;
        for (PlanStep step : globalSteps) {
            StepExecution record;
            if (options.dryRun()) {
                record = skip(step.id(), step.host(), ExecutionError.DRY_RUN, "dry-run");
            } else if (!options.selects(step.id())) {
                record = skip(step.id(), step.host(), ExecutionError.FILTERED, "not selected");
            } else if (failedStepId != null) {
                record =
                        skip(
                                step.id(),
                                step.host(),
                                ExecutionError.UPSTREAM_FAILED,
                                "global step \"" + failedStepId + "\" failed");
            } else if (globalStepExecutor == null) {
                record =
                        skip(
                                step.id(),
                                step.host(),
                                ExecutionError.NO_EXECUTOR,
                                "no global step executor configured");
            } else {
                logger.fine("Running global step " + step.id() + " (" + step.action() + ")");
                record = globalStepExecutor.execute(step);
                if (record == null) {
                    throw new EngineException(
                            "global step executor returned no record for step \""
                                    + step.id()
                                    + "\"");
                }
            }

            if (record.status() == StepStatus.SUCCEEDED) {
                succeeded.add(step.id());
            } else if (record.status() == StepStatus.FAILED && failedStepId == null) {
                failedStepId = step.id();
                logger.warning("Global step " + step.id() + " failed");
            }
            records.add(record);
        }
        return records;
    }

    // -----------------------------------------------------------------------
    // Host plans
    // -----------------------------------------------------------------------

    private ExecutionReport dispatch(HostPlan hostPlan, ExecOptions options)
            throws EngineException {
        String hostId = hostPlan.host().logicalId();
        if (hostPlanExecutor == null) {
            throw new EngineException("no host plan executor configured");
        }

        if (options.stepFilter().isEmpty()) {
            logger.info("Dispatching host plan " + hostId + " (" + hostPlan.steps().size() + " step(s))");
            return requireReport(hostId, hostPlanExecutor.execute(hostPlan));
        }

        // Run only selected steps; dependencies on unselected steps are dropped.
        List<HostPlanStep> selected = new ArrayList<>();
        for (HostPlanStep step : hostPlan.steps()) {
            if (options.selects(step.id())) {
                List<String> deps = new ArrayList<>();
                for (String dep : step.dependsOn()) {
                    if (options.selects(dep)) {
                        deps.add(dep);
                    }
                }
                selected.add(
                        new HostPlanStep(
                                step.id(),
                                step.index(),
                                step.action(),
                                step.target(),
                                step.inputs(),
                                deps,
                                step.meta()));
            }
        }

        Map<String, StepExecution> executed = new HashMap<>();
        ExecutionStatus status = ExecutionStatus.SUCCEEDED;
        if (!selected.isEmpty()) {
            logger.info("Dispatching host plan " + hostId + " (" + selected.size() + " selected step(s))");
            ExecutionReport report =
                    requireReport(
                            hostId,
                            hostPlanExecutor.execute(
                                    new HostPlan(
                                            hostPlan.version(),
                                            hostPlan.planId(),
                                            hostPlan.host(),
                                            selected,
                                            hostPlan.meta())));
            status = report.status();
            for (StepExecution record : report.steps()) {
                executed.put(record.stepId(), record);
            }
        }

        List<StepExecution> records = new ArrayList<>();
        for (HostPlanStep step : hostPlan.steps()) {
            if (!options.selects(step.id())) {
                records.add(skip(step.id(), hostPlan.host(), ExecutionError.FILTERED, "not selected"));
            } else if (executed.containsKey(step.id())) {
                records.add(executed.get(step.id()));
            }
        }
        return ExecutionReport.of(hostPlan.planId(), status, records);
    }

    private Map<String, ExecutionReport> runHostPlans(
            Map<String, Callable<ExecutionReport>> dispatches, int maxParallel)
            throws EngineException {
        Map<String, ExecutionReport> reports = new TreeMap<>();
        int poolSize = Math.min(maxParallel, dispatches.size());
        if (poolSize <= 1) {
            for (Map.Entry<String, Callable<ExecutionReport>> entry : dispatches.entrySet()) {
                reports.put(entry.getKey(), call(entry.getValue()));
            }
            return reports;
        }

        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        try {
            Map<String, Future<ExecutionReport>> futures = new LinkedHashMap<>();
            dispatches.forEach((hostId, task) -> futures.put(hostId, pool.submit(task)));
            for (Map.Entry<String, Future<ExecutionReport>> entry : futures.entrySet()) {
                try {
                    reports.put(entry.getKey(), entry.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof EngineException engineException) {
                        throw engineException;
                    }
                    throw new EngineException(
                            "host plan " + entry.getKey() + " failed: " + cause.getMessage(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new EngineException("interrupted while executing host plans", e);
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return reports;
    }

    private static ExecutionReport call(Callable<ExecutionReport> task) throws EngineException {
        try {
            return task.call();
        } catch (EngineException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new EngineException(e.getMessage(), e);
        }
    }

    private static ExecutionReport requireReport(String hostId, ExecutionReport report)
            throws EngineException {
        if (report == null) {
            throw new EngineException("host plan executor returned no report for host " + hostId);
        }
        return report;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static ExecutionReport skipAll(HostPlan hostPlan, String code, String message) {
        List<StepExecution> records = new ArrayList<>(hostPlan.steps().size());
        for (HostPlanStep step : hostPlan.steps()) {
            records.add(skip(step.id(), hostPlan.host(), code, message));
        }
        return ExecutionReport.of(hostPlan.planId(), ExecutionStatus.SUCCEEDED, records);
    }

    private static StepExecution skip(String stepId, HostRef host, String code, String message) {
        return StepExecution.skipped(stepId, host, new ExecutionError(code, message));
    }

    static ExecutionStatus aggregate(List<StepExecution> records) {
        ExecutionStatus status = ExecutionStatus.SUCCEEDED;
        for (StepExecution record : records) {
            if (record.status() == StepStatus.FAILED) {
                return ExecutionStatus.FAILED;
            }
            if (record.status() != StepStatus.SUCCEEDED && !deliberatelySkipped(record)) {
                status = ExecutionStatus.PARTIAL;
            }
        }
        return status;
    }

    private static boolean deliberatelySkipped(StepExecution record) {
        if (record.status() != StepStatus.SKIPPED || record.error() == null) {
            return false;
        }
        String code = record.error().code();
        return ExecutionError.DRY_RUN.equals(code) || ExecutionError.FILTERED.equals(code);
    }

    /// Fluent builder for {@link DefaultEngine}.
    ///
    /// All collaborators are optional. Without a global step executor, global steps are
    /// reported skipped with {@link ExecutionError#NO_EXECUTOR}; any other operation that
    /// needs a missing collaborator, including dispatching a host plan without a
    /// {@link HostPlanExecutor}, fails with an {@link EngineException}.
    public static final class Builder {
        private Planner planner;
        private final Map<String, StateInspector> stateInspectors = new HashMap<>();
        private HostPlanExecutor hostPlanExecutor;
        private GlobalStepExecutor globalStepExecutor;
        private PlanSlicer slicer = new PlanSlicer();

        private Builder() {}

        public Builder planner(Planner planner) {
            this.planner = Objects.requireNonNull(planner, "planner must not be null");
            return this;
        }

        /// Registers the inspector used for one runtime, replacing any previous one.
        ///
        /// @param runtime   runtime name, not null
        /// @param inspector inspector, not null
        /// @return this builder for chaining
        public Builder stateInspector(String runtime, StateInspector inspector) {
            Objects.requireNonNull(runtime, "runtime must not be null");
            Objects.requireNonNull(inspector, "inspector must not be null");
            stateInspectors.put(runtime, inspector);
            return this;
        }

        public Builder hostPlanExecutor(HostPlanExecutor hostPlanExecutor) {
            this.hostPlanExecutor =
                    Objects.requireNonNull(hostPlanExecutor, "hostPlanExecutor must not be null");
            return this;
        }

        public Builder globalStepExecutor(GlobalStepExecutor globalStepExecutor) {
            this.globalStepExecutor =
                    Objects.requireNonNull(globalStepExecutor, "globalStepExecutor must not be null");
            return this;
        }

        public Builder slicer(PlanSlicer slicer) {
            this.slicer = Objects.requireNonNull(slicer, "slicer must not be null");
            return this;
        }

        public DefaultEngine build() {
            return new DefaultEngine(this);
        }
    }
}
