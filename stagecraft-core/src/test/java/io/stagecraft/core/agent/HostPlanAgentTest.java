package io.stagecraft.core.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagecraft.core.plan.HostPlan;
import io.stagecraft.core.plan.HostPlanStep;
import io.stagecraft.core.plan.HostRef;
import io.stagecraft.core.plan.StepAction;
import io.stagecraft.core.report.ExecutionError;
import io.stagecraft.core.report.ExecutionReport;
import io.stagecraft.core.report.ExecutionStatus;
import io.stagecraft.core.report.StepExecution;
import io.stagecraft.core.report.StepStatus;
import io.stagecraft.core.resource.OpaquePayload;
import io.stagecraft.core.resource.ResourceRef;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class HostPlanAgentTest {

    private static final HostRef HOST = HostRef.of("host-a");
    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2025-01-02T03:04:05Z"), ZoneOffset.UTC);

    private DefaultStepExecutorRegistry registry;
    private HostPlanAgent agent;
    private List<String> executed;

    private static HostPlanStep step(String id, int index, StepAction action, String... dependsOn) {
        return new HostPlanStep(
                id, index, action, ResourceRef.none(), OpaquePayload.NULL, List.of(dependsOn), Map.of());
    }

    private static HostPlan hostPlan(HostPlanStep... steps) {
        return new HostPlan(HostPlan.SCHEMA_VERSION, "plan-1", HOST, List.of(steps), Map.of());
    }

    @BeforeEach
    void setUp() {
        registry = new DefaultStepExecutorRegistry();
        agent = new HostPlanAgent(registry, CLOCK);
        executed = new ArrayList<>();
        registry.register(StepAction.BUILD, (step, host) -> executed.add(step.id()));
        registry.register(StepAction.APPLY_COMPOSE, (step, host) -> executed.add(step.id()));
    }

    @Nested
    class Construction {

        @Test
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new HostPlanAgent(null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("registry");
        }
    }

    @Nested
    class Execution {

        @Test
        void shouldExecuteStepsInCanonicalOrder() throws Exception {
            ExecutionReport report =
                    agent.execute(
                            hostPlan(
                                    step("c", 3, StepAction.BUILD, "b"),
                                    step("a", 1, StepAction.BUILD),
                                    step("b", 2, StepAction.APPLY_COMPOSE, "a")));

            assertThat(executed).containsExactly("a", "b", "c");
            assertThat(report.planId()).isEqualTo("plan-1");
            assertThat(report.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(report.steps())
                    .allSatisfy(
                            record -> {
                                assertThat(record.status()).isEqualTo(StepStatus.SUCCEEDED);
                                assertThat(record.host()).isEqualTo(HOST);
                                assertThat(record.startedAt()).isEqualTo("2025-01-02T03:04:05Z");
                                assertThat(record.completedAt()).isEqualTo("2025-01-02T03:04:05Z");
                                assertThat(record.error()).isNull();
                            });
        }

        @Test
        void shouldFailWhenDependencyHasNotCompleted() {
            HostPlan plan = hostPlan(step("a", 1, StepAction.BUILD, "b"), step("b", 2, StepAction.BUILD));

            assertThatThrownBy(() -> agent.execute(plan))
                    .isInstanceOf(AgentExecutionException.class)
                    .hasMessage("step \"a\" depends on \"b\" which has not completed");
            assertThat(executed).isEmpty();
        }

        @Test
        void shouldSkipStepsWithoutExecutorAndReportPartial() throws Exception {
            ExecutionReport report =
                    agent.execute(
                            hostPlan(
                                    step("m", 1, StepAction.MIGRATE),
                                    step("b", 2, StepAction.BUILD, "m")));

            StepExecution skipped = report.step("m").orElseThrow();
            assertThat(skipped.status()).isEqualTo(StepStatus.SKIPPED);
            assertThat(skipped.error().code()).isEqualTo(ExecutionError.NO_EXECUTOR);
            assertThat(skipped.error().message()).contains("migrate");
            assertThat(report.step("b").orElseThrow().status()).isEqualTo(StepStatus.SUCCEEDED);
            assertThat(report.status()).isEqualTo(ExecutionStatus.PARTIAL);
        }

        @Test
        void shouldStopAfterFailure() throws Exception {
            registry.register(
                    StepAction.HEALTH_CHECK,
                    (step, host) -> {
                        throw new StepExecutionException("endpoint unhealthy");
                    });

            ExecutionReport report =
                    agent.execute(
                            hostPlan(
                                    step("a", 1, StepAction.BUILD),
                                    step("hc", 2, StepAction.HEALTH_CHECK),
                                    step("c", 3, StepAction.BUILD)));

            assertThat(report.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(report.steps()).extracting(StepExecution::stepId).containsExactly("a", "hc");
            StepExecution failed = report.step("hc").orElseThrow();
            assertThat(failed.status()).isEqualTo(StepStatus.FAILED);
            assertThat(failed.error())
                    .isEqualTo(new ExecutionError(ExecutionError.EXECUTION_ERROR, "endpoint unhealthy"));
            assertThat(executed).containsExactly("a");
        }

        @Test
        void shouldReturnEmptySucceededReportForEmptyPlan() throws Exception {
            ExecutionReport report = agent.execute(hostPlan());

            assertThat(report.steps()).isEmpty();
            assertThat(report.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
        }
    }

    @Nested
    class Observers {

        @Test
        void shouldNotifyStartAndCompletion() throws Exception {
            List<String> events = new ArrayList<>();
            agent.addObserver(
                    new ExecutionObserver() {
                        @Override
                        public void onStepStarted(String planId, HostPlanStep step) {
                            events.add("start:" + step.id());
                        }

                        @Override
                        public void onStepCompleted(String planId, StepExecution execution) {
                            events.add("done:" + execution.stepId() + ":" + execution.status().wireValue());
                        }
                    });

            agent.execute(hostPlan(step("a", 1, StepAction.BUILD), step("m", 2, StepAction.MIGRATE)));

            assertThat(events).containsExactly("start:a", "done:a:succeeded", "done:m:skipped");
        }

        @Test
        void shouldNotFailOnObserverException() throws Exception {
            agent.addObserver(
                    new ExecutionObserver() {
                        @Override
                        public void onStepCompleted(String planId, StepExecution execution) {
                            throw new IllegalStateException("observer failed");
                        }
                    });

            ExecutionReport report = agent.execute(hostPlan(step("a", 1, StepAction.BUILD)));

            assertThat(report.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
        }
    }
}
