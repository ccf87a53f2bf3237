package io.stagecraft.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagecraft.core.resource.ResourceRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PlanSlicerTest {

    private final PlanSlicer slicer = new PlanSlicer();

    private static PlanStep global(String id, int index, String... dependsOn) {
        return PlanStep.builder(id, index, StepAction.BUILD).dependsOn(dependsOn).build();
    }

    private static PlanStep onHost(String id, int index, String host, String... dependsOn) {
        return PlanStep.builder(id, index, StepAction.APPLY_COMPOSE)
                .host(host)
                .dependsOn(dependsOn)
                .build();
    }

    @Nested
    class Partitioning {

        @Test
        void shouldSeparateGlobalAndHostSteps() throws Exception {
            Plan plan =
                    Plan.of(
                            "p1",
                            List.of(
                                    global("build", 0),
                                    onHost("deploy-a", 1, "host-a"),
                                    onHost("deploy-b", 2, "host-b")));

            SliceResult result = slicer.slice(plan);

            assertThat(result.globalStepIds()).containsExactly("build");
            assertThat(result.hostIds()).containsExactly("host-a", "host-b");
            assertThat(result.hostPlans().get("host-a").steps())
                    .extracting(HostPlanStep::id)
                    .containsExactly("deploy-a");
            assertThat(result.hostPlans().get("host-b").planId()).isEqualTo("p1");
            assertThat(result.hostPlans().get("host-b").version()).isEqualTo("v1");
        }

        @Test
        void shouldReportEveryStepExactlyOnce() throws Exception {
            List<PlanStep> steps = new ArrayList<>();
            steps.add(global("g1", 0));
            steps.add(global("g2", 1, "g1"));
            for (int i = 0; i < 6; i++) {
                String host = "host-" + (i % 3);
                steps.add(onHost("s" + i, 10 + i, host, "g2"));
            }

            SliceResult result = slicer.slice(Plan.of("p", steps));

            List<String> seen = new ArrayList<>(result.globalStepIds());
            result.hostPlans()
                    .values()
                    .forEach(hp -> hp.steps().forEach(step -> seen.add(step.id())));
            assertThat(seen)
                    .containsExactlyInAnyOrderElementsOf(
                            steps.stream().map(PlanStep::id).toList());
            assertThat(result.stepCount()).isEqualTo(steps.size());
        }

        @Test
        void shouldKeepFirstSeenHostRefIncludingLabels() throws Exception {
            HostRef labelled = new HostRef("host-a", Map.of("role", "web"));
            Plan plan =
                    Plan.of(
                            "p",
                            List.of(
                                    PlanStep.builder("a", 0, StepAction.CREATE).host(labelled).build(),
                                    onHost("b", 1, "host-a")));

            SliceResult result = slicer.slice(plan);

            assertThat(result.hostPlans().get("host-a").host().labels())
                    .containsEntry("role", "web");
        }

        @Test
        void shouldCopyTargetInputsAndMetaThrough() throws Exception {
            ResourceRef target = ResourceRef.of("service", "api", "compose");
            PlanStep step =
                    PlanStep.builder("a", 3, StepAction.ROLLOUT)
                            .host("host-a")
                            .target(target)
                            .inputs("{\"mode\":\"rolling\"}")
                            .meta(Map.of("owner", "team"))
                            .build();

            HostPlanStep sliced =
                    slicer.slice(Plan.of("p", List.of(step))).hostPlans().get("host-a").steps().get(0);

            assertThat(sliced.index()).isEqualTo(3);
            assertThat(sliced.action()).isEqualTo(StepAction.ROLLOUT);
            assertThat(sliced.target()).isEqualTo(target);
            assertThat(sliced.inputs()).isSameAs(step.inputs());
            assertThat(sliced.meta()).containsEntry("owner", "team");
        }

        @Test
        void shouldHandleEmptyPlan() throws Exception {
            SliceResult result = slicer.slice(Plan.of("empty", List.of()));

            assertThat(result.hostPlans()).isEmpty();
            assertThat(result.globalSteps()).isEmpty();
            assertThat(result.globalDependencyRefs()).isEmpty();
        }
    }

    @Nested
    class Ordering {

        @Test
        void shouldOrderStepsByIndexThenId() throws Exception {
            Plan plan =
                    Plan.of(
                            "p",
                            List.of(
                                    onHost("c", 2, "h"),
                                    onHost("b", 1, "h"),
                                    onHost("a2", 1, "h"),
                                    global("g2", 5),
                                    global("g1", 5)));

            SliceResult result = slicer.slice(plan);

            assertThat(result.hostPlans().get("h").steps())
                    .extracting(HostPlanStep::id)
                    .containsExactly("a2", "b", "c");
            assertThat(result.globalStepIds()).containsExactly("g1", "g2");
            assertThat(result.globalSteps()).extracting(PlanStep::id).containsExactly("g1", "g2");
        }

        @Test
        void shouldSortAndDeduplicateLocalDependencies() throws Exception {
            Plan plan =
                    Plan.of(
                            "p",
                            List.of(
                                    onHost("z", 0, "h"),
                                    onHost("a", 1, "h"),
                                    onHost("m", 2, "h", "z", "a", "z")));

            SliceResult result = slicer.slice(plan);

            assertThat(result.hostPlans().get("h").steps().get(2).dependsOn())
                    .containsExactly("a", "z");
        }

        @Test
        void shouldProduceEqualResultsForRepeatedSlices() throws Exception {
            Plan plan =
                    Plan.of(
                            "p",
                            List.of(
                                    global("g", 0),
                                    onHost("b1", 2, "host-b", "g"),
                                    onHost("a1", 1, "host-a"),
                                    onHost("a2", 3, "host-a", "a1", "g")));

            assertThat(slicer.slice(plan)).isEqualTo(slicer.slice(plan));
        }
    }

    @Nested
    class GlobalDependencies {

        @Test
        void shouldMoveGlobalDependencyOutOfHostStep() throws Exception {
            Plan plan = Plan.of("p", List.of(global("G", 0), onHost("H", 1, "host-a", "G")));

            SliceResult result = slicer.slice(plan);

            assertThat(result.globalDependencyRefs()).containsEntry("H", List.of("G"));
            assertThat(result.hostPlans().get("host-a").steps().get(0).dependsOn()).isEmpty();
        }

        @Test
        void shouldSplitMixedDependencies() throws Exception {
            Plan plan =
                    Plan.of(
                            "p",
                            List.of(
                                    global("g2", 0),
                                    global("g1", 1),
                                    onHost("local", 2, "h"),
                                    onHost("s", 3, "h", "g2", "local", "g1")));

            SliceResult result = slicer.slice(plan);

            assertThat(result.globalDependencyRefs().get("s")).containsExactly("g1", "g2");
            assertThat(result.hostPlans().get("h").steps().get(1).dependsOn())
                    .containsExactly("local");
            assertThat(result.globalDependenciesOf("h")).containsExactly("g1", "g2");
        }

        @Test
        void shouldNotValidateGlobalStepDependencies() throws Exception {
            Plan plan = Plan.of("p", List.of(global("g", 0, "missing"), onHost("a", 1, "h")));

            SliceResult result = slicer.slice(plan);

            assertThat(result.globalSteps().get(0).dependsOn()).containsExactly("missing");
        }

        @Test
        void shouldOmitStepsWithoutGlobalDependencies() throws Exception {
            Plan plan = Plan.of("p", List.of(global("g", 0), onHost("a", 1, "h")));

            assertThat(slicer.slice(plan).globalDependencyRefs()).isEmpty();
        }
    }

    @Nested
    class Validation {

        @Test
        void shouldRejectCrossHostDependency() {
            Plan plan =
                    Plan.of(
                            "p",
                            List.of(
                                    global("s1", 0),
                                    onHost("s2", 1, "host-a"),
                                    onHost("s3", 2, "host-b", "s2")));

            assertThatThrownBy(() -> slicer.slice(plan))
                    .isInstanceOf(CrossHostDependencyException.class)
                    .hasMessage(
                            "step \"s3\" on host \"host-b\" depends on step \"s2\" on host"
                                    + " \"host-a\" (cross-host dependencies not allowed in v1)")
                    .satisfies(
                            e -> {
                                CrossHostDependencyException ex = (CrossHostDependencyException) e;
                                assertThat(ex.getStepId()).isEqualTo("s3");
                                assertThat(ex.getHostId()).isEqualTo("host-b");
                                assertThat(ex.getDependencyStepId()).isEqualTo("s2");
                                assertThat(ex.getDependencyHostId()).isEqualTo("host-a");
                            });
        }

        @Test
        void shouldRejectUnknownDependency() {
            Plan plan = Plan.of("p", List.of(onHost("a", 0, "h", "ghost")));

            assertThatThrownBy(() -> slicer.slice(plan))
                    .isInstanceOf(UnknownStepReferenceException.class)
                    .hasMessage("step \"a\" depends on unknown step \"ghost\"")
                    .satisfies(
                            e ->
                                    assertThat(((UnknownStepReferenceException) e).getMissingStepId())
                                            .isEqualTo("ghost"));
        }

        @Test
        void shouldRejectDuplicateStepIds() {
            Plan plan = Plan.of("p", List.of(onHost("a", 0, "h"), global("a", 1)));

            assertThatThrownBy(() -> slicer.slice(plan))
                    .isInstanceOf(DuplicateStepIdException.class)
                    .hasMessageContaining("\"a\"");
        }

        @Test
        void shouldRejectNullPlan() {
            assertThatThrownBy(() -> slicer.slice(null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("plan");
        }
    }

    @Nested
    class ExampleScenario {

        @Test
        void shouldFailWhenHostBDependsOnHostA() {
            Plan plan =
                    Plan.of(
                            "plan-1",
                            List.of(
                                    global("s1", 1),
                                    onHost("s2", 2, "host-a"),
                                    onHost("s3", 3, "host-b", "s2")));

            assertThatThrownBy(() -> slicer.slice(plan))
                    .isInstanceOf(CrossHostDependencyException.class);
        }

        @Test
        void shouldSliceWhenBothStepsShareHost() throws Exception {
            Plan plan =
                    Plan.of(
                            "plan-1",
                            List.of(
                                    global("s1", 1),
                                    onHost("s2", 2, "host-a"),
                                    onHost("s3", 3, "host-a", "s2")));

            SliceResult result = slicer.slice(plan);

            assertThat(result.hostIds()).containsExactly("host-a");
            List<HostPlanStep> steps = result.hostPlans().get("host-a").steps();
            assertThat(steps).extracting(HostPlanStep::id).containsExactly("s2", "s3");
            assertThat(steps.get(1).dependsOn()).containsExactly("s2");
            assertThat(result.globalStepIds()).containsExactly("s1");
        }
    }

    @Nested
    class Immutability {

        @Test
        void shouldNotMutateInputPlan() throws Exception {
            PlanStep unsorted = onHost("b", 2, "h", "a");
            Plan plan = Plan.of("p", List.of(unsorted, onHost("a", 1, "h")));
            Plan before = new Plan(plan.version(), plan.id(), plan.summary(), plan.steps(), plan.meta());

            slicer.slice(plan);

            assertThat(plan).isEqualTo(before);
            assertThat(plan.steps()).extracting(PlanStep::id).containsExactly("b", "a");
        }

        @Test
        void shouldReturnUnmodifiableStructures() throws Exception {
            SliceResult result = slicer.slice(Plan.of("p", List.of(onHost("a", 0, "h"))));

            assertThatThrownBy(() -> result.hostPlans().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> result.hostPlans().get("h").steps().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
