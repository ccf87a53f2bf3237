package io.stagecraft.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagecraft.core.resource.OpaquePayload;
import io.stagecraft.core.resource.ResourceRef;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PlanModelTest {

    @Nested
    class Steps {

        @Test
        void shouldDefaultOptionalFields() {
            PlanStep step = new PlanStep(null, 0, StepAction.NOOP, null, null, null, null, null);

            assertThat(step.id()).isEmpty();
            assertThat(step.target()).isEqualTo(ResourceRef.none());
            assertThat(step.host()).isEqualTo(HostRef.global());
            assertThat(step.inputs()).isEqualTo(OpaquePayload.NULL);
            assertThat(step.dependsOn()).isEmpty();
            assertThat(step.meta()).isEmpty();
            assertThat(step.global()).isTrue();
        }

        @Test
        void shouldRequireAction() {
            assertThatThrownBy(() -> PlanStep.builder("a", 0, null).build())
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("action");
        }

        @Test
        void shouldOrderCanonically() {
            PlanStep b = PlanStep.builder("b", 1, StepAction.NOOP).build();
            PlanStep a = PlanStep.builder("a", 1, StepAction.NOOP).build();
            PlanStep first = PlanStep.builder("z", 0, StepAction.NOOP).build();

            assertThat(List.of(b, a, first).stream().sorted(PlanStep.CANONICAL_ORDER).toList())
                    .extracting(PlanStep::id)
                    .containsExactly("z", "a", "b");
        }
    }

    @Nested
    class Hosts {

        @Test
        void shouldTreatEmptyLogicalIdAsGlobal() {
            assertThat(HostRef.of("").hasLogicalId()).isFalse();
            assertThat(new HostRef(null, null)).isEqualTo(HostRef.global());
            assertThat(new HostRef("h", Map.of("zone", "eu")).hasLogicalId()).isTrue();
        }
    }

    @Nested
    class Payloads {

        @Test
        void shouldMapBlankJsonToNull() {
            assertThat(OpaquePayload.of("  ")).isSameAs(OpaquePayload.NULL);
            assertThat(OpaquePayload.of(null).absent()).isTrue();
            assertThat(OpaquePayload.of(" {\"a\":1} ").json()).isEqualTo("{\"a\":1}");
        }

        @Test
        void shouldRejectBlankJsonInConstructor() {
            assertThatThrownBy(() -> new OpaquePayload(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void shouldUseWireSpellingForActions() {
        assertThat(StepAction.RENDER_COMPOSE.wireValue()).isEqualTo("render_compose");
        assertThat(StepAction.HEALTH_CHECK).hasToString("health_check");
    }
}
