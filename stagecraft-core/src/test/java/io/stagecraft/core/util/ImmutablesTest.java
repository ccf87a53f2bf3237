package io.stagecraft.core.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagecraft.core.plan.StepAction;
import io.stagecraft.core.report.StepStatus;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ImmutablesTest {

    @Nested
    class Maps {

        @Test
        void shouldSortKeysAndReplaceNullValues() {
            Map<String, String> source = new HashMap<>();
            source.put("zeta", "1");
            source.put("alpha", null);

            Map<String, String> copy = Immutables.copyOf(source);

            assertThat(copy.keySet()).containsExactly("alpha", "zeta");
            assertThat(copy).containsEntry("alpha", "");
        }

        @Test
        void shouldNotAliasSource() {
            Map<String, String> source = new HashMap<>(Map.of("a", "1"));

            Map<String, String> copy = Immutables.copyOf(source);
            source.put("b", "2");

            assertThat(copy).containsOnlyKeys("a");
            assertThatThrownBy(() -> copy.put("c", "3"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void shouldTreatNullAsEmpty() {
            assertThat(Immutables.copyOf((Map<String, String>) null)).isEmpty();
        }
    }

    @Nested
    class Lists {

        @Test
        void shouldCopyAndRejectNullElements() {
            List<String> source = new ArrayList<>(List.of("a"));
            List<String> copy = Immutables.copyOf(source);
            source.add("b");

            assertThat(copy).containsExactly("a");

            List<String> withNull = new ArrayList<>();
            withNull.add(null);
            assertThatThrownBy(() -> Immutables.copyOf(withNull))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    class WireValues {

        @Test
        void shouldResolveWireSpelling() {
            assertThat(WireEnum.fromWire(StepAction.class, "health_check"))
                    .contains(StepAction.HEALTH_CHECK);
            assertThat(WireEnum.fromWire(StepStatus.class, "skipped")).contains(StepStatus.SKIPPED);
        }

        @Test
        void shouldNotResolveConstantNames() {
            assertThat(WireEnum.fromWire(StepAction.class, "HEALTH_CHECK")).isEmpty();
            assertThat(WireEnum.fromWire(StepAction.class, null)).isEmpty();
        }
    }
}
