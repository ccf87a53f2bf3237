package io.stagecraft.core.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ResourceModelTest {

    private static ResourceSpec spec(String kind, String name) {
        return new ResourceSpec(ResourceRef.of(kind, name, "docker"), null, null);
    }

    @Nested
    class Snapshots {

        @Test
        void shouldSortTopologyByKindThenName() {
            TopologySnapshot snapshot =
                    TopologySnapshot.of(
                            List.of(spec("service", "web"), spec("network", "edge"), spec("service", "api")));

            assertThat(snapshot.sorted().resources())
                    .extracting(r -> r.ref().kind() + "/" + r.ref().name())
                    .containsExactly("network/edge", "service/api", "service/web");
        }

        @Test
        void shouldLeaveOriginalOrderUntouched() {
            TopologySnapshot snapshot =
                    TopologySnapshot.of(List.of(spec("service", "web"), spec("service", "api")));

            snapshot.sorted();

            assertThat(snapshot.resources()).extracting(r -> r.ref().name()).containsExactly("web", "api");
        }

        @Test
        void shouldSortState() {
            StateSnapshot state =
                    StateSnapshot.of(
                            List.of(
                                    new ResourceState(ResourceRef.of("volume", "b", "docker"), null, null),
                                    new ResourceState(ResourceRef.of("volume", "a", "docker"), null, null)));

            assertThat(state.sorted().resources())
                    .extracting(r -> r.ref().name())
                    .containsExactly("a", "b");
        }

        @Test
        void shouldProvideEmptyState() {
            StateSnapshot empty = StateSnapshot.empty();

            assertThat(empty.version()).isEqualTo(StateSnapshot.SCHEMA_VERSION);
            assertThat(empty.resources()).isEmpty();
            assertThat(empty.meta()).isEmpty();
        }
    }

    @Nested
    class Payloads {

        @Test
        void shouldMapMissingPayloadToNull() {
            assertThat(OpaquePayload.of(null)).isSameAs(OpaquePayload.NULL);
            assertThat(OpaquePayload.of("  ")).isSameAs(OpaquePayload.NULL);
            assertThat(spec("service", "api").data().absent()).isTrue();
        }

        @Test
        void shouldKeepJsonText() {
            OpaquePayload payload = OpaquePayload.of(" {\"a\":1} ");

            assertThat(payload.json()).isEqualTo("{\"a\":1}");
            assertThat(payload.absent()).isFalse();
            assertThat(new String(payload.bytes(), StandardCharsets.UTF_8))
                    .isEqualTo("{\"a\":1}");
        }

        @Test
        void shouldRejectBlankJsonInConstructor() {
            assertThatThrownBy(() -> new OpaquePayload(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void shouldDefaultEmptyNamespace() {
        assertThat(ResourceRef.of("service", "api", "docker").namespace()).isEmpty();
    }

    @Test
    void shouldRequireRefOnSpec() {
        assertThatThrownBy(() -> new ResourceSpec(null, null, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("ref must not be null");
    }
}
