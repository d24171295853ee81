package fr.lapetina.inference.scheduler.infrastructure.capacity;

import fr.lapetina.inference.scheduler.MutableClock;
import fr.lapetina.inference.scheduler.domain.model.Backend;
import fr.lapetina.inference.scheduler.domain.model.CapacitySnapshot;
import fr.lapetina.inference.scheduler.domain.model.ProviderType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OllamaCapacityFacadeTest {

    private MutableClock clock;
    private OllamaCapacityFacade facade;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        facade = new OllamaCapacityFacade(clock);
        facade.registerProvider("gpu", 24000);
        facade.registerBackend(backend("small", "llama3:8b", 2, 6000));
        facade.registerBackend(backend("large", "llama3:70b", 1, 40000));
    }

    private static Backend backend(String id, String model, int slots, long vramMb) {
        return Backend.builder()
                .id(id)
                .providerType(ProviderType.OLLAMA)
                .providerName("gpu")
                .modelName(model)
                .maxConcurrentRequests(slots)
                .requiredVramMb(vramMb)
                .build();
    }

    @Nested
    @DisplayName("Slots")
    class SlotTests {

        @Test
        @DisplayName("should reserve up to the parallel limit")
        void shouldReserveUpToLimit() {
            assertThat(facade.tryReserve("small")).isTrue();
            assertThat(facade.tryReserve("small")).isTrue();
            assertThat(facade.tryReserve("small")).isFalse();

            CapacitySnapshot snapshot = facade.currentCapacity("small");
            assertThat(snapshot.freeSlots()).isZero();
            assertThat(snapshot.inFlight()).isEqualTo(2);
        }

        @Test
        @DisplayName("should clamp releases at zero")
        void shouldClampRelease() {
            facade.tryReserve("small");

            assertThat(facade.release("small")).isTrue();
            assertThat(facade.release("small")).isFalse();
            assertThat(facade.currentCapacity("small").inFlight()).isZero();
        }

        @Test
        @DisplayName("should pass a held slot on without touching the count")
        void shouldTransferHeldSlot() {
            assertThat(facade.transfer("small")).isFalse();
            facade.tryReserve("small");

            assertThat(facade.transfer("small")).isTrue();
            assertThat(facade.currentCapacity("small").inFlight()).isEqualTo(1);
        }

        @Test
        @DisplayName("should refuse unknown backends and foreign provider types")
        void shouldRefuseUnknown() {
            assertThatThrownBy(() -> facade.currentCapacity("ghost")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> facade.registerBackend(Backend.builder().id("x")
                    .providerType(ProviderType.AZURE).providerName("azure").build()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("VRAM and warmth")
    class VramTests {

        @Test
        @DisplayName("should report no capacity for a cold model that does not fit in free VRAM")
        void shouldBlockColdModelWithoutVram() {
            CapacitySnapshot large = facade.currentCapacity("large");

            assertThat(large.freeSlots()).isZero();
            assertThat(large.warm()).isFalse();
            assertThat(facade.tryReserve("large")).isFalse();
            assertThat(facade.currentCapacity("small").hasCapacity()).isTrue();
        }

        @Test
        @DisplayName("should admit a model once it is loaded, whatever the free VRAM")
        void shouldAdmitLoadedModel() {
            facade.applyLoadedModels("gpu", List.of(
                    new OllamaCapacityFacade.LoadedModel("llama3:70b", 40000, clock.instant().plusSeconds(300))));

            CapacitySnapshot large = facade.currentCapacity("large");
            assertThat(large.warm()).isTrue();
            assertThat(large.freeSlots()).isEqualTo(1);
            assertThat(large.metrics()).containsEntry("available_vram_mb", 0L);
        }

        @Test
        @DisplayName("should treat an expired keep-alive as cold")
        void shouldExpireKeepAlive() {
            facade.applyLoadedModels("gpu", List.of(
                    new OllamaCapacityFacade.LoadedModel("llama3:8b", 6000, clock.instant().plusSeconds(60))));
            assertThat(facade.currentCapacity("small").predictsColdStart()).isFalse();

            clock.advance(Duration.ofSeconds(61));

            assertThat(facade.currentCapacity("small").predictsColdStart()).isTrue();
        }

        @Test
        @DisplayName("should mark unlisted models unloaded and recompute free VRAM")
        void shouldReplaceLoadedPicture() {
            facade.applyLoadedModels("gpu", List.of(new OllamaCapacityFacade.LoadedModel("llama3:8b", 6000, null)));
            facade.applyLoadedModels("gpu", List.of());

            assertThat(facade.currentCapacity("small").warm()).isFalse();
            assertThat(facade.currentCapacity("small").metrics()).containsEntry("available_vram_mb", 24000L);
        }

        @Test
        @DisplayName("should ingest provider and backend stats from strings")
        void shouldIngestStringStats() {
            facade.updateProviderStats("gpu", Map.of(
                    OllamaCapacityFacade.STAT_AVAILABLE_VRAM_MB, "50000",
                    OllamaCapacityFacade.STAT_LOADED_MODELS, "llama3:8b, other"));

            assertThat(facade.currentCapacity("large").freeSlots()).isEqualTo(1);
            assertThat(facade.currentCapacity("small").warm()).isTrue();

            facade.updateBackendStats("small", Map.of(
                    OllamaCapacityFacade.STAT_LOADED, "true",
                    OllamaCapacityFacade.STAT_EXPIRES_AT, "not-a-date"));
            assertThat(facade.currentCapacity("small").warm()).isTrue();
        }

        @Test
        @DisplayName("should stay warm while requests are in flight")
        void shouldStayWarmWhileBusy() {
            facade.tryReserve("small");

            assertThat(facade.currentCapacity("small").warm()).isTrue();
        }
    }

    @Test
    @DisplayName("should list backends and providers")
    void shouldListBackends() {
        assertThat(facade.hasProvider("gpu")).isTrue();
        assertThat(facade.getBackendIds("gpu")).containsExactlyInAnyOrder("small", "large");
        assertThat(facade.getProviderNames()).containsExactly("gpu");
        assertThat(facade.handles("small")).isTrue();
    }
}
