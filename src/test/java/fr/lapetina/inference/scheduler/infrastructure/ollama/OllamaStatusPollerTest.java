package fr.lapetina.inference.scheduler.infrastructure.ollama;

import fr.lapetina.inference.scheduler.domain.model.Backend;
import fr.lapetina.inference.scheduler.domain.model.ProviderType;
import fr.lapetina.inference.scheduler.infrastructure.capacity.OllamaCapacityFacade;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class OllamaStatusPollerTest {

    private OllamaCapacityFacade facade;
    private List<String> refreshed;
    private OllamaStatusPoller poller;

    @BeforeEach
    void setUp() {
        facade = new OllamaCapacityFacade();
        facade.registerProvider("gpu", 16000);
        facade.registerBackend(Backend.builder().id("m1").providerType(ProviderType.OLLAMA)
                .providerName("gpu").modelName("llama3:8b").build());
        refreshed = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        poller.close();
    }

    @Test
    @DisplayName("should apply a successful poll and notify the scheduler")
    void shouldApplyAndNotify() {
        OllamaStatusClient stub = new OllamaStatusClient() {
            @Override
            public CompletableFuture<List<OllamaCapacityFacade.LoadedModel>> fetchLoadedModels(URI baseUrl) {
                return CompletableFuture.completedFuture(
                        List.of(new OllamaCapacityFacade.LoadedModel("llama3:8b", 5000, null)));
            }
        };
        poller = new OllamaStatusPoller(facade, stub, refreshed::add);
        poller.addProvider("gpu", URI.create("http://gpu:11434"), Duration.ofSeconds(30));

        poller.poll("gpu");

        assertThat(refreshed).containsExactly("gpu");
        assertThat(facade.currentCapacity("m1").warm()).isTrue();
        assertThat(facade.currentCapacity("m1").metrics()).containsEntry("available_vram_mb", 11000L);
    }

    @Test
    @DisplayName("should keep the last known state when a poll fails")
    void shouldKeepStateOnFailure() {
        OllamaStatusClient failing = new OllamaStatusClient() {
            @Override
            public CompletableFuture<List<OllamaCapacityFacade.LoadedModel>> fetchLoadedModels(URI baseUrl) {
                return CompletableFuture.failedFuture(new OllamaStatusException("Unexpected status 500"));
            }
        };
        poller = new OllamaStatusPoller(facade, failing, refreshed::add);
        poller.addProvider("gpu", URI.create("http://gpu:11434"), Duration.ofSeconds(30));

        poller.poll("gpu");

        assertThat(refreshed).isEmpty();
        assertThat(facade.currentCapacity("m1").warm()).isFalse();
    }

    @Test
    @DisplayName("should ignore providers that were never added or have polling disabled")
    void shouldIgnoreUnknownProvider() {
        poller = new OllamaStatusPoller(facade, new OllamaStatusClient(), refreshed::add);
        poller.addProvider("gpu", URI.create("http://gpu:11434"), Duration.ZERO);

        poller.poll("gpu");
        poller.poll("other");

        assertThat(refreshed).isEmpty();
    }
}
