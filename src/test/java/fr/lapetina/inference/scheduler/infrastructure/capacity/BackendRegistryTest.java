package fr.lapetina.inference.scheduler.infrastructure.capacity;

import fr.lapetina.inference.scheduler.domain.model.Backend;
import fr.lapetina.inference.scheduler.domain.model.ProviderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendRegistryTest {

    private final OllamaCapacityFacade ollama = new OllamaCapacityFacade();
    private final AzureCapacityFacade azure = new AzureCapacityFacade();

    @Test
    @DisplayName("should resolve each backend to the facade of its provider type")
    void shouldResolveFacade() {
        BackendRegistry registry = new BackendRegistry(List.of(ollama, azure));
        registry.register(Backend.builder().id("local").providerType(ProviderType.OLLAMA).providerName("gpu").build());
        registry.register(Backend.builder().id("cloud").providerType(ProviderType.AZURE).providerName("az").build());

        assertThat(registry.facadeFor("local")).containsSame(ollama);
        assertThat(registry.facadeFor("cloud")).containsSame(azure);
        assertThat(registry.facadeFor("ghost")).isEmpty();
        assertThat(registry.facadeFor((String) null)).isEmpty();
        assertThat(registry.size()).isEqualTo(2);
        assertThat(ollama.handles("local")).isTrue();
    }

    @Test
    @DisplayName("should refuse a backend whose provider type has no facade")
    void shouldRefuseMissingFacade() {
        BackendRegistry registry = new BackendRegistry(List.of(ollama));

        assertThatThrownBy(() -> registry.register(
                Backend.builder().id("cloud").providerType(ProviderType.AZURE).providerName("az").build()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.contains("cloud")).isFalse();
    }

    @Test
    @DisplayName("should refuse two facades for the same provider type")
    void shouldRefuseDuplicateFacade() {
        assertThatThrownBy(() -> new BackendRegistry(List.of(ollama, new OllamaCapacityFacade())))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
