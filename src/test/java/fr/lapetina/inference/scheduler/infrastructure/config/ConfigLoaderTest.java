package fr.lapetina.inference.scheduler.infrastructure.config;

import fr.lapetina.inference.scheduler.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final String MINIMAL = """
            scheduler:
              type: fcfs
            providers:
              - name: gpu
                type: ollama
            backends:
              - id: m1
                provider: gpu
            """;

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load the classpath configuration")
    void shouldLoadFromClasspath() {
        SchedulerConfig config = new ConfigLoader("scheduler-test.yaml").load();

        assertThat(config.getScheduler().getType()).isEqualTo("utilization");
        assertThat(config.getScheduler().getDefaultQueueTimeoutMs()).isEqualTo(2000);
        assertThat(config.getStarvation().getSweepMode()).isEqualTo("on-release");
        assertThat(config.getProviders()).extracting(SchedulerConfig.ProviderConfig::getName)
                .containsExactly("gpu-test", "azure-test");
        assertThat(config.getBackends()).extracting(SchedulerConfig.BackendConfig::getId)
                .containsExactly("m1", "m2", "cloud");
        assertThat(config.getBackends().get(1).getRequiredVramMb()).isEqualTo(5000);
        assertThat(config.getAzure().getMinRemainingRequests()).isEqualTo(5);
    }

    @Test
    @DisplayName("should fill defaults for omitted sections")
    void shouldApplyDefaults() {
        SchedulerConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml(MINIMAL));

        assertThat(config.getStarvation().getLowThresholdMs()).isEqualTo(10_000);
        assertThat(config.getStarvation().getNormalThresholdMs()).isEqualTo(30_000);
        assertThat(config.getStarvation().getSweepMode()).isEqualTo("both");
        assertThat(config.getBackends().get(0).getMaxConcurrentRequests()).isEqualTo(1);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("inference_scheduler");
    }

    @Test
    @DisplayName("should fail when the file exists nowhere")
    void shouldFailWhenMissing() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        private void assertRejected(String document, String message) {
            ConfigLoader loader = new ConfigLoader("unused.yaml");
            assertThatThrownBy(() -> loader.loadFromStream(yaml(document)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining(message);
            assertThat(loader.getCurrentConfig()).isNull();
        }

        @Test
        @DisplayName("should reject a backend that references an unknown provider")
        void shouldRejectUnknownProvider() {
            assertRejected(MINIMAL.replace("provider: gpu", "provider: nowhere"), "unknown provider");
        }

        @Test
        @DisplayName("should reject duplicate backend ids")
        void shouldRejectDuplicateBackend() {
            assertRejected(MINIMAL + "  - id: m1\n    provider: gpu\n", "Duplicate backend");
        }

        @Test
        @DisplayName("should reject a negative queue timeout")
        void shouldRejectNegativeTimeout() {
            assertRejected(MINIMAL.replace("type: fcfs", "type: fcfs\n  defaultQueueTimeoutMs: -1"),
                    "defaultQueueTimeoutMs");
        }

        @Test
        @DisplayName("should reject an unknown provider type")
        void shouldRejectBadProviderType() {
            assertRejected(MINIMAL.replace("type: ollama", "type: tpu"), "unknown type");
        }

        @Test
        @DisplayName("should reject malformed and empty documents")
        void shouldRejectMalformed() {
            assertRejected("scheduler: [unclosed", "Malformed");
            assertRejected("", "Empty");
        }
    }

    @Nested
    @DisplayName("Reload")
    class ReloadTests {

        @Test
        @DisplayName("should notify listeners with old and new configuration")
        void shouldNotifyListeners(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("scheduler.yaml");
            Files.writeString(file, MINIMAL);
            ConfigLoader loader = new ConfigLoader(file.toString());
            List<String> seen = new ArrayList<>();
            loader.addListener((oldConfig, newConfig) -> seen.add(
                    (oldConfig == null ? "none" : oldConfig.getScheduler().getType())
                            + "->" + newConfig.getScheduler().getType()));

            loader.load();
            Files.writeString(file, MINIMAL.replace("type: fcfs", "type: utilization"));
            loader.reload();

            assertThat(seen).containsExactly("none->fcfs", "fcfs->utilization");
            loader.close();
        }

        @Test
        @DisplayName("should keep the current configuration when a reload is invalid")
        void shouldKeepCurrentOnFailure(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("scheduler.yaml");
            Files.writeString(file, MINIMAL);
            ConfigLoader loader = new ConfigLoader(file.toString());
            SchedulerConfig first = loader.load();

            Files.writeString(file, MINIMAL.replace("provider: gpu", "provider: nowhere"));
            SchedulerConfig afterReload = loader.reload();

            assertThat(afterReload).isSameAs(first);
            assertThat(loader.getCurrentConfig()).isSameAs(first);
            loader.close();
        }

        @Test
        @DisplayName("should stop notifying a removed listener")
        void shouldRemoveListener() {
            ConfigLoader loader = new ConfigLoader("unused.yaml");
            List<SchedulerConfig> seen = new ArrayList<>();
            ConfigChangeListener listener = (oldConfig, newConfig) -> seen.add(newConfig);
            loader.addListener(listener);
            loader.loadFromStream(yaml(MINIMAL));
            loader.removeListener(listener);
            loader.loadFromStream(yaml(MINIMAL));

            assertThat(seen).hasSize(1);
        }
    }
}
