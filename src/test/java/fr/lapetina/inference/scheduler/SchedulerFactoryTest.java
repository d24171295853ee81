package fr.lapetina.inference.scheduler;

import fr.lapetina.inference.scheduler.domain.model.ReleaseOutcome;
import fr.lapetina.inference.scheduler.domain.model.SchedulingRequest;
import fr.lapetina.inference.scheduler.domain.model.SchedulingResult;
import fr.lapetina.inference.scheduler.domain.scheduler.SweepMode;
import fr.lapetina.inference.scheduler.domain.model.Priority;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerFactoryTest {

    private SchedulerFactory factory;

    @BeforeEach
    void setUp() {
        factory = SchedulerFactory.create("scheduler-test.yaml");
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    @Test
    @DisplayName("should wire the configured policy and backends")
    void shouldWireFromConfig() {
        assertThat(factory.getScheduler().getName()).isEqualTo("utilization");
        assertThat(factory.getBackendRegistry().size()).isEqualTo(3);
        assertThat(factory.getBackendRegistry().getBackend("m2").orElseThrow().getRequiredVramMb()).isEqualTo(5000);
        assertThat(factory.getStarvationGuard().getMode()).isEqualTo(SweepMode.ON_RELEASE);
        assertThat(factory.getStarvationGuard().thresholdFor(Priority.LOW)).contains(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("should grant, release and expose decisions in the scrape")
    void shouldScheduleEndToEnd() {
        SchedulingResult result = factory.getScheduler().schedule(SchedulingRequest.builder()
                .requestId("req-1").candidate("m1").build()).join();

        assertThat(result.isGranted()).isTrue();
        assertThat(result.backendId()).isEqualTo("m1");
        factory.getScheduler().release("m1", ReleaseOutcome.success("req-1", Duration.ofMillis(10)));

        assertThat(factory.getMetrics().scrape())
                .contains("test_scheduler_decisions_total")
                .contains("test_scheduler_releases_total");
    }

    @Test
    @DisplayName("should apply new starvation thresholds on config change")
    void shouldApplyConfigChange() throws IOException {
        String updated = """
                scheduler:
                  type: utilization
                starvation:
                  lowThresholdMs: 250
                  normalThresholdMs: 750
                providers:
                  - name: gpu-test
                    type: ollama
                backends:
                  - id: m1
                    provider: gpu-test
                """;
        try (InputStream in = new ByteArrayInputStream(updated.getBytes(StandardCharsets.UTF_8))) {
            factory.getConfigLoader().loadFromStream(in);
        }

        assertThat(factory.getStarvationGuard().thresholdFor(Priority.LOW)).contains(Duration.ofMillis(250));
        assertThat(factory.getStarvationGuard().thresholdFor(Priority.NORMAL)).contains(Duration.ofMillis(750));
        assertThat(factory.getBackendRegistry().size()).isEqualTo(3);
    }
}
