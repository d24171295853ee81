package fr.lapetina.inference.scheduler.domain.scheduler;

import fr.lapetina.inference.scheduler.infrastructure.capacity.BackendRegistry;
import fr.lapetina.inference.scheduler.infrastructure.capacity.OllamaCapacityFacade;
import fr.lapetina.inference.scheduler.infrastructure.metrics.SchedulerMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerPoliciesTest {

    private final SchedulerPolicies.Context context = new SchedulerPolicies.Context(
            new BackendRegistry(List.of(new OllamaCapacityFacade())),
            StarvationGuard.defaults(),
            new SchedulerMetrics("policies_test"),
            Clock.systemUTC(),
            Duration.ofSeconds(1),
            Duration.ofMillis(10)
    );

    @Test
    @DisplayName("should create built-in policies by name, case-insensitively")
    void shouldCreateBuiltIns() {
        try (Scheduler utilization = SchedulerPolicies.create("Utilization", context).orElseThrow();
             Scheduler fcfs = SchedulerPolicies.create("FCFS", context).orElseThrow()) {
            assertThat(utilization).isInstanceOf(UtilizationAwareScheduler.class);
            assertThat(fcfs).isInstanceOf(FcfsScheduler.class);
        }
        assertThat(SchedulerPolicies.getRegisteredNames()).contains("utilization", "fcfs");
    }

    @Test
    @DisplayName("should return empty for an unknown policy")
    void shouldReturnEmptyForUnknown() {
        assertThat(SchedulerPolicies.create("round-robin", context)).isEmpty();
    }
}
