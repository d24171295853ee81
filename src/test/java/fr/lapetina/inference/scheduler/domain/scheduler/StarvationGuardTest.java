package fr.lapetina.inference.scheduler.domain.scheduler;

import fr.lapetina.inference.scheduler.MutableClock;
import fr.lapetina.inference.scheduler.domain.model.Priority;
import fr.lapetina.inference.scheduler.domain.queue.PriorityQueueManager;
import fr.lapetina.inference.scheduler.domain.queue.QueueState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StarvationGuardTest {

    private MutableClock clock;
    private PriorityQueueManager<String> queues;
    private StarvationGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        queues = new PriorityQueueManager<>(clock);
        guard = StarvationGuard.defaults();
    }

    @Test
    @DisplayName("should leave entries alone below their threshold")
    void shouldLeaveFreshEntries() {
        queues.enqueue("low", "m1", Priority.LOW);
        queues.enqueue("normal", "m1", Priority.NORMAL);
        clock.advance(Duration.ofSeconds(9));

        assertThat(guard.sweep(queues, clock.instant())).isEmpty();
        assertThat(queues.getState("m1")).isEqualTo(new QueueState(1, 1, 0));
    }

    @Test
    @DisplayName("should promote an overdue LOW entry to NORMAL")
    void shouldPromoteOverdueLow() {
        String id = queues.enqueue("low", "m1", Priority.LOW);
        clock.advance(Duration.ofSeconds(10));

        List<StarvationGuard.Escalation> escalations = guard.sweep(queues, clock.instant());

        assertThat(escalations).singleElement().satisfies(e -> {
            assertThat(e.entryId()).isEqualTo(id);
            assertThat(e.from()).isEqualTo(Priority.LOW);
            assertThat(e.to()).isEqualTo(Priority.NORMAL);
            assertThat(e.waited()).isEqualTo(Duration.ofSeconds(10));
        });
        assertThat(queues.getState("m1")).isEqualTo(new QueueState(0, 1, 0));
    }

    @Test
    @DisplayName("should promote at most one level per sweep")
    void shouldPromoteOneLevelPerSweep() {
        queues.enqueue("low", "m1", Priority.LOW);
        clock.advance(Duration.ofSeconds(45));

        guard.sweep(queues, clock.instant());
        assertThat(queues.getState("m1")).isEqualTo(new QueueState(0, 1, 0));

        // Total wait already exceeds the NORMAL threshold
        guard.sweep(queues, clock.instant());
        assertThat(queues.getState("m1")).isEqualTo(new QueueState(0, 0, 1));

        assertThat(guard.sweep(queues, clock.instant())).isEmpty();
    }

    @Test
    @DisplayName("should sweep every backend")
    void shouldSweepEveryBackend() {
        queues.enqueue("a", "m1", Priority.NORMAL);
        queues.enqueue("b", "m2", Priority.NORMAL);
        clock.advance(Duration.ofSeconds(30));

        assertThat(guard.sweep(queues, clock.instant()))
                .extracting(StarvationGuard.Escalation::backendId)
                .containsExactlyInAnyOrder("m1", "m2");
    }

    @Test
    @DisplayName("should apply thresholds changed at runtime")
    void shouldApplyNewThresholds() {
        queues.enqueue("low", "m1", Priority.LOW);
        clock.advance(Duration.ofSeconds(2));
        assertThat(guard.sweep(queues, clock.instant())).isEmpty();

        guard.updateThresholds(Duration.ofSeconds(1), Duration.ofSeconds(5));

        assertThat(guard.sweep(queues, clock.instant())).hasSize(1);
        assertThat(guard.thresholdFor(Priority.HIGH)).isEmpty();
    }

    @Test
    @DisplayName("should reject non-positive settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new StarvationGuard(Duration.ZERO, Duration.ofSeconds(1),
                SweepMode.BOTH, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StarvationGuard(Duration.ofSeconds(1), Duration.ofSeconds(1),
                SweepMode.BOTH, Duration.ofMillis(-5)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should parse sweep modes")
    void shouldParseSweepModes() {
        assertThat(SweepMode.fromString("on-release")).isEqualTo(SweepMode.ON_RELEASE);
        assertThat(SweepMode.fromString("PERIODIC")).isEqualTo(SweepMode.PERIODIC);
        assertThat(SweepMode.fromString(null)).isEqualTo(SweepMode.BOTH);
        assertThat(SweepMode.BOTH.sweepsOnRelease()).isTrue();
        assertThat(SweepMode.ON_RELEASE.sweepsPeriodically()).isFalse();
        assertThatThrownBy(() -> SweepMode.fromString("sometimes")).isInstanceOf(IllegalArgumentException.class);
    }
}
