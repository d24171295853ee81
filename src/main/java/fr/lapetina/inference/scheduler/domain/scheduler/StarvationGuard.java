package fr.lapetina.inference.scheduler.domain.scheduler;

import fr.lapetina.inference.scheduler.domain.model.Priority;
import fr.lapetina.inference.scheduler.domain.queue.PriorityQueueManager;
import fr.lapetina.inference.scheduler.domain.queue.QueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Anti-starvation promotion rule.
 *
 * A queued entry whose total wait, measured from its original enqueue time,
 * reaches the threshold of its current level is moved up one level. One sweep
 * promotes an entry at most once, so a LOW entry needs two sweeps to reach
 * HIGH. HIGH entries are never touched.
 *
 * Thresholds may be changed at runtime; the sweep mode and period are fixed
 * for the lifetime of the scheduler.
 */
public final class StarvationGuard {

    private static final Logger log = LoggerFactory.getLogger(StarvationGuard.class);

    public static final Duration DEFAULT_LOW_THRESHOLD = Duration.ofSeconds(10);
    public static final Duration DEFAULT_NORMAL_THRESHOLD = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SWEEP_PERIOD = Duration.ofSeconds(1);

    /**
     * A promotion performed by a sweep.
     */
    public record Escalation(String entryId, String backendId, Priority from, Priority to, Duration waited) {
    }

    private volatile Duration lowThreshold;
    private volatile Duration normalThreshold;
    private final SweepMode mode;
    private final Duration period;

    public StarvationGuard(Duration lowThreshold, Duration normalThreshold, SweepMode mode, Duration period) {
        this.mode = Objects.requireNonNull(mode, "Sweep mode is required");
        this.period = requirePositive(period, "Sweep period");
        updateThresholds(lowThreshold, normalThreshold);
    }

    public static StarvationGuard defaults() {
        return new StarvationGuard(DEFAULT_LOW_THRESHOLD, DEFAULT_NORMAL_THRESHOLD,
                SweepMode.BOTH, DEFAULT_SWEEP_PERIOD);
    }

    public void updateThresholds(Duration lowThreshold, Duration normalThreshold) {
        this.lowThreshold = requirePositive(lowThreshold, "LOW threshold");
        this.normalThreshold = requirePositive(normalThreshold, "NORMAL threshold");
        log.info("Starvation thresholds set: low={}, normal={}", lowThreshold, normalThreshold);
    }

    /**
     * Wait after which an entry at this level gets promoted; empty for HIGH.
     */
    public Optional<Duration> thresholdFor(Priority priority) {
        return switch (priority) {
            case LOW -> Optional.of(lowThreshold);
            case NORMAL -> Optional.of(normalThreshold);
            case HIGH -> Optional.empty();
        };
    }

    public SweepMode getMode() {
        return mode;
    }

    public Duration getPeriod() {
        return period;
    }

    /**
     * Promotes every overdue entry of every backend by one level.
     *
     * @return the promotions performed, in the order they happened
     */
    public <T> List<Escalation> sweep(PriorityQueueManager<T> queues, Instant now) {
        List<Escalation> escalations = new ArrayList<>();
        for (String backendId : queues.getQueuedBackendIds()) {
            // NORMAL before LOW, so an entry promoted from LOW is not seen again at NORMAL
            promoteOverdue(queues, backendId, Priority.NORMAL, now, escalations);
            promoteOverdue(queues, backendId, Priority.LOW, now, escalations);
        }
        if (!escalations.isEmpty()) {
            log.debug("Starvation sweep done: escalations={}", escalations.size());
        }
        return escalations;
    }

    private <T> void promoteOverdue(
            PriorityQueueManager<T> queues,
            String backendId,
            Priority level,
            Instant now,
            List<Escalation> escalations
    ) {
        Duration threshold = thresholdFor(level).orElseThrow();
        Priority target = level.next().orElseThrow();
        for (QueueEntry<T> entry : queues.getEntriesForPriority(backendId, level)) {
            Duration waited = entry.waitTime(now);
            if (waited.compareTo(threshold) < 0) {
                // Entries within a level are in enqueue order only until promotions mix them
                continue;
            }
            if (queues.movePriority(entry.getEntryId(), target)) {
                escalations.add(new Escalation(entry.getEntryId(), backendId, level, target, waited));
            }
        }
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " is required");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }
}
