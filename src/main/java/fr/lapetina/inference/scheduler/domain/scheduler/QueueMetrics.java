package fr.lapetina.inference.scheduler.domain.scheduler;

import fr.lapetina.inference.scheduler.domain.queue.QueueState;

import java.time.Duration;
import java.util.Map;

/**
 * Aggregate queue figures for monitoring.
 *
 * @param depthByBackend per-backend depth, only backends with queued entries
 * @param totalDepth     entries queued across all backends
 * @param oldestWait     wait of the longest-queued entry, zero when nothing is queued
 */
public record QueueMetrics(Map<String, QueueState> depthByBackend, int totalDepth, Duration oldestWait) {

    public static final QueueMetrics EMPTY = new QueueMetrics(Map.of(), 0, Duration.ZERO);

    public QueueMetrics {
        depthByBackend = Map.copyOf(depthByBackend);
        if (oldestWait == null) {
            oldestWait = Duration.ZERO;
        }
    }
}
