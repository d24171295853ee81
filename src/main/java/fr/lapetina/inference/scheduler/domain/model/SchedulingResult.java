package fr.lapetina.inference.scheduler.domain.model;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a scheduling decision.
 *
 * A GRANTED result carries the selected backend and obliges the caller to
 * call {@code release} exactly once for it. TIMED_OUT and REJECTED results
 * hold no slot. Immutable and thread-safe.
 */
public record SchedulingResult(
        String requestId,
        Outcome outcome,
        String backendId,
        boolean wasQueued,
        int queueDepthAtDecision,
        Duration queueWait,
        boolean coldStart,
        Priority priorityWhenScheduled,
        Map<String, Object> providerMetrics,
        String failureReason
) {
    public enum Outcome {
        GRANTED,
        TIMED_OUT,
        REJECTED
    }

    public SchedulingResult {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(outcome, "Outcome is required");
        if (outcome == Outcome.GRANTED) {
            Objects.requireNonNull(backendId, "Granted result requires a backend");
        }
        if (queueWait == null) {
            queueWait = Duration.ZERO;
        }
        providerMetrics = providerMetrics != null ? Map.copyOf(providerMetrics) : Map.of();
    }

    public static SchedulingResult granted(
            String requestId,
            String backendId,
            boolean wasQueued,
            int queueDepthAtDecision,
            Duration queueWait,
            boolean coldStart,
            Priority priority,
            Map<String, Object> providerMetrics
    ) {
        return new SchedulingResult(requestId, Outcome.GRANTED, backendId, wasQueued,
                queueDepthAtDecision, queueWait, coldStart, priority, providerMetrics, null);
    }

    public static SchedulingResult timedOut(
            String requestId,
            String backendId,
            int queueDepthAtDecision,
            Duration queueWait,
            Priority priority
    ) {
        return new SchedulingResult(requestId, Outcome.TIMED_OUT, backendId, true,
                queueDepthAtDecision, queueWait, false, priority, null,
                "Timed out after " + queueWait.toMillis() + "ms waiting for " + backendId);
    }

    public static SchedulingResult rejected(String requestId, Priority priority, String reason) {
        return new SchedulingResult(requestId, Outcome.REJECTED, null, false,
                0, Duration.ZERO, false, priority, null, reason);
    }

    public boolean isGranted() {
        return outcome == Outcome.GRANTED;
    }
}
