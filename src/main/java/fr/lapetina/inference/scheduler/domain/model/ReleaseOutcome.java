package fr.lapetina.inference.scheduler.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * What happened to a granted request, reported by the executor when it
 * hands its slot back.
 */
public record ReleaseOutcome(String requestId, Status status, Duration duration) {

    public enum Status {
        SUCCESS,
        FAILURE,
        TIMEOUT,
        CANCELLED
    }

    public ReleaseOutcome {
        Objects.requireNonNull(status, "Status is required");
        if (requestId == null) {
            requestId = "unknown";
        }
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    public static ReleaseOutcome success(String requestId, Duration duration) {
        return new ReleaseOutcome(requestId, Status.SUCCESS, duration);
    }

    public static ReleaseOutcome failure(String requestId, Duration duration) {
        return new ReleaseOutcome(requestId, Status.FAILURE, duration);
    }

    public static ReleaseOutcome of(String requestId, Status status) {
        return new ReleaseOutcome(requestId, status, Duration.ZERO);
    }
}
