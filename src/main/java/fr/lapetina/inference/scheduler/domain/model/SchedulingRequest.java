package fr.lapetina.inference.scheduler.domain.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A request for a backend slot.
 *
 * Candidates arrive already ranked by the classifier (highest weight first);
 * schedulers filter them by capacity but never re-rank. The timeout bounds
 * the time spent waiting in a queue; when absent the scheduler default applies.
 * Immutable and thread-safe.
 */
public record SchedulingRequest(
        String requestId,
        List<Candidate> candidates,
        Priority priority,
        Duration timeout
) {
    public SchedulingRequest {
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        if (priority == null) {
            priority = Priority.NORMAL;
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must not be negative: " + timeout);
        }
    }

    /**
     * A ranked candidate backend and the weight the classifier gave it.
     */
    public record Candidate(String backendId, double weight) {
        public Candidate {
            Objects.requireNonNull(backendId, "Backend ID is required");
        }
    }

    public Optional<Duration> timeoutOption() {
        return Optional.ofNullable(timeout);
    }

    /**
     * The first-ranked candidate, which is where the request queues when
     * no candidate has capacity.
     */
    public Optional<Candidate> firstCandidate() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private final List<Candidate> candidates = new ArrayList<>();
        private Priority priority = Priority.NORMAL;
        private Duration timeout;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder candidate(String backendId, double weight) {
            this.candidates.add(new Candidate(backendId, weight));
            return this;
        }

        public Builder candidate(String backendId) {
            return candidate(backendId, 1.0);
        }

        public Builder candidates(List<Candidate> candidates) {
            this.candidates.addAll(candidates);
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public SchedulingRequest build() {
            return new SchedulingRequest(requestId, candidates, priority, timeout);
        }
    }
}
