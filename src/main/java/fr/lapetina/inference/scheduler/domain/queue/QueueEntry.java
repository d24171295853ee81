package fr.lapetina.inference.scheduler.domain.queue;

import fr.lapetina.inference.scheduler.domain.model.Priority;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A suspended caller waiting in a backend's queue.
 *
 * Owned by the {@link PriorityQueueManager} from enqueue until it is dequeued
 * or removed. The current priority and escalation counter only change through
 * {@link PriorityQueueManager#movePriority}, under the manager's lock; they are
 * volatile so snapshots can be read outside it.
 *
 * @param <T> the continuation type (typically a pending grant holding a future)
 */
public final class QueueEntry<T> {
    private final String entryId;
    private final T task;
    private final String backendId;
    private final Priority originalPriority;
    private final Instant enqueuedAt;

    private volatile Priority currentPriority;
    private volatile int escalationCount;
    private volatile Instant lastEscalatedAt;

    QueueEntry(String entryId, T task, String backendId, Priority priority, Instant enqueuedAt) {
        this.entryId = Objects.requireNonNull(entryId);
        this.task = Objects.requireNonNull(task, "Task is required");
        this.backendId = Objects.requireNonNull(backendId, "Backend ID is required");
        this.originalPriority = Objects.requireNonNull(priority, "Priority is required");
        this.currentPriority = priority;
        this.enqueuedAt = Objects.requireNonNull(enqueuedAt);
    }

    public String getEntryId() {
        return entryId;
    }

    public T getTask() {
        return task;
    }

    public String getBackendId() {
        return backendId;
    }

    public Priority getOriginalPriority() {
        return originalPriority;
    }

    public Priority getCurrentPriority() {
        return currentPriority;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public int getEscalationCount() {
        return escalationCount;
    }

    /**
     * When the entry was last escalated, or null if never.
     */
    public Instant getLastEscalatedAt() {
        return lastEscalatedAt;
    }

    public Duration waitTime(Instant now) {
        Duration waited = Duration.between(enqueuedAt, now);
        return waited.isNegative() ? Duration.ZERO : waited;
    }

    void escalate(Priority newPriority, Instant at) {
        this.currentPriority = newPriority;
        this.escalationCount++;
        this.lastEscalatedAt = at;
    }

    @Override
    public String toString() {
        return "QueueEntry{" +
                "entryId='" + entryId + '\'' +
                ", backendId='" + backendId + '\'' +
                ", priority=" + currentPriority +
                (escalationCount > 0 ? " (from " + originalPriority + ", escalations=" + escalationCount + ")" : "") +
                ", enqueuedAt=" + enqueuedAt +
                '}';
    }
}
