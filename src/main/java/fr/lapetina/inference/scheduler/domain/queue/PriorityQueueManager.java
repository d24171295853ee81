package fr.lapetina.inference.scheduler.domain.queue;

import fr.lapetina.inference.scheduler.domain.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-backend multi-level priority queue.
 *
 * Layout: {@code queues[backendId][priority]} is an insertion-ordered map of
 * entry id to entry, so enqueue, dequeue-oldest and removal by id are all O(1).
 * Dequeue always serves the highest non-empty level, FIFO within a level.
 *
 * Pure data structure: no scheduling policy, no I/O, no callbacks. Escalation is
 * only ever done by an explicit {@link #movePriority} call from the scheduler.
 *
 * Thread-safe: every operation runs under a single reentrant lock owned by the
 * instance, which keeps cross-backend figures (total depth) consistent.
 *
 * @param <T> the continuation type stored in each entry
 */
public final class PriorityQueueManager<T> {

    private static final Logger log = LoggerFactory.getLogger(PriorityQueueManager.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, EnumMap<Priority, LinkedHashMap<String, QueueEntry<T>>>> queues = new HashMap<>();
    private final Map<String, QueueEntry<T>> entries = new HashMap<>();
    private final Clock clock;
    private long entryCounter;

    public PriorityQueueManager(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    public PriorityQueueManager() {
        this(Clock.systemUTC());
    }

    /**
     * Adds a task at the tail of the backend's queue for the given priority.
     *
     * @return unique entry id, used later for escalation or removal
     */
    public String enqueue(T task, String backendId, Priority priority) {
        Objects.requireNonNull(backendId, "Backend ID is required");
        Objects.requireNonNull(priority, "Priority is required");
        lock.lock();
        try {
            entryCounter++;
            String entryId = "qe-" + backendId + "-" + entryCounter + "-"
                    + UUID.randomUUID().toString().substring(0, 8);
            QueueEntry<T> entry = new QueueEntry<>(entryId, task, backendId, priority, clock.instant());

            levelsFor(backendId).get(priority).put(entryId, entry);
            entries.put(entryId, entry);

            log.debug("Enqueued: entryId={}, backendId={}, priority={}", entryId, backendId, priority);
            return entryId;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the oldest task of the highest non-empty level. Never blocks.
     */
    public Optional<T> dequeue(String backendId) {
        return dequeueWithEntry(backendId).map(QueueEntry::getTask);
    }

    /**
     * Same as {@link #dequeue} but returns the whole entry, including its enqueue time.
     */
    public Optional<QueueEntry<T>> dequeueWithEntry(String backendId) {
        lock.lock();
        try {
            EnumMap<Priority, LinkedHashMap<String, QueueEntry<T>>> levels = queues.get(backendId);
            if (levels == null) {
                return Optional.empty();
            }
            for (Priority priority : Priority.DESCENDING) {
                Iterator<QueueEntry<T>> it = levels.get(priority).values().iterator();
                if (it.hasNext()) {
                    QueueEntry<T> entry = it.next();
                    it.remove();
                    entries.remove(entry.getEntryId());
                    log.debug("Dequeued: entryId={}, backendId={}, priority={}",
                            entry.getEntryId(), backendId, priority);
                    return Optional.of(entry);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the entry that the next dequeue would return, without removing it.
     */
    public Optional<QueueEntry<T>> peek(String backendId) {
        lock.lock();
        try {
            EnumMap<Priority, LinkedHashMap<String, QueueEntry<T>>> levels = queues.get(backendId);
            if (levels == null) {
                return Optional.empty();
            }
            for (Priority priority : Priority.DESCENDING) {
                LinkedHashMap<String, QueueEntry<T>> level = levels.get(priority);
                if (!level.isEmpty()) {
                    return Optional.of(level.values().iterator().next());
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves an entry to the tail of a higher level, keeping its original
     * enqueue time for wait accounting.
     *
     * @return true if moved (or already at that level), false if the entry is no longer queued
     * @throws IllegalArgumentException if the new priority is lower than the current one
     */
    public boolean movePriority(String entryId, Priority newPriority) {
        Objects.requireNonNull(newPriority, "Priority is required");
        lock.lock();
        try {
            QueueEntry<T> entry = entries.get(entryId);
            if (entry == null) {
                log.debug("Cannot move entry, not queued: entryId={}", entryId);
                return false;
            }
            Priority current = entry.getCurrentPriority();
            if (current == newPriority) {
                return true;
            }
            if (current.isHigherThan(newPriority)) {
                throw new IllegalArgumentException(
                        "Priority can only increase: entryId=" + entryId + ", " + current + " -> " + newPriority);
            }

            EnumMap<Priority, LinkedHashMap<String, QueueEntry<T>>> levels = levelsFor(entry.getBackendId());
            levels.get(current).remove(entryId);
            entry.escalate(newPriority, clock.instant());
            levels.get(newPriority).put(entryId, entry);

            log.info("Entry escalated: entryId={}, backendId={}, {} -> {}, escalations={}",
                    entryId, entry.getBackendId(), current, newPriority, entry.getEscalationCount());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a queued entry (timeout or cancellation). Has no capacity side effect.
     *
     * @return the removed entry, or empty if it was already dequeued or removed
     */
    public Optional<QueueEntry<T>> remove(String entryId) {
        lock.lock();
        try {
            QueueEntry<T> entry = entries.remove(entryId);
            if (entry == null) {
                return Optional.empty();
            }
            levelsFor(entry.getBackendId()).get(entry.getCurrentPriority()).remove(entryId);
            log.debug("Entry removed: entryId={}, backendId={}", entryId, entry.getBackendId());
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of the entries currently at one level of a backend's queue, in dequeue order.
     */
    public List<QueueEntry<T>> getEntriesForPriority(String backendId, Priority priority) {
        lock.lock();
        try {
            EnumMap<Priority, LinkedHashMap<String, QueueEntry<T>>> levels = queues.get(backendId);
            if (levels == null) {
                return List.of();
            }
            return List.copyOf(levels.get(priority).values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<QueueEntry<T>> getEntry(String entryId) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(entryId));
        } finally {
            lock.unlock();
        }
    }

    public QueueState getState(String backendId) {
        lock.lock();
        try {
            EnumMap<Priority, LinkedHashMap<String, QueueEntry<T>>> levels = queues.get(backendId);
            if (levels == null) {
                return QueueState.EMPTY;
            }
            return new QueueState(
                    levels.get(Priority.LOW).size(),
                    levels.get(Priority.NORMAL).size(),
                    levels.get(Priority.HIGH).size()
            );
        } finally {
            lock.unlock();
        }
    }

    public int getTotalDepth(String backendId) {
        return getState(backendId).total();
    }

    /**
     * Total queued entries across all backends.
     */
    public int getTotalDepth() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Backends that currently have at least one queued entry.
     */
    public List<String> getQueuedBackendIds() {
        lock.lock();
        try {
            List<String> result = new ArrayList<>();
            for (Map.Entry<String, EnumMap<Priority, LinkedHashMap<String, QueueEntry<T>>>> e : queues.entrySet()) {
                if (e.getValue().values().stream().anyMatch(level -> !level.isEmpty())) {
                    result.add(e.getKey());
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return entries.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private EnumMap<Priority, LinkedHashMap<String, QueueEntry<T>>> levelsFor(String backendId) {
        return queues.computeIfAbsent(backendId, k -> {
            EnumMap<Priority, LinkedHashMap<String, QueueEntry<T>>> levels = new EnumMap<>(Priority.class);
            for (Priority priority : Priority.values()) {
                levels.put(priority, new LinkedHashMap<>());
            }
            return levels;
        });
    }
}
