package fr.lapetina.inference.scheduler.domain.scheduler;

import fr.lapetina.inference.scheduler.domain.model.CapacitySnapshot;
import fr.lapetina.inference.scheduler.domain.model.ReleaseOutcome;
import fr.lapetina.inference.scheduler.domain.model.SchedulingRequest;
import fr.lapetina.inference.scheduler.domain.model.SchedulingResult;
import fr.lapetina.inference.scheduler.domain.queue.PriorityQueueManager;
import fr.lapetina.inference.scheduler.domain.queue.QueueEntry;
import fr.lapetina.inference.scheduler.domain.queue.QueueState;
import fr.lapetina.inference.scheduler.infrastructure.capacity.BackendRegistry;
import fr.lapetina.inference.scheduler.infrastructure.metrics.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Production policy: grants the first ranked candidate with live capacity,
 * otherwise queues the caller on the first-ranked candidate's priority queue.
 *
 * <p>Never blocks the calling thread. A queued request is a pending future,
 * resolved by a later {@link #release}, by a stats update that frees capacity,
 * by its deadline, or by the caller cancelling it.
 *
 * <p>Concurrency:
 * <ul>
 *   <li>Capacity evaluation and enqueue run under one admission lock, and so
 *       does the release decision, so a release can never slip between a
 *       failed evaluation and the enqueue that follows it.</li>
 *   <li>A release with a waiter hands its slot over directly: the backend's
 *       in-flight count does not change.</li>
 *   <li>Futures are completed outside every lock.</li>
 *   <li>Queue removal by entry id decides races between timeout, cancellation
 *       and grant: whoever removes the entry owns its outcome.</li>
 * </ul>
 */
public final class UtilizationAwareScheduler implements Scheduler {

    private static final Logger log = LoggerFactory.getLogger(UtilizationAwareScheduler.class);

    public static final String NAME = "utilization";

    private static final String MDC_REQUEST_ID = "requestId";

    private final SchedulingSupport support;
    private final PriorityQueueManager<PendingGrant> queues;
    private final Duration defaultTimeout;
    private final ReentrantLock admissionLock = new ReentrantLock();
    private final ScheduledExecutorService timer;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param defaultTimeout queue timeout for requests that carry none; zero waits indefinitely
     */
    public UtilizationAwareScheduler(
            BackendRegistry registry,
            StarvationGuard starvationGuard,
            SchedulerMetrics metrics,
            Clock clock,
            Duration defaultTimeout
    ) {
        Objects.requireNonNull(defaultTimeout, "Default timeout is required");
        if (defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("Default timeout must not be negative: " + defaultTimeout);
        }
        this.support = new SchedulingSupport(registry, starvationGuard, metrics, clock);
        this.queues = support.queues();
        this.defaultTimeout = defaultTimeout;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scheduler-timer");
            t.setDaemon(true);
            return t;
        });

        if (starvationGuard.getMode().sweepsPeriodically()) {
            long periodMs = starvationGuard.getPeriod().toMillis();
            timer.scheduleWithFixedDelay(this::maintain, periodMs, periodMs, TimeUnit.MILLISECONDS);
        }
        log.info("Utilization-aware scheduler started: backends={}, defaultTimeout={}, sweepMode={}, sweepPeriod={}",
                registry.size(), defaultTimeout, starvationGuard.getMode(), starvationGuard.getPeriod());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public CompletableFuture<SchedulingResult> schedule(SchedulingRequest request) {
        Objects.requireNonNull(request, "Request is required");
        MDC.put(MDC_REQUEST_ID, request.requestId());
        try {
            if (closed.get()) {
                return CompletableFuture.completedFuture(
                        support.record(SchedulingResult.rejected(request.requestId(), request.priority(),
                                "Scheduler is closed")));
            }
            Optional<String> invalid = support.validate(request);
            if (invalid.isPresent()) {
                log.warn("Request rejected: requestId={}, reason={}", request.requestId(), invalid.get());
                return CompletableFuture.completedFuture(
                        support.record(SchedulingResult.rejected(request.requestId(), request.priority(),
                                invalid.get())));
            }
            return admit(request);
        } catch (RuntimeException e) {
            log.error("Scheduling failed: requestId={}", request.requestId(), e);
            return CompletableFuture.completedFuture(
                    support.record(SchedulingResult.rejected(request.requestId(), request.priority(),
                            "Internal error: " + e.getMessage())));
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private CompletableFuture<SchedulingResult> admit(SchedulingRequest request) {
        SchedulingResult granted = null;
        PendingGrant pending = null;

        admissionLock.lock();
        try {
            for (SchedulingRequest.Candidate candidate : request.candidates()) {
                String backendId = candidate.backendId();
                Optional<CapacitySnapshot> snapshot = support.capacityOf(backendId);
                if (snapshot.isEmpty() || !snapshot.get().hasCapacity()) {
                    log.debug("Candidate saturated: requestId={}, backendId={}, freeSlots={}",
                            request.requestId(), backendId, snapshot.map(CapacitySnapshot::freeSlots).orElse(0));
                    continue;
                }
                // Cold start is judged before our own reservation changes the in-flight count
                boolean coldStart = snapshot.get().predictsColdStart();
                if (support.tryReserve(backendId)) {
                    granted = SchedulingResult.granted(request.requestId(), backendId, false,
                            queues.getTotalDepth(backendId), Duration.ZERO, coldStart,
                            request.priority(), snapshot.get().metrics());
                    break;
                }
                log.debug("Reservation lost: requestId={}, backendId={}", request.requestId(), backendId);
            }

            if (granted == null) {
                if (closed.get()) {
                    return CompletableFuture.completedFuture(support.record(SchedulingResult.rejected(
                            request.requestId(), request.priority(), "Scheduler is closed")));
                }
                String backendId = request.firstCandidate().orElseThrow().backendId();
                pending = new PendingGrant(request, backendId, new CompletableFuture<>());
                String entryId = queues.enqueue(pending, backendId, request.priority());
                pending.queued(entryId, queues.getTotalDepth(backendId));
            }
        } finally {
            admissionLock.unlock();
        }

        if (granted != null) {
            log.info("Request granted: requestId={}, backendId={}, priority={}, coldStart={}",
                    granted.requestId(), granted.backendId(), request.priority(), granted.coldStart());
            return CompletableFuture.completedFuture(support.record(granted));
        }

        suspend(pending);
        return pending.future();
    }

    private void suspend(PendingGrant pending) {
        SchedulingRequest request = pending.request();
        Duration timeout = support.effectiveTimeout(request, defaultTimeout);

        log.info("Request queued: requestId={}, backendId={}, priority={}, depth={}, timeout={}",
                request.requestId(), pending.backendId(), request.priority(),
                pending.depthAtEnqueue(), timeout.isZero() ? "none" : timeout);

        pending.future().whenComplete((result, error) -> {
            if (pending.future().isCancelled()) {
                withdraw(pending);
            }
        });

        if (!timeout.isZero()) {
            try {
                pending.armTimeout(timer.schedule(() -> expire(pending), timeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (RejectedExecutionException e) {
                // close() won the race; if it did not already reject the entry, do it here
                queues.remove(pending.entryId()).ifPresent(entry -> pending.future().complete(
                        support.record(SchedulingResult.rejected(pending.requestId(),
                                entry.getCurrentPriority(), "Scheduler is closed"))));
            }
        }
    }

    private void expire(PendingGrant pending) {
        MDC.put(MDC_REQUEST_ID, pending.requestId());
        try {
            Optional<QueueEntry<PendingGrant>> removed = queues.remove(pending.entryId());
            if (removed.isEmpty()) {
                return;
            }
            QueueEntry<PendingGrant> entry = removed.get();
            SchedulingResult result = SchedulingResult.timedOut(pending.requestId(), pending.backendId(),
                    pending.depthAtEnqueue(), entry.waitTime(support.now()), entry.getCurrentPriority());
            log.info("Request timed out: requestId={}, backendId={}, waitedMs={}, priority={}",
                    pending.requestId(), pending.backendId(), result.queueWait().toMillis(),
                    entry.getCurrentPriority());
            pending.future().complete(support.record(result));
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private void withdraw(PendingGrant pending) {
        Optional<QueueEntry<PendingGrant>> removed = queues.remove(pending.entryId());
        pending.disarmTimeout();
        if (removed.isPresent()) {
            log.info("Queued request cancelled: requestId={}, backendId={}, waitedMs={}",
                    pending.requestId(), pending.backendId(),
                    removed.get().waitTime(support.now()).toMillis());
        } else {
            log.debug("Cancelled request already dequeued: requestId={}", pending.requestId());
        }
    }

    @Override
    public void release(String backendId, ReleaseOutcome outcome) {
        Objects.requireNonNull(outcome, "Outcome is required");
        if (!support.isKnown(backendId)) {
            log.warn("Release for unknown backend ignored: backendId={}, requestId={}",
                    backendId, outcome.requestId());
            return;
        }
        support.recordRelease(backendId, outcome);
        log.debug("Release: backendId={}, requestId={}, status={}, durationMs={}",
                backendId, outcome.requestId(), outcome.status(), outcome.duration().toMillis());

        if (support.starvationGuard().getMode().sweepsOnRelease()) {
            support.sweep();
        }
        handOff(backendId, outcome.requestId());
    }

    /**
     * Passes one held slot of the backend to the next live waiter, or frees it.
     */
    private void handOff(String backendId, String releasedBy) {
        while (true) {
            QueueEntry<PendingGrant> next;
            admissionLock.lock();
            try {
                if (support.inFlight(backendId) == 0) {
                    log.warn("Release without outstanding grant ignored: backendId={}, requestId={}",
                            backendId, releasedBy);
                    return;
                }
                if (queues.peek(backendId).isEmpty()) {
                    support.releaseSlot(backendId);
                    return;
                }
                if (!support.transferSlot(backendId)) {
                    // Waiters stay queued until a stats update lets drain serve them
                    support.releaseSlot(backendId);
                    log.debug("Slot freed, provider budget refuses hand-off: backendId={}, depth={}",
                            backendId, queues.getTotalDepth(backendId));
                    return;
                }
                Optional<QueueEntry<PendingGrant>> dequeued = queues.dequeueWithEntry(backendId);
                if (dequeued.isEmpty()) {
                    support.releaseSlot(backendId);
                    return;
                }
                next = dequeued.get();
            } finally {
                admissionLock.unlock();
            }

            // A handed-over slot is busy, so the model is warm
            if (grantQueued(next, false)) {
                return;
            }
        }
    }

    /**
     * Completes a dequeued waiter with the slot the caller holds for it.
     *
     * @return false if the waiter had already been cancelled; the slot is still held
     */
    private boolean grantQueued(QueueEntry<PendingGrant> entry, boolean coldStart) {
        PendingGrant pending = entry.getTask();
        pending.disarmTimeout();
        Map<String, Object> providerMetrics = support.capacityOf(pending.backendId())
                .map(CapacitySnapshot::metrics)
                .orElse(Map.of());
        SchedulingResult result = SchedulingResult.granted(pending.requestId(), pending.backendId(), true,
                pending.depthAtEnqueue(), entry.waitTime(support.now()), coldStart,
                entry.getCurrentPriority(), providerMetrics);

        if (!pending.future().complete(result)) {
            log.debug("Waiter gone before grant: requestId={}, backendId={}", pending.requestId(), pending.backendId());
            return false;
        }
        support.record(result);
        log.info("Queued request granted: requestId={}, backendId={}, waitedMs={}, priority={}, escalations={}",
                pending.requestId(), pending.backendId(), result.queueWait().toMillis(),
                entry.getCurrentPriority(), entry.getEscalationCount());
        return true;
    }

    /**
     * Grants waiters of a backend while it has fresh capacity that no release announced.
     */
    private void drain(String backendId) {
        while (true) {
            QueueEntry<PendingGrant> next;
            boolean coldStart;
            admissionLock.lock();
            try {
                if (queues.peek(backendId).isEmpty()) {
                    return;
                }
                Optional<CapacitySnapshot> snapshot = support.capacityOf(backendId);
                if (snapshot.isEmpty() || !snapshot.get().hasCapacity() || !support.tryReserve(backendId)) {
                    return;
                }
                coldStart = snapshot.get().predictsColdStart();
                Optional<QueueEntry<PendingGrant>> dequeued = queues.dequeueWithEntry(backendId);
                if (dequeued.isEmpty()) {
                    support.releaseSlot(backendId);
                    return;
                }
                next = dequeued.get();
            } finally {
                admissionLock.unlock();
            }

            if (!grantQueued(next, coldStart)) {
                handOff(backendId, next.getTask().requestId());
            }
        }
    }

    @Override
    public QueueState queueDepth(String backendId) {
        return queues.getState(backendId);
    }

    @Override
    public QueueMetrics queueMetrics() {
        return support.queueMetrics();
    }

    @Override
    public void updateProviderStats(String providerId, Map<String, String> stats) {
        Objects.requireNonNull(stats, "Stats are required");
        Set<String> affected;
        try {
            affected = support.applyStats(providerId, stats);
        } catch (RuntimeException e) {
            log.warn("Stats update failed: providerId={}, error={}", providerId, e.getMessage());
            return;
        }
        for (String backendId : affected) {
            drain(backendId);
        }
    }

    /**
     * Periodic sweep plus a drain of every queued backend.
     */
    void maintain() {
        try {
            support.sweep();
            for (String backendId : queues.getQueuedBackendIds()) {
                drain(backendId);
            }
        } catch (RuntimeException e) {
            log.error("Scheduler maintenance failed", e);
        }
    }

    @Override
    public void close() {
        admissionLock.lock();
        try {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
        } finally {
            admissionLock.unlock();
        }
        timer.shutdownNow();
        int rejected = 0;
        for (String backendId : queues.getQueuedBackendIds()) {
            Optional<QueueEntry<PendingGrant>> entry;
            while ((entry = queues.dequeueWithEntry(backendId)).isPresent()) {
                PendingGrant pending = entry.get().getTask();
                pending.future().complete(support.record(SchedulingResult.rejected(pending.requestId(),
                        entry.get().getCurrentPriority(), "Scheduler is closed")));
                rejected++;
            }
        }
        log.info("Utilization-aware scheduler closed: rejectedWaiters={}", rejected);
    }
}
