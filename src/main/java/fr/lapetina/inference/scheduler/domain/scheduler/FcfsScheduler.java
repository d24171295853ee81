package fr.lapetina.inference.scheduler.domain.scheduler;

import fr.lapetina.inference.scheduler.domain.model.CapacitySnapshot;
import fr.lapetina.inference.scheduler.domain.model.ReleaseOutcome;
import fr.lapetina.inference.scheduler.domain.model.SchedulingRequest;
import fr.lapetina.inference.scheduler.domain.model.SchedulingResult;
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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Baseline policy: the first ranked candidate with any free capacity wins.
 *
 * When every candidate is saturated the calling thread blocks until a release
 * or a stats update signals free capacity, or until the request's deadline.
 * There is no queue and no priority treatment, so waiting callers race for
 * each freed slot. Use it as a reference point, not in production.
 */
public final class FcfsScheduler implements Scheduler {

    private static final Logger log = LoggerFactory.getLogger(FcfsScheduler.class);

    public static final String NAME = "fcfs";

    private static final String MDC_REQUEST_ID = "requestId";

    private final SchedulingSupport support;
    private final Duration defaultTimeout;
    private final Duration pollInterval;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition capacityChanged = lock.newCondition();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param defaultTimeout how long a caller may block when its request carries no timeout; zero blocks indefinitely
     * @param pollInterval   re-check period while blocked, for capacity that frees without a signal
     */
    public FcfsScheduler(
            BackendRegistry registry,
            StarvationGuard starvationGuard,
            SchedulerMetrics metrics,
            Clock clock,
            Duration defaultTimeout,
            Duration pollInterval
    ) {
        Objects.requireNonNull(defaultTimeout, "Default timeout is required");
        Objects.requireNonNull(pollInterval, "Poll interval is required");
        if (defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("Default timeout must not be negative: " + defaultTimeout);
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
        }
        this.support = new SchedulingSupport(registry, starvationGuard, metrics, clock);
        this.defaultTimeout = defaultTimeout;
        this.pollInterval = pollInterval;
        log.info("FCFS scheduler started: backends={}, defaultTimeout={}, pollInterval={}",
                registry.size(), defaultTimeout, pollInterval);
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Blocks the calling thread while every candidate is saturated; the returned future is always complete.
     */
    @Override
    public CompletableFuture<SchedulingResult> schedule(SchedulingRequest request) {
        Objects.requireNonNull(request, "Request is required");
        MDC.put(MDC_REQUEST_ID, request.requestId());
        try {
            Optional<String> invalid = closed.get() ? Optional.of("Scheduler is closed") : support.validate(request);
            if (invalid.isPresent()) {
                log.warn("Request rejected: requestId={}, reason={}", request.requestId(), invalid.get());
                return CompletableFuture.completedFuture(support.record(
                        SchedulingResult.rejected(request.requestId(), request.priority(), invalid.get())));
            }
            return CompletableFuture.completedFuture(support.record(await(request)));
        } catch (RuntimeException e) {
            log.error("Scheduling failed: requestId={}", request.requestId(), e);
            return CompletableFuture.completedFuture(support.record(SchedulingResult.rejected(
                    request.requestId(), request.priority(), "Internal error: " + e.getMessage())));
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private SchedulingResult await(SchedulingRequest request) {
        Duration timeout = support.effectiveTimeout(request, defaultTimeout);
        long start = System.nanoTime();
        long deadline = timeout.isZero() ? Long.MAX_VALUE : start + timeout.toNanos();
        boolean waited = false;

        lock.lock();
        try {
            while (true) {
                if (closed.get()) {
                    return SchedulingResult.rejected(request.requestId(), request.priority(), "Scheduler is closed");
                }
                for (SchedulingRequest.Candidate candidate : request.candidates()) {
                    Optional<CapacitySnapshot> snapshot = support.capacityOf(candidate.backendId());
                    if (snapshot.isEmpty() || !snapshot.get().hasCapacity()) {
                        continue;
                    }
                    boolean coldStart = snapshot.get().predictsColdStart();
                    if (support.tryReserve(candidate.backendId())) {
                        Duration wait = Duration.ofNanos(System.nanoTime() - start);
                        log.info("Request granted: requestId={}, backendId={}, waitedMs={}, coldStart={}",
                                request.requestId(), candidate.backendId(), wait.toMillis(), coldStart);
                        return SchedulingResult.granted(request.requestId(), candidate.backendId(), waited,
                                0, wait, coldStart, request.priority(), snapshot.get().metrics());
                    }
                }

                long remaining = deadline == Long.MAX_VALUE ? Long.MAX_VALUE : deadline - System.nanoTime();
                if (remaining <= 0) {
                    Duration wait = Duration.ofNanos(System.nanoTime() - start);
                    String backendId = request.firstCandidate().orElseThrow().backendId();
                    log.info("Request timed out: requestId={}, backendId={}, waitedMs={}",
                            request.requestId(), backendId, wait.toMillis());
                    return SchedulingResult.timedOut(request.requestId(), backendId, 0, wait, request.priority());
                }
                if (!waited) {
                    log.debug("All candidates saturated, blocking: requestId={}", request.requestId());
                    waited = true;
                }
                capacityChanged.await(Math.min(remaining, pollInterval.toNanos()), TimeUnit.NANOSECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for capacity: requestId={}", request.requestId());
            return SchedulingResult.rejected(request.requestId(), request.priority(), "Interrupted");
        } finally {
            lock.unlock();
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
        if (!support.releaseSlot(backendId)) {
            log.warn("Release without outstanding grant ignored: backendId={}, requestId={}",
                    backendId, outcome.requestId());
            return;
        }
        signalCapacity();
    }

    /**
     * Always empty: blocked callers are threads, not queue entries.
     */
    @Override
    public QueueState queueDepth(String backendId) {
        return QueueState.EMPTY;
    }

    @Override
    public QueueMetrics queueMetrics() {
        return QueueMetrics.EMPTY;
    }

    @Override
    public void updateProviderStats(String providerId, Map<String, String> stats) {
        Objects.requireNonNull(stats, "Stats are required");
        try {
            if (!support.applyStats(providerId, stats).isEmpty()) {
                signalCapacity();
            }
        } catch (RuntimeException e) {
            log.warn("Stats update failed: providerId={}, error={}", providerId, e.getMessage());
        }
    }

    private void signalCapacity() {
        lock.lock();
        try {
            capacityChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            signalCapacity();
            log.info("FCFS scheduler closed");
        }
    }
}
