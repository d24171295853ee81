package fr.lapetina.inference.scheduler.domain.scheduler;

import fr.lapetina.inference.scheduler.domain.model.Backend;
import fr.lapetina.inference.scheduler.domain.model.CapacitySnapshot;
import fr.lapetina.inference.scheduler.domain.model.Priority;
import fr.lapetina.inference.scheduler.domain.model.ReleaseOutcome;
import fr.lapetina.inference.scheduler.domain.model.SchedulingRequest;
import fr.lapetina.inference.scheduler.domain.model.SchedulingResult;
import fr.lapetina.inference.scheduler.domain.queue.PriorityQueueManager;
import fr.lapetina.inference.scheduler.domain.queue.QueueEntry;
import fr.lapetina.inference.scheduler.domain.queue.QueueState;
import fr.lapetina.inference.scheduler.infrastructure.capacity.BackendRegistry;
import fr.lapetina.inference.scheduler.infrastructure.capacity.CapacityFacade;
import fr.lapetina.inference.scheduler.infrastructure.metrics.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Logic shared by the scheduling policies, used by composition.
 *
 * Owns the queue manager and dispatches capacity calls to the facade resolved
 * for each backend at registration. Facade failures never escape: a candidate
 * whose facade throws is treated as having no capacity.
 */
final class SchedulingSupport {

    private static final Logger log = LoggerFactory.getLogger(SchedulingSupport.class);

    private final BackendRegistry registry;
    private final PriorityQueueManager<PendingGrant> queues;
    private final StarvationGuard starvationGuard;
    private final SchedulerMetrics metrics;
    private final Clock clock;

    SchedulingSupport(
            BackendRegistry registry,
            StarvationGuard starvationGuard,
            SchedulerMetrics metrics,
            Clock clock
    ) {
        this.registry = Objects.requireNonNull(registry, "Backend registry is required");
        this.starvationGuard = Objects.requireNonNull(starvationGuard, "Starvation guard is required");
        this.metrics = Objects.requireNonNull(metrics, "Metrics are required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.queues = new PriorityQueueManager<>(clock);
        registerGauges();
    }

    PriorityQueueManager<PendingGrant> queues() {
        return queues;
    }

    StarvationGuard starvationGuard() {
        return starvationGuard;
    }

    Clock clock() {
        return clock;
    }

    Instant now() {
        return clock.instant();
    }

    /**
     * Admission checks run before any queue mutation.
     *
     * @return the rejection reason, or empty if the request is admissible
     */
    Optional<String> validate(SchedulingRequest request) {
        if (request.candidates().isEmpty()) {
            return Optional.of("No candidate backends");
        }
        for (SchedulingRequest.Candidate candidate : request.candidates()) {
            if (!registry.contains(candidate.backendId())) {
                return Optional.of("Unknown backend: " + candidate.backendId());
            }
        }
        return Optional.empty();
    }

    boolean isKnown(String backendId) {
        return registry.contains(backendId);
    }

    /**
     * Queue timeout for a request: its own, else the default. Zero means no deadline.
     */
    Duration effectiveTimeout(SchedulingRequest request, Duration defaultTimeout) {
        return request.timeoutOption().orElse(defaultTimeout);
    }

    /**
     * Live capacity of a backend, or empty when its facade failed.
     */
    Optional<CapacitySnapshot> capacityOf(String backendId) {
        Optional<CapacityFacade> facade = registry.facadeFor(backendId);
        if (facade.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(facade.get().currentCapacity(backendId));
        } catch (RuntimeException e) {
            log.warn("Capacity query failed, treating backend as unavailable: backendId={}, error={}",
                    backendId, e.getMessage());
            return Optional.empty();
        }
    }

    boolean tryReserve(String backendId) {
        Optional<CapacityFacade> facade = registry.facadeFor(backendId);
        if (facade.isEmpty()) {
            return false;
        }
        try {
            return facade.get().tryReserve(backendId);
        } catch (RuntimeException e) {
            log.warn("Slot reservation failed: backendId={}, error={}", backendId, e.getMessage());
            return false;
        }
    }

    /**
     * Asks the backend's facade to let a held slot pass to a waiter.
     * A facade failure counts as a refusal.
     */
    boolean transferSlot(String backendId) {
        Optional<CapacityFacade> facade = registry.facadeFor(backendId);
        if (facade.isEmpty()) {
            return false;
        }
        try {
            return facade.get().transfer(backendId);
        } catch (RuntimeException e) {
            log.warn("Slot transfer failed: backendId={}, error={}", backendId, e.getMessage());
            return false;
        }
    }

    /**
     * Frees one slot on the backend's facade.
     *
     * @return false if no slot was outstanding
     */
    boolean releaseSlot(String backendId) {
        CapacityFacade facade = registry.facadeFor(backendId).orElseThrow(
                () -> new IllegalArgumentException("Unknown backend: " + backendId));
        return facade.release(backendId);
    }

    int inFlight(String backendId) {
        return capacityOf(backendId).map(CapacitySnapshot::inFlight).orElse(0);
    }

    /**
     * Routes stats to the right facade: a backend id goes to that backend, a
     * provider name to every facade serving the provider.
     *
     * @return the backends whose capacity may have changed
     */
    Set<String> applyStats(String providerId, Map<String, String> stats) {
        Set<String> affected = new HashSet<>();
        Optional<CapacityFacade> backendFacade = registry.facadeFor(providerId);
        if (backendFacade.isPresent()) {
            backendFacade.get().updateBackendStats(providerId, stats);
            affected.add(providerId);
        } else {
            for (CapacityFacade facade : registry.getFacades()) {
                if (facade.hasProvider(providerId)) {
                    facade.updateProviderStats(providerId, stats);
                    affected.addAll(facade.getBackendIds(providerId));
                }
            }
        }
        if (affected.isEmpty()) {
            log.warn("Stats for unknown provider or backend ignored: providerId={}", providerId);
        } else {
            log.debug("Stats applied: providerId={}, affectedBackends={}", providerId, affected);
        }
        return affected;
    }

    /**
     * Runs one anti-starvation sweep over all queues and counts the promotions.
     */
    List<StarvationGuard.Escalation> sweep() {
        List<StarvationGuard.Escalation> escalations = starvationGuard.sweep(queues, now());
        for (StarvationGuard.Escalation escalation : escalations) {
            metrics.recordEscalation(escalation.backendId(), escalation.from(), escalation.to());
        }
        return escalations;
    }

    QueueMetrics queueMetrics() {
        Instant now = now();
        Map<String, QueueState> depths = new HashMap<>();
        int total = 0;
        Duration oldest = Duration.ZERO;
        for (String backendId : queues.getQueuedBackendIds()) {
            QueueState state = queues.getState(backendId);
            depths.put(backendId, state);
            total += state.total();
            for (Priority priority : Priority.DESCENDING) {
                for (QueueEntry<PendingGrant> entry : queues.getEntriesForPriority(backendId, priority)) {
                    Duration waited = entry.waitTime(now);
                    if (waited.compareTo(oldest) > 0) {
                        oldest = waited;
                    }
                }
            }
        }
        return total == 0 ? QueueMetrics.EMPTY : new QueueMetrics(depths, total, oldest);
    }

    SchedulingResult record(SchedulingResult result) {
        metrics.recordDecision(result);
        return result;
    }

    void recordRelease(String backendId, ReleaseOutcome outcome) {
        metrics.recordRelease(backendId, outcome);
    }

    private void registerGauges() {
        for (Backend backend : registry.getAllBackends()) {
            String backendId = backend.getId();
            for (Priority priority : Priority.values()) {
                metrics.registerQueueDepth(backendId, priority, () -> queues.getState(backendId).count(priority));
            }
            metrics.registerInFlight(backendId, () -> inFlight(backendId));
        }
    }
}
