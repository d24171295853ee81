package fr.lapetina.inference.scheduler.infrastructure.metrics;

import fr.lapetina.inference.scheduler.domain.model.Priority;
import fr.lapetina.inference.scheduler.domain.model.ReleaseOutcome;
import fr.lapetina.inference.scheduler.domain.model.SchedulingResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Scheduler metrics using Micrometer.
 *
 * Provides:
 * - Admission decisions per backend and outcome
 * - Queue wait histograms per backend
 * - Escalation counters per level transition
 * - Releases per backend and status
 * - Queue depth and in-flight gauges
 * - Prometheus exposition
 */
public final class SchedulerMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerMetrics.class);

    private static final String NO_BACKEND = "none";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> decisionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> waitTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> escalationCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> releaseCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> coldStartCounters = new ConcurrentHashMap<>();
    private final Set<String> registeredGauges = ConcurrentHashMap.newKeySet();

    public SchedulerMetrics(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        log.info("SchedulerMetrics initialized with prefix: {}", prefix);
    }

    public SchedulerMetrics() {
        this("inference_scheduler");
    }

    /**
     * Counts an admission decision. Rejections without a backend are tagged {@code none}.
     */
    public void recordDecision(SchedulingResult result) {
        String backend = result.backendId() != null ? result.backendId() : NO_BACKEND;
        String outcome = result.outcome().name();
        String queued = Boolean.toString(result.wasQueued());
        decisionCounters.computeIfAbsent(backend + ":" + outcome + ":" + queued, k ->
                Counter.builder(prefix + "_decisions_total")
                        .description("Admission decisions")
                        .tag("backend", backend)
                        .tag("outcome", outcome)
                        .tag("queued", queued)
                        .register(registry)
        ).increment();

        if (result.wasQueued()) {
            waitTimers.computeIfAbsent(backend, k ->
                    Timer.builder(prefix + "_queue_wait")
                            .description("Time spent waiting in a backend queue")
                            .tag("backend", backend)
                            .publishPercentileHistogram()
                            .publishPercentiles(0.5, 0.9, 0.99)
                            .register(registry)
            ).record(result.queueWait());
        }

        if (result.isGranted() && result.coldStart()) {
            coldStartCounters.computeIfAbsent(backend, k ->
                    Counter.builder(prefix + "_cold_starts_total")
                            .description("Grants predicted to pay a model load")
                            .tag("backend", backend)
                            .register(registry)
            ).increment();
        }
    }

    public void recordEscalation(String backendId, Priority from, Priority to) {
        escalationCounters.computeIfAbsent(backendId + ":" + from + ":" + to, k ->
                Counter.builder(prefix + "_escalations_total")
                        .description("Anti-starvation priority promotions")
                        .tag("backend", backendId)
                        .tag("from", from.name())
                        .tag("to", to.name())
                        .register(registry)
        ).increment();
    }

    public void recordRelease(String backendId, ReleaseOutcome outcome) {
        String status = outcome.status().name();
        releaseCounters.computeIfAbsent(backendId + ":" + status, k ->
                Counter.builder(prefix + "_releases_total")
                        .description("Slots handed back by executors")
                        .tag("backend", backendId)
                        .tag("status", status)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a queue depth gauge for a backend and priority level. Idempotent.
     */
    public void registerQueueDepth(String backendId, Priority priority, Supplier<Number> depth) {
        if (registeredGauges.add("depth:" + backendId + ":" + priority)) {
            Gauge.builder(prefix + "_queue_depth", depth, s -> s.get().doubleValue())
                    .description("Queued requests per backend and priority")
                    .tag("backend", backendId)
                    .tag("priority", priority.name())
                    .register(registry);
        }
    }

    /**
     * Registers an in-flight gauge for a backend. Idempotent.
     */
    public void registerInFlight(String backendId, Supplier<Number> inFlight) {
        if (registeredGauges.add("inflight:" + backendId)) {
            Gauge.builder(prefix + "_backend_inflight", inFlight, s -> s.get().doubleValue())
                    .description("Requests holding a slot per backend")
                    .tag("backend", backendId)
                    .register(registry);
        }
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
