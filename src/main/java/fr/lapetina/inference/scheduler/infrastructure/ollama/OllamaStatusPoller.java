package fr.lapetina.inference.scheduler.infrastructure.ollama;

import fr.lapetina.inference.scheduler.infrastructure.capacity.OllamaCapacityFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Background poller of Ollama servers' {@code /api/ps}.
 *
 * Each successful poll replaces the provider's loaded-model picture in the
 * facade and then calls the refresh callback, so the scheduler can grant
 * waiters that the new picture makes admissible. A failed poll is logged and
 * leaves the last known state in place.
 */
public final class OllamaStatusPoller implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OllamaStatusPoller.class);

    private record Target(URI baseUrl, Duration interval) {
    }

    private final OllamaCapacityFacade facade;
    private final OllamaStatusClient client;
    private final Consumer<String> onRefresh;
    private final Map<String, Target> targets = new ConcurrentHashMap<>();
    private final ScheduledExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param onRefresh called with the provider name after each successful poll
     */
    public OllamaStatusPoller(OllamaCapacityFacade facade, OllamaStatusClient client, Consumer<String> onRefresh) {
        this.facade = facade;
        this.client = client;
        this.onRefresh = onRefresh;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ollama-status-poller");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Adds a provider to poll. Must be called before {@link #start()}.
     */
    public void addProvider(String providerName, URI baseUrl, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            log.info("Status polling disabled: provider={}", providerName);
            return;
        }
        targets.put(providerName, new Target(baseUrl, interval));
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            targets.forEach((provider, target) -> executor.scheduleWithFixedDelay(
                    () -> poll(provider),
                    0,
                    target.interval().toMillis(),
                    TimeUnit.MILLISECONDS
            ));
            log.info("Ollama status poller started: providers={}", targets.keySet());
        }
    }

    /**
     * Polls one provider now and waits for the result to be applied.
     */
    public void poll(String providerName) {
        Target target = targets.get(providerName);
        if (target == null) {
            log.warn("Poll requested for unknown provider: provider={}", providerName);
            return;
        }
        try {
            List<OllamaCapacityFacade.LoadedModel> models = client.fetchLoadedModels(target.baseUrl())
                    .orTimeout(10, TimeUnit.SECONDS)
                    .join();
            apply(providerName, models);
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Status poll failed, keeping last known state: provider={}, error={}",
                    providerName, cause.getMessage());
        }
    }

    /**
     * Applies a poll result to the facade and notifies the scheduler.
     */
    void apply(String providerName, List<OllamaCapacityFacade.LoadedModel> models) {
        facade.applyLoadedModels(providerName, models);
        log.debug("Status poll applied: provider={}, loadedModels={}", providerName, models.size());
        onRefresh.accept(providerName);
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Ollama status poller stopped");
        } else {
            executor.shutdownNow();
        }
    }
}
