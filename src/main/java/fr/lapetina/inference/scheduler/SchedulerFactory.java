package fr.lapetina.inference.scheduler;

import fr.lapetina.inference.scheduler.domain.model.Backend;
import fr.lapetina.inference.scheduler.domain.model.ProviderType;
import fr.lapetina.inference.scheduler.domain.scheduler.Scheduler;
import fr.lapetina.inference.scheduler.domain.scheduler.SchedulerPolicies;
import fr.lapetina.inference.scheduler.domain.scheduler.StarvationGuard;
import fr.lapetina.inference.scheduler.domain.scheduler.SweepMode;
import fr.lapetina.inference.scheduler.domain.scheduler.UtilizationAwareScheduler;
import fr.lapetina.inference.scheduler.infrastructure.capacity.AzureCapacityFacade;
import fr.lapetina.inference.scheduler.infrastructure.capacity.BackendRegistry;
import fr.lapetina.inference.scheduler.infrastructure.capacity.OllamaCapacityFacade;
import fr.lapetina.inference.scheduler.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.scheduler.infrastructure.config.SchedulerConfig;
import fr.lapetina.inference.scheduler.infrastructure.metrics.SchedulerMetrics;
import fr.lapetina.inference.scheduler.infrastructure.ollama.OllamaStatusClient;
import fr.lapetina.inference.scheduler.infrastructure.ollama.OllamaStatusPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating a fully-wired scheduler from configuration.
 * This is the primary entry point for obtaining a configured {@link Scheduler}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SchedulerFactory factory = SchedulerFactory.create("scheduler.yaml").start()) {
 *     Scheduler scheduler = factory.getScheduler();
 *     SchedulingResult result = scheduler.schedule(request).join();
 *     // call the backend, then:
 *     scheduler.release(result.backendId(), ReleaseOutcome.success(result.requestId(), elapsed));
 * }
 * }</pre>
 */
public class SchedulerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerFactory.class);

    private final ConfigLoader configLoader;
    private final SchedulerConfig config;
    private final SchedulerMetrics metrics;
    private final OllamaCapacityFacade ollamaFacade;
    private final AzureCapacityFacade azureFacade;
    private final BackendRegistry backendRegistry;
    private final StarvationGuard starvationGuard;
    private final Scheduler scheduler;
    private final OllamaStatusPoller statusPoller;

    protected SchedulerFactory(String configPath, Clock clock, OllamaStatusClient statusClientOverride) {
        log.info("Initializing SchedulerFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metrics = new SchedulerMetrics(config.getMetrics().getPrefix());

        this.ollamaFacade = new OllamaCapacityFacade(clock);
        this.azureFacade = new AzureCapacityFacade(clock, config.getAzure().getMinRemainingRequests());
        this.backendRegistry = new BackendRegistry(List.of(ollamaFacade, azureFacade));
        loadBackends();

        SchedulerConfig.StarvationConfig starvation = config.getStarvation();
        this.starvationGuard = new StarvationGuard(
                Duration.ofMillis(starvation.getLowThresholdMs()),
                Duration.ofMillis(starvation.getNormalThresholdMs()),
                SweepMode.fromString(starvation.getSweepMode()),
                Duration.ofMillis(starvation.getSweepPeriodMs())
        );

        this.scheduler = createScheduler(clock);
        log.info("Using scheduling policy: {}", scheduler.getName());

        OllamaStatusClient statusClient = statusClientOverride != null
                ? statusClientOverride
                : new OllamaStatusClient();
        this.statusPoller = new OllamaStatusPoller(ollamaFacade, statusClient,
                provider -> scheduler.updateProviderStats(provider, Map.of()));
        registerPollTargets();

        configLoader.addListener(this::onConfigChanged);

        log.info("SchedulerFactory initialized with {} backends", backendRegistry.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static SchedulerFactory create(String configPath) {
        return new SchedulerFactory(configPath, Clock.systemUTC(), null);
    }

    /**
     * Creates a factory from the default configuration (scheduler.yaml).
     */
    public static SchedulerFactory create() {
        return create("scheduler.yaml");
    }

    /**
     * Starts status polling and configuration hot-reload.
     */
    public SchedulerFactory start() {
        statusPoller.start();
        configLoader.startWatching();
        log.info("Scheduler started");
        return this;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public BackendRegistry getBackendRegistry() {
        return backendRegistry;
    }

    public SchedulerMetrics getMetrics() {
        return metrics;
    }

    public StarvationGuard getStarvationGuard() {
        return starvationGuard;
    }

    public OllamaStatusPoller getStatusPoller() {
        return statusPoller;
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private Scheduler createScheduler(Clock clock) {
        SchedulerConfig.SchedulerSettings settings = config.getScheduler();
        SchedulerPolicies.Context context = new SchedulerPolicies.Context(
                backendRegistry,
                starvationGuard,
                metrics,
                clock,
                Duration.ofMillis(settings.getDefaultQueueTimeoutMs()),
                Duration.ofMillis(settings.getFcfsPollIntervalMs())
        );
        return SchedulerPolicies.create(settings.getType(), context).orElseGet(() -> {
            log.warn("Unknown scheduling policy, falling back: requested={}, using={}, known={}",
                    settings.getType(), UtilizationAwareScheduler.NAME, SchedulerPolicies.getRegisteredNames());
            return SchedulerPolicies.create(UtilizationAwareScheduler.NAME, context).orElseThrow();
        });
    }

    private void loadBackends() {
        Map<String, SchedulerConfig.ProviderConfig> providers = new HashMap<>();
        for (SchedulerConfig.ProviderConfig provider : config.getProviders()) {
            providers.put(provider.getName(), provider);
            if (ConfigLoader.providerType(provider) == ProviderType.OLLAMA) {
                ollamaFacade.registerProvider(provider.getName(), provider.getTotalVramMb());
            }
        }

        for (SchedulerConfig.BackendConfig backendConfig : config.getBackends()) {
            SchedulerConfig.ProviderConfig provider = providers.get(backendConfig.getProvider());
            Backend backend = Backend.builder()
                    .id(backendConfig.getId())
                    .providerType(ConfigLoader.providerType(provider))
                    .providerName(provider.getName())
                    .modelName(backendConfig.getModel())
                    .maxConcurrentRequests(backendConfig.getMaxConcurrentRequests())
                    .requiredVramMb(backendConfig.getRequiredVramMb())
                    .endpoint(backendConfig.getUrl() != null ? backendConfig.getUrl() : provider.getUrl())
                    .build();
            backendRegistry.register(backend);
        }
    }

    private void registerPollTargets() {
        for (SchedulerConfig.ProviderConfig provider : config.getProviders()) {
            if (ConfigLoader.providerType(provider) == ProviderType.OLLAMA && provider.getUrl() != null) {
                statusPoller.addProvider(provider.getName(), URI.create(provider.getUrl()),
                        Duration.ofMillis(provider.getPollIntervalMs()));
            }
        }
    }

    /**
     * Applies the settings that can change at runtime. Policy, providers and
     * backends are fixed for the lifetime of the factory.
     */
    private void onConfigChanged(SchedulerConfig oldConfig, SchedulerConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        SchedulerConfig.StarvationConfig starvation = newConfig.getStarvation();
        starvationGuard.updateThresholds(
                Duration.ofMillis(starvation.getLowThresholdMs()),
                Duration.ofMillis(starvation.getNormalThresholdMs())
        );

        if (oldConfig != null && !oldConfig.getScheduler().getType().equals(newConfig.getScheduler().getType())) {
            log.warn("Scheduling policy change needs a restart: current={}, requested={}",
                    scheduler.getName(), newConfig.getScheduler().getType());
        }

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down SchedulerFactory...");

        try {
            statusPoller.close();
        } catch (RuntimeException e) {
            log.warn("Error closing status poller", e);
        }

        try {
            scheduler.close();
        } catch (RuntimeException e) {
            log.warn("Error closing scheduler", e);
        }

        try {
            metrics.close();
        } catch (RuntimeException e) {
            log.warn("Error closing metrics", e);
        }

        try {
            configLoader.close();
        } catch (RuntimeException e) {
            log.warn("Error closing config loader", e);
        }

        log.info("SchedulerFactory shut down");
    }
}
