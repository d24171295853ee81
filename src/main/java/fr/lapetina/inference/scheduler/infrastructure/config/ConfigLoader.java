package fr.lapetina.inference.scheduler.infrastructure.config;

import fr.lapetina.inference.scheduler.domain.model.ProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@code scheduler.yaml} and keeps the current configuration.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Validation before a configuration becomes current
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<SchedulerConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(SchedulerConfig.class, new LoaderOptions()));
    }

    /**
     * Loads and validates configuration from file or classpath, then notifies listeners.
     *
     * @throws ConfigurationException if the file is missing, malformed or invalid
     */
    public SchedulerConfig load() {
        return install(readFromPath());
    }

    /**
     * Loads and validates configuration from an input stream, then notifies listeners.
     *
     * @throws ConfigurationException if the document is malformed or invalid
     */
    public SchedulerConfig loadFromStream(InputStream inputStream) {
        return install(parse(inputStream, "stream"));
    }

    /**
     * Reloads from the configured path. On failure the current configuration stays in place.
     */
    public SchedulerConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current: path={}", configPath, e);
            return currentConfig.get();
        }
    }

    public SchedulerConfig getCurrentConfig() {
        return currentConfig.get();
    }

    private SchedulerConfig install(SchedulerConfig config) {
        validate(config);
        SchedulerConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private SchedulerConfig readFromPath() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                lastModified = Files.getLastModifiedTime(configPath).toMillis();
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private SchedulerConfig parse(InputStream inputStream, String source) {
        try {
            SchedulerConfig config = yaml.load(inputStream);
            if (config == null) {
                throw new ConfigurationException("Empty configuration: " + source);
            }
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks ranges and cross-references.
     *
     * @throws ConfigurationException on the first problem found
     */
    static void validate(SchedulerConfig config) {
        SchedulerConfig.SchedulerSettings settings = config.getScheduler();
        if (settings.getType() == null || settings.getType().isBlank()) {
            throw new ConfigurationException("scheduler.type is required");
        }
        if (settings.getDefaultQueueTimeoutMs() < 0) {
            throw new ConfigurationException("scheduler.defaultQueueTimeoutMs must not be negative");
        }
        if (settings.getFcfsPollIntervalMs() <= 0) {
            throw new ConfigurationException("scheduler.fcfsPollIntervalMs must be positive");
        }

        SchedulerConfig.StarvationConfig starvation = config.getStarvation();
        if (starvation.getLowThresholdMs() <= 0 || starvation.getNormalThresholdMs() <= 0) {
            throw new ConfigurationException("starvation thresholds must be positive");
        }
        if (starvation.getSweepPeriodMs() <= 0) {
            throw new ConfigurationException("starvation.sweepPeriodMs must be positive");
        }

        if (config.getAzure().getMinRemainingRequests() < 0) {
            throw new ConfigurationException("azure.minRemainingRequests must not be negative");
        }

        Set<String> providerNames = new HashSet<>();
        for (SchedulerConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.getName() == null || provider.getName().isBlank()) {
                throw new ConfigurationException("provider name is required");
            }
            if (!providerNames.add(provider.getName())) {
                throw new ConfigurationException("Duplicate provider: " + provider.getName());
            }
            providerType(provider);
        }

        Set<String> backendIds = new HashSet<>();
        for (SchedulerConfig.BackendConfig backend : config.getBackends()) {
            if (backend.getId() == null || backend.getId().isBlank()) {
                throw new ConfigurationException("backend id is required");
            }
            if (!backendIds.add(backend.getId())) {
                throw new ConfigurationException("Duplicate backend: " + backend.getId());
            }
            if (!providerNames.contains(backend.getProvider())) {
                throw new ConfigurationException("Backend " + backend.getId()
                        + " references unknown provider: " + backend.getProvider());
            }
            if (backend.getMaxConcurrentRequests() < 1) {
                throw new ConfigurationException("Backend " + backend.getId()
                        + ": maxConcurrentRequests must be at least 1");
            }
        }
    }

    /**
     * Parses a provider's type.
     *
     * @throws ConfigurationException if the type is not a known provider family
     */
    public static ProviderType providerType(SchedulerConfig.ProviderConfig provider) {
        try {
            return ProviderType.fromString(provider.getType());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Provider " + provider.getName()
                    + " has unknown type: " + provider.getType(), e);
        }
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });
            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);
        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())
                        && Files.getLastModifiedTime(configPath).toMillis() > lastModified) {
                    log.info("Configuration file changed, reloading: {}", configPath);
                    reload();
                }
            }
            key.reset();
        } catch (IOException | RuntimeException e) {
            log.error("Error checking for config changes", e);
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(SchedulerConfig oldConfig, SchedulerConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (RuntimeException e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
