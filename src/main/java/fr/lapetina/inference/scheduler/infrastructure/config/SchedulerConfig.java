package fr.lapetina.inference.scheduler.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the scheduler.
 * Designed to be populated from YAML.
 */
public class SchedulerConfig {

    private SchedulerSettings scheduler = new SchedulerSettings();
    private StarvationConfig starvation = new StarvationConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private List<BackendConfig> backends = new ArrayList<>();
    private AzureConfig azure = new AzureConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public SchedulerSettings getScheduler() { return scheduler; }
    public void setScheduler(SchedulerSettings scheduler) { this.scheduler = scheduler; }

    public StarvationConfig getStarvation() { return starvation; }
    public void setStarvation(StarvationConfig starvation) { this.starvation = starvation; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public List<BackendConfig> getBackends() { return backends; }
    public void setBackends(List<BackendConfig> backends) { this.backends = backends; }

    public AzureConfig getAzure() { return azure; }
    public void setAzure(AzureConfig azure) { this.azure = azure; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Policy selection and queue timeouts.
     */
    public static class SchedulerSettings {
        private String type = "utilization";
        private long defaultQueueTimeoutMs = 300000;
        private long fcfsPollIntervalMs = 50;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        /** Zero means queued requests wait indefinitely. */
        public long getDefaultQueueTimeoutMs() { return defaultQueueTimeoutMs; }
        public void setDefaultQueueTimeoutMs(long defaultQueueTimeoutMs) { this.defaultQueueTimeoutMs = defaultQueueTimeoutMs; }

        public long getFcfsPollIntervalMs() { return fcfsPollIntervalMs; }
        public void setFcfsPollIntervalMs(long fcfsPollIntervalMs) { this.fcfsPollIntervalMs = fcfsPollIntervalMs; }
    }

    /**
     * Anti-starvation promotion thresholds and sweep cadence.
     */
    public static class StarvationConfig {
        private long lowThresholdMs = 10000;
        private long normalThresholdMs = 30000;
        private String sweepMode = "both";
        private long sweepPeriodMs = 1000;

        public long getLowThresholdMs() { return lowThresholdMs; }
        public void setLowThresholdMs(long lowThresholdMs) { this.lowThresholdMs = lowThresholdMs; }

        public long getNormalThresholdMs() { return normalThresholdMs; }
        public void setNormalThresholdMs(long normalThresholdMs) { this.normalThresholdMs = normalThresholdMs; }

        public String getSweepMode() { return sweepMode; }
        public void setSweepMode(String sweepMode) { this.sweepMode = sweepMode; }

        public long getSweepPeriodMs() { return sweepPeriodMs; }
        public void setSweepPeriodMs(long sweepPeriodMs) { this.sweepPeriodMs = sweepPeriodMs; }
    }

    /**
     * A provider host or account: one Ollama server or one Azure resource.
     */
    public static class ProviderConfig {
        private String name;
        private String type = "ollama";
        private String url;
        private long totalVramMb = -1;
        private long pollIntervalMs = 5000;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        /** Negative when unknown. Ollama only. */
        public long getTotalVramMb() { return totalVramMb; }
        public void setTotalVramMb(long totalVramMb) { this.totalVramMb = totalVramMb; }

        /** Period of the {@code /api/ps} poll; zero disables it. Ollama only. */
        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }

    /**
     * A schedulable model deployment on a provider.
     */
    public static class BackendConfig {
        private String id;
        private String provider;
        private String model;
        private String url;
        private int maxConcurrentRequests = 1;
        private long requiredVramMb;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        /** Defaults to the provider URL. */
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }

        public long getRequiredVramMb() { return requiredVramMb; }
        public void setRequiredVramMb(long requiredVramMb) { this.requiredVramMb = requiredVramMb; }
    }

    /**
     * Rate-limit handling for Azure deployments.
     */
    public static class AzureConfig {
        private int minRemainingRequests = 10;

        public int getMinRemainingRequests() { return minRemainingRequests; }
        public void setMinRemainingRequests(int minRemainingRequests) { this.minRemainingRequests = minRemainingRequests; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "inference_scheduler";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
