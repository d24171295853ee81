package fr.lapetina.inference.scheduler.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called after a configuration has been loaded and validated.
     *
     * @param oldConfig The previous configuration (null on initial load)
     * @param newConfig The new configuration
     */
    void onConfigChanged(SchedulerConfig oldConfig, SchedulerConfig newConfig);
}
