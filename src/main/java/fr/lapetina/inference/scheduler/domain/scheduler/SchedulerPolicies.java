package fr.lapetina.inference.scheduler.domain.scheduler;

import fr.lapetina.inference.scheduler.infrastructure.capacity.BackendRegistry;
import fr.lapetina.inference.scheduler.infrastructure.metrics.SchedulerMetrics;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of scheduling policies by configuration name.
 */
public final class SchedulerPolicies {

    /**
     * Collaborators and settings every policy is built from.
     *
     * @param defaultQueueTimeout wait bound for requests without their own timeout; zero waits indefinitely
     * @param fcfsPollInterval    re-check period of blocked FCFS callers
     */
    public record Context(
            BackendRegistry registry,
            StarvationGuard starvationGuard,
            SchedulerMetrics metrics,
            Clock clock,
            Duration defaultQueueTimeout,
            Duration fcfsPollInterval
    ) {
    }

    /**
     * Builds a scheduler from its context.
     */
    @FunctionalInterface
    public interface PolicyConstructor {
        Scheduler create(Context context);
    }

    private static final Map<String, PolicyConstructor> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(UtilizationAwareScheduler.NAME, ctx -> new UtilizationAwareScheduler(
                ctx.registry(), ctx.starvationGuard(), ctx.metrics(), ctx.clock(), ctx.defaultQueueTimeout()));
        register(FcfsScheduler.NAME, ctx -> new FcfsScheduler(
                ctx.registry(), ctx.starvationGuard(), ctx.metrics(), ctx.clock(),
                ctx.defaultQueueTimeout(), ctx.fcfsPollInterval()));
    }

    private SchedulerPolicies() {
        // Utility class
    }

    /**
     * Registers a custom policy.
     *
     * @param name Policy name (used in configuration)
     * @param constructor Factory for creating scheduler instances
     */
    public static void register(String name, PolicyConstructor constructor) {
        REGISTRY.put(name.toLowerCase(), constructor);
    }

    /**
     * Creates a scheduler by policy name.
     *
     * @return Scheduler instance, or empty if the name is not registered
     */
    public static Optional<Scheduler> create(String name, Context context) {
        PolicyConstructor constructor = REGISTRY.get(name.toLowerCase());
        if (constructor == null) {
            return Optional.empty();
        }
        return Optional.of(constructor.create(context));
    }

    public static Set<String> getRegisteredNames() {
        return Set.copyOf(REGISTRY.keySet());
    }
}
