package fr.lapetina.inference.scheduler.infrastructure.capacity;

import fr.lapetina.inference.scheduler.domain.model.Backend;
import fr.lapetina.inference.scheduler.domain.model.CapacitySnapshot;
import fr.lapetina.inference.scheduler.domain.model.ProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Capacity facade for self-hosted Ollama providers.
 *
 * A backend is one model on one Ollama server. Its capacity is bounded by the
 * server's parallel slots for that model and, while the model is not loaded,
 * by the VRAM the server has left to load it.
 *
 * Loaded-model state comes from {@link #applyLoadedModels} (pushed by the
 * {@code /api/ps} poller) or from string stats:
 * <ul>
 *   <li>backend stats: {@code loaded}, {@code size_vram_mb}, {@code expires_at}</li>
 *   <li>provider stats: {@code total_vram_mb}, {@code available_vram_mb}, {@code loaded_models}</li>
 * </ul>
 */
public final class OllamaCapacityFacade implements CapacityFacade {

    private static final Logger log = LoggerFactory.getLogger(OllamaCapacityFacade.class);

    public static final String STAT_LOADED = "loaded";
    public static final String STAT_SIZE_VRAM_MB = "size_vram_mb";
    public static final String STAT_EXPIRES_AT = "expires_at";
    public static final String STAT_TOTAL_VRAM_MB = "total_vram_mb";
    public static final String STAT_AVAILABLE_VRAM_MB = "available_vram_mb";
    public static final String STAT_LOADED_MODELS = "loaded_models";

    private final Map<String, ProviderState> providers = new ConcurrentHashMap<>();
    private final Map<String, BackendState> backends = new ConcurrentHashMap<>();
    private final Clock clock;

    public OllamaCapacityFacade(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    public OllamaCapacityFacade() {
        this(Clock.systemUTC());
    }

    /**
     * A model reported as resident in VRAM.
     */
    public record LoadedModel(String name, long sizeVramMb, Instant expiresAt) {
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.OLLAMA;
    }

    /**
     * Declares a provider's VRAM budget. Providers not declared here are
     * created on first backend registration with an unknown budget.
     */
    public void registerProvider(String providerName, long totalVramMb) {
        ProviderState state = providers.computeIfAbsent(providerName, k -> new ProviderState());
        state.totalVramMb = totalVramMb;
        state.availableVramMb = totalVramMb;
        log.info("Ollama provider registered: provider={}, totalVramMb={}", providerName, totalVramMb);
    }

    @Override
    public void registerBackend(Backend backend) {
        if (backend.getProviderType() != ProviderType.OLLAMA) {
            throw new IllegalArgumentException("Not an Ollama backend: " + backend);
        }
        providers.computeIfAbsent(backend.getProviderName(), k -> new ProviderState());
        backends.put(backend.getId(), new BackendState(backend));
        log.info("Ollama backend registered: {}", backend);
    }

    @Override
    public boolean handles(String backendId) {
        return backends.containsKey(backendId);
    }

    @Override
    public CapacitySnapshot currentCapacity(String backendId) {
        BackendState state = require(backendId);
        ProviderState provider = providers.get(state.backend.getProviderName());
        Instant now = clock.instant();
        synchronized (state) {
            Map<String, Object> metrics = new HashMap<>();
            if (provider.availableVramMb >= 0) {
                metrics.put("available_vram_mb", provider.availableVramMb);
            }
            return new CapacitySnapshot(
                    backendId,
                    freeSlots(state, provider, now),
                    isWarm(state, now),
                    state.slots.getInFlight(),
                    metrics
            );
        }
    }

    @Override
    public boolean tryReserve(String backendId) {
        BackendState state = require(backendId);
        ProviderState provider = providers.get(state.backend.getProviderName());
        synchronized (state) {
            if (freeSlots(state, provider, clock.instant()) <= 0) {
                return false;
            }
            return state.slots.tryAcquire();
        }
    }

    /**
     * A busy model keeps its slot and VRAM, so a held slot always passes on.
     */
    @Override
    public boolean transfer(String backendId) {
        BackendState state = require(backendId);
        synchronized (state) {
            return state.slots.getInFlight() > 0;
        }
    }

    @Override
    public boolean release(String backendId) {
        BackendState state = require(backendId);
        synchronized (state) {
            return state.slots.release();
        }
    }

    @Override
    public void updateBackendStats(String backendId, Map<String, String> stats) {
        BackendState state = require(backendId);
        synchronized (state) {
            String loaded = stats.get(STAT_LOADED);
            if (loaded != null) {
                state.loaded = Boolean.parseBoolean(loaded.trim());
            }
            Long size = parseLong(stats.get(STAT_SIZE_VRAM_MB), backendId, STAT_SIZE_VRAM_MB);
            if (size != null) {
                state.sizeVramMb = size;
            }
            String expires = stats.get(STAT_EXPIRES_AT);
            if (expires != null && !expires.isBlank()) {
                try {
                    state.expiresAt = OffsetDateTime.parse(expires.trim()).toInstant();
                } catch (DateTimeParseException e) {
                    log.warn("Invalid stat value: backendId={}, key={}, value={}", backendId, STAT_EXPIRES_AT, expires);
                }
            }
        }
        log.debug("Ollama backend stats updated: backendId={}, stats={}", backendId, stats);
    }

    @Override
    public boolean hasProvider(String providerName) {
        return providers.containsKey(providerName);
    }

    @Override
    public void updateProviderStats(String providerName, Map<String, String> stats) {
        ProviderState provider = providers.get(providerName);
        if (provider == null) {
            throw new IllegalArgumentException("Unknown Ollama provider: " + providerName);
        }
        Long total = parseLong(stats.get(STAT_TOTAL_VRAM_MB), providerName, STAT_TOTAL_VRAM_MB);
        if (total != null) {
            provider.totalVramMb = total;
        }
        Long available = parseLong(stats.get(STAT_AVAILABLE_VRAM_MB), providerName, STAT_AVAILABLE_VRAM_MB);
        if (available != null) {
            provider.availableVramMb = available;
        }
        String loadedModels = stats.get(STAT_LOADED_MODELS);
        if (loadedModels != null) {
            Set<String> names = Arrays.stream(loadedModels.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toSet());
            for (BackendState state : backendsOf(providerName)) {
                synchronized (state) {
                    state.loaded = names.contains(state.backend.getModelName());
                }
            }
        }
        log.debug("Ollama provider stats updated: provider={}, stats={}", providerName, stats);
    }

    /**
     * Replaces the provider's loaded-model picture with a fresh {@code /api/ps} reading.
     * Available VRAM is recomputed from the provider total when it is known.
     */
    public void applyLoadedModels(String providerName, List<LoadedModel> loadedModels) {
        ProviderState provider = providers.get(providerName);
        if (provider == null) {
            throw new IllegalArgumentException("Unknown Ollama provider: " + providerName);
        }
        Map<String, LoadedModel> byName = loadedModels.stream()
                .collect(Collectors.toMap(LoadedModel::name, m -> m, (a, b) -> a));

        long used = loadedModels.stream().mapToLong(LoadedModel::sizeVramMb).sum();
        if (provider.totalVramMb >= 0) {
            provider.availableVramMb = Math.max(0, provider.totalVramMb - used);
        }

        for (BackendState state : backendsOf(providerName)) {
            LoadedModel model = byName.get(state.backend.getModelName());
            synchronized (state) {
                state.loaded = model != null;
                if (model != null) {
                    state.sizeVramMb = model.sizeVramMb();
                    state.expiresAt = model.expiresAt();
                }
            }
        }
        log.debug("Ollama loaded models applied: provider={}, loaded={}, availableVramMb={}",
                providerName, byName.keySet(), provider.availableVramMb);
    }

    @Override
    public Set<String> getBackendIds(String providerName) {
        return backendsOf(providerName).stream()
                .map(state -> state.backend.getId())
                .collect(Collectors.toSet());
    }

    public Set<String> getProviderNames() {
        return Set.copyOf(providers.keySet());
    }

    private List<BackendState> backendsOf(String providerName) {
        return backends.values().stream()
                .filter(state -> state.backend.getProviderName().equals(providerName))
                .toList();
    }

    // Caller holds the backend state monitor
    private int freeSlots(BackendState state, ProviderState provider, Instant now) {
        int free = state.slots.getFree();
        if (free > 0 && !isWarm(state, now)) {
            long required = state.backend.getRequiredVramMb() > 0
                    ? state.backend.getRequiredVramMb()
                    : state.sizeVramMb;
            if (required > 0 && provider.availableVramMb >= 0 && required > provider.availableVramMb) {
                return 0;
            }
        }
        return free;
    }

    // Caller holds the backend state monitor
    private boolean isWarm(BackendState state, Instant now) {
        if (state.slots.getInFlight() > 0) {
            return true;
        }
        return state.loaded && (state.expiresAt == null || state.expiresAt.isAfter(now));
    }

    private BackendState require(String backendId) {
        BackendState state = backends.get(backendId);
        if (state == null) {
            throw new IllegalArgumentException("Backend not registered with Ollama facade: " + backendId);
        }
        return state;
    }

    private static Long parseLong(String value, String owner, String key) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid stat value: owner={}, key={}, value={}", owner, key, value);
            return null;
        }
    }

    private static final class ProviderState {
        // -1 while unknown
        private volatile long totalVramMb = -1;
        private volatile long availableVramMb = -1;
    }

    private static final class BackendState {
        private final Backend backend;
        private final SlotCounter slots;
        private boolean loaded;
        private long sizeVramMb;
        private Instant expiresAt;

        private BackendState(Backend backend) {
            this.backend = backend;
            this.slots = new SlotCounter(backend.getMaxConcurrentRequests());
        }
    }
}
