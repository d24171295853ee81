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
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Capacity facade for metered cloud deployments (Azure OpenAI and compatible APIs).
 *
 * A backend is one deployment. Capacity is the smaller of the local concurrency
 * cap and the remaining request budget reported by the last response's
 * rate-limit headers, keeping a small reserve and counting the reservations
 * made since those headers arrived. With no headers yet, or once the reported
 * reset time has passed, the budget is unknown and only the local cap applies.
 * Cloud deployments have no cold start.
 */
public final class AzureCapacityFacade implements CapacityFacade {

    private static final Logger log = LoggerFactory.getLogger(AzureCapacityFacade.class);

    public static final String HEADER_LIMIT_REQUESTS = "x-ratelimit-limit-requests";
    public static final String HEADER_LIMIT_TOKENS = "x-ratelimit-limit-tokens";
    public static final String HEADER_REMAINING_REQUESTS = "x-ratelimit-remaining-requests";
    public static final String HEADER_REMAINING_TOKENS = "x-ratelimit-remaining-tokens";
    public static final String HEADER_RESET_REQUESTS = "x-ratelimit-reset-requests";

    private final Map<String, BackendState> backends = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int minRemainingRequests;

    /**
     * @param minRemainingRequests remaining-request budget kept in reserve and never handed out
     */
    public AzureCapacityFacade(Clock clock, int minRemainingRequests) {
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        if (minRemainingRequests < 0) {
            throw new IllegalArgumentException("minRemainingRequests must not be negative");
        }
        this.minRemainingRequests = minRemainingRequests;
    }

    public AzureCapacityFacade() {
        this(Clock.systemUTC(), 10);
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.AZURE;
    }

    @Override
    public void registerBackend(Backend backend) {
        if (backend.getProviderType() != ProviderType.AZURE) {
            throw new IllegalArgumentException("Not an Azure backend: " + backend);
        }
        backends.put(backend.getId(), new BackendState(backend));
        log.info("Azure deployment registered: {}", backend);
    }

    @Override
    public boolean handles(String backendId) {
        return backends.containsKey(backendId);
    }

    @Override
    public CapacitySnapshot currentCapacity(String backendId) {
        BackendState state = require(backendId);
        Instant now = clock.instant();
        synchronized (state) {
            Map<String, Object> metrics = new HashMap<>();
            if (state.remainingRequests != null) {
                metrics.put("rate_remaining_requests", state.remainingRequests);
            }
            if (state.remainingTokens != null) {
                metrics.put("rate_remaining_tokens", state.remainingTokens);
            }
            if (state.lastUpdate != null) {
                metrics.put("header_age_ms", now.toEpochMilli() - state.lastUpdate.toEpochMilli());
            }
            return new CapacitySnapshot(backendId, freeSlots(state, now), true,
                    state.slots.getInFlight(), metrics);
        }
    }

    @Override
    public boolean tryReserve(String backendId) {
        BackendState state = require(backendId);
        synchronized (state) {
            if (freeSlots(state, clock.instant()) <= 0 || !state.slots.tryAcquire()) {
                return false;
            }
            state.reservedSinceUpdate++;
            return true;
        }
    }

    /**
     * Charges the request budget for a waiter taking over a held slot.
     */
    @Override
    public boolean transfer(String backendId) {
        BackendState state = require(backendId);
        synchronized (state) {
            if (state.slots.getInFlight() == 0 || requestBudget(state, clock.instant()) <= 0) {
                return false;
            }
            state.reservedSinceUpdate++;
            return true;
        }
    }

    @Override
    public boolean release(String backendId) {
        BackendState state = require(backendId);
        synchronized (state) {
            return state.slots.release();
        }
    }

    /**
     * Parses rate-limit headers from a deployment's response. Header names are
     * matched case-insensitively; invalid values are logged and skipped.
     */
    @Override
    public void updateBackendStats(String backendId, Map<String, String> headers) {
        BackendState state = require(backendId);
        Map<String, String> normalized = new HashMap<>();
        headers.forEach((k, v) -> {
            if (k != null && v != null) {
                normalized.put(k.toLowerCase(Locale.ROOT), v.trim());
            }
        });

        synchronized (state) {
            state.lastUpdate = clock.instant();
            state.reservedSinceUpdate = 0;

            Integer limitRequests = parseInt(normalized.get(HEADER_LIMIT_REQUESTS), backendId, HEADER_LIMIT_REQUESTS);
            if (limitRequests != null) {
                state.limitRequests = limitRequests;
            }
            Integer limitTokens = parseInt(normalized.get(HEADER_LIMIT_TOKENS), backendId, HEADER_LIMIT_TOKENS);
            if (limitTokens != null) {
                state.limitTokens = limitTokens;
            }
            Integer remainingRequests = parseInt(normalized.get(HEADER_REMAINING_REQUESTS), backendId, HEADER_REMAINING_REQUESTS);
            if (remainingRequests != null) {
                state.remainingRequests = remainingRequests;
            }
            Integer remainingTokens = parseInt(normalized.get(HEADER_REMAINING_TOKENS), backendId, HEADER_REMAINING_TOKENS);
            if (remainingTokens != null) {
                state.remainingTokens = remainingTokens;
            }
            String reset = normalized.get(HEADER_RESET_REQUESTS);
            if (reset != null && !reset.isEmpty()) {
                Instant resetsAt = parseReset(reset);
                if (resetsAt != null) {
                    state.resetsAt = resetsAt;
                } else {
                    log.warn("Invalid rate-limit header: backendId={}, header={}, value={}",
                            backendId, HEADER_RESET_REQUESTS, reset);
                }
            }

            log.debug("Rate limits updated: backendId={}, remainingRequests={}/{}, remainingTokens={}/{}",
                    backendId, state.remainingRequests, state.limitRequests,
                    state.remainingTokens, state.limitTokens);
        }
    }

    @Override
    public boolean hasProvider(String providerName) {
        return backends.values().stream()
                .anyMatch(state -> state.backend.getProviderName().equals(providerName));
    }

    /**
     * Applies the same headers to every deployment of the provider.
     */
    @Override
    public void updateProviderStats(String providerName, Map<String, String> stats) {
        for (String backendId : getBackendIds(providerName)) {
            updateBackendStats(backendId, stats);
        }
    }

    @Override
    public Set<String> getBackendIds(String providerName) {
        return backends.values().stream()
                .filter(state -> state.backend.getProviderName().equals(providerName))
                .map(state -> state.backend.getId())
                .collect(Collectors.toSet());
    }

    // Caller holds the backend state monitor
    private int freeSlots(BackendState state, Instant now) {
        return Math.min(state.slots.getFree(), requestBudget(state, now));
    }

    // Caller holds the backend state monitor; MAX_VALUE while the budget is unknown
    private int requestBudget(BackendState state, Instant now) {
        boolean windowReset = state.resetsAt != null && !now.isBefore(state.resetsAt);
        if (state.remainingRequests == null || windowReset) {
            return Integer.MAX_VALUE;
        }
        return Math.max(0, state.remainingRequests - minRemainingRequests - state.reservedSinceUpdate);
    }

    private BackendState require(String backendId) {
        BackendState state = backends.get(backendId);
        if (state == null) {
            throw new IllegalArgumentException("Backend not registered with Azure facade: " + backendId);
        }
        return state;
    }

    private static Integer parseInt(String value, String backendId, String header) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid rate-limit header: backendId={}, header={}, value={}", backendId, header, value);
            return null;
        }
    }

    /**
     * Accepts ISO-8601 timestamps or epoch seconds.
     */
    private static Instant parseReset(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException e2) {
                try {
                    double epochSeconds = Double.parseDouble(value);
                    return Instant.ofEpochMilli((long) (epochSeconds * 1000));
                } catch (NumberFormatException e3) {
                    return null;
                }
            }
        }
    }

    private static final class BackendState {
        private final Backend backend;
        private final SlotCounter slots;
        private Integer limitRequests;
        private Integer limitTokens;
        private Integer remainingRequests;
        private Integer remainingTokens;
        private Instant resetsAt;
        private Instant lastUpdate;
        private int reservedSinceUpdate;

        private BackendState(Backend backend) {
            this.backend = backend;
            this.slots = new SlotCounter(backend.getMaxConcurrentRequests());
        }
    }
}
