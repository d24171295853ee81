package fr.lapetina.inference.scheduler.domain.model;

import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time capacity of one backend, as reported by its facade.
 *
 * @param freeSlots number of requests the backend can accept right now
 * @param warm      whether the model is loaded (always true for cloud backends)
 * @param inFlight  requests currently holding a slot on the backend
 * @param metrics   provider-specific figures (VRAM headroom, remaining budget)
 */
public record CapacitySnapshot(
        String backendId,
        int freeSlots,
        boolean warm,
        int inFlight,
        Map<String, Object> metrics
) {
    public CapacitySnapshot {
        Objects.requireNonNull(backendId, "Backend ID is required");
        freeSlots = Math.max(0, freeSlots);
        metrics = metrics != null ? Map.copyOf(metrics) : Map.of();
    }

    public boolean hasCapacity() {
        return freeSlots > 0;
    }

    /**
     * A request sent now would pay the model load time.
     */
    public boolean predictsColdStart() {
        return inFlight == 0 && !warm;
    }

    public static CapacitySnapshot unavailable(String backendId) {
        return new CapacitySnapshot(backendId, 0, false, 0, Map.of());
    }
}
