package fr.lapetina.inference.scheduler.infrastructure.capacity;

import fr.lapetina.inference.scheduler.domain.model.Backend;
import fr.lapetina.inference.scheduler.domain.model.CapacitySnapshot;
import fr.lapetina.inference.scheduler.domain.model.ProviderType;

import java.util.Map;
import java.util.Set;

/**
 * Reports live capacity for the backends of one provider family and keeps
 * their slot accounting.
 *
 * Implementations must be thread-safe and must not block: they answer from
 * in-memory state that background pollers and stats pushes keep fresh.
 */
public interface CapacityFacade {

    ProviderType getProviderType();

    /**
     * Starts tracking a backend. Re-registering replaces the descriptor and
     * resets its accounting.
     */
    void registerBackend(Backend backend);

    boolean handles(String backendId);

    /**
     * @throws IllegalArgumentException if the backend is not registered
     */
    CapacitySnapshot currentCapacity(String backendId);

    /**
     * Atomically takes one slot if the backend has capacity.
     *
     * @return true if the slot was reserved
     */
    boolean tryReserve(String backendId);

    /**
     * Passes a held slot to another request without freeing it, charging any
     * per-request budget the provider keeps.
     *
     * @return false if the slot may not pass on; it is still held either way
     */
    boolean transfer(String backendId);

    /**
     * Gives one slot back. Never drops below zero.
     *
     * @return false if the backend had no outstanding reservation
     */
    boolean release(String backendId);

    /**
     * Ingests stats for a single backend, typically parsed from response headers.
     */
    void updateBackendStats(String backendId, Map<String, String> stats);

    boolean hasProvider(String providerName);

    /**
     * Ingests provider-wide stats (e.g. VRAM, loaded models).
     */
    void updateProviderStats(String providerName, Map<String, String> stats);

    Set<String> getBackendIds(String providerName);
}
