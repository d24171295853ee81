package fr.lapetina.inference.scheduler.infrastructure.capacity;

import fr.lapetina.inference.scheduler.domain.model.Backend;
import fr.lapetina.inference.scheduler.domain.model.ProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of schedulable backends and of the capacity facade serving each one.
 *
 * The facade for a backend is resolved once, at registration, from its
 * provider type; scheduling calls look it up by backend id only.
 * Thread-safe.
 */
public final class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<ProviderType, CapacityFacade> facadesByType = new EnumMap<>(ProviderType.class);
    private final Map<String, Backend> backends = new ConcurrentHashMap<>();
    private final Map<String, CapacityFacade> facadesByBackend = new ConcurrentHashMap<>();

    public BackendRegistry(Collection<? extends CapacityFacade> facades) {
        for (CapacityFacade facade : facades) {
            CapacityFacade previous = facadesByType.put(facade.getProviderType(), facade);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate facade for provider type: " + facade.getProviderType());
            }
        }
    }

    /**
     * Registers a backend with the facade of its provider family.
     *
     * @throws IllegalStateException if no facade serves the backend's provider type
     */
    public void register(Backend backend) {
        CapacityFacade facade = facadesByType.get(backend.getProviderType());
        if (facade == null) {
            throw new IllegalStateException("No capacity facade for provider type " + backend.getProviderType()
                    + " (backend " + backend.getId() + ")");
        }
        facade.registerBackend(backend);
        facadesByBackend.put(backend.getId(), facade);
        Backend previous = backends.put(backend.getId(), backend);
        if (previous == null) {
            log.info("Backend registered: {}", backend);
        } else {
            log.info("Backend updated: {}", backend);
        }
    }

    public Optional<Backend> getBackend(String backendId) {
        return backendId == null ? Optional.empty() : Optional.ofNullable(backends.get(backendId));
    }

    public boolean contains(String backendId) {
        return backendId != null && backends.containsKey(backendId);
    }

    /**
     * The facade that reports capacity for the backend, or empty if the backend is unknown.
     */
    public Optional<CapacityFacade> facadeFor(String backendId) {
        return backendId == null ? Optional.empty() : Optional.ofNullable(facadesByBackend.get(backendId));
    }

    public Optional<CapacityFacade> facadeFor(ProviderType providerType) {
        return Optional.ofNullable(facadesByType.get(providerType));
    }

    public Collection<CapacityFacade> getFacades() {
        return List.copyOf(facadesByType.values());
    }

    public List<Backend> getAllBackends() {
        return new ArrayList<>(backends.values());
    }

    public int size() {
        return backends.size();
    }
}
