package io.eidos.core.engine;

import io.eidos.core.spi.BackendAdapter;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of target backends, keyed by {@link BackendAdapter#id()}. Thread-safe: registration and
 * lookup can happen concurrently.
 */
public final class BackendRegistry {

    private final Map<String, BackendAdapter> backends = new ConcurrentHashMap<>();

    /**
     * Returns a registry holding every {@link BackendAdapter} visible to {@link ServiceLoader} from
     * the context class loader.
     */
    public static BackendRegistry installed() {
        BackendRegistry registry = new BackendRegistry();
        ServiceLoader.load(BackendAdapter.class).forEach(registry::register);
        return registry;
    }

    /**
     * Registers a backend. If a backend with the same id is already registered, it is replaced
     * (last-write-wins semantics).
     *
     * @throws NullPointerException     if backend is null
     * @throws IllegalArgumentException if backend.id() is null or empty
     */
    public void register(BackendAdapter backend) {
        if (backend == null) {
            throw new NullPointerException("backend must not be null");
        }
        String id = backend.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("backend id must not be null or empty");
        }
        backends.put(id, backend);
    }

    /** Looks up a backend by id. */
    public Optional<BackendAdapter> getBackend(String backendId) {
        return Optional.ofNullable(backends.get(backendId));
    }

    /**
     * Looks up a backend by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no backend is registered with the given id
     */
    public BackendAdapter requireBackend(String backendId) {
        return getBackend(backendId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown backend '" + backendId + "' — available: " + ids()));
    }

    /** Registered ids, sorted. */
    public Set<String> ids() {
        return Collections.unmodifiableSet(new TreeSet<>(backends.keySet()));
    }
}
