package turnstile.spi;

import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;

import turnstile.core.port.out.KeyValueStore;

/**
 * SPI for key-value store backends.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-backed store, shared across instances</li>
 *   <li>memory (priority: 0) - in-process store (development and tests only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider ({@code turnstile.store.provider})</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
public interface KeyValueStoreProvider {

    /**
     * Provider name used in {@code turnstile.store.provider}.
     */
    String name();

    /**
     * Higher priority providers are preferred when several are available.
     */
    int priority();

    /**
     * Check whether the backend can be used.
     *
     * <p>May block briefly; only called at startup.
     */
    boolean isAvailable();

    /**
     * Create (or return the already created) store.
     */
    KeyValueStore createStore();

    /**
     * Probe the backend for the readiness endpoint.
     */
    Uni<HealthCheckResponse> healthCheck();
}
