package turnstile.adapter.out.store.memory;

import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import turnstile.core.port.out.KeyValueStore;
import turnstile.spi.KeyValueStoreProvider;

/**
 * In-memory key-value store provider.
 *
 * <p>Always available; serves as the fallback when Redis is unreachable.
 *
 * <p><strong>Warning:</strong> sessions live in one process only, so sticky
 * routing is required when running several instances.
 */
@ApplicationScoped
public class InMemoryKeyValueStoreProvider implements KeyValueStoreProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyValueStoreProvider.class);
    private static final int PRIORITY = 0;

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private volatile InMemoryKeyValueStore store;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized KeyValueStore createStore() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Session store is in-memory only!");
            LOG.warn("  Sessions are lost on restart and not shared between instances.");
            LOG.warn("  Configure turnstile.store.provider=redis for production.");
            LOG.warn("========================================================================");
        }
        if (store == null) {
            store = new InMemoryKeyValueStore();
        }
        return store;
    }

    @Override
    public Uni<HealthCheckResponse> healthCheck() {
        var current = store;
        return Uni.createFrom()
                .item(HealthCheckResponse.named("kv-store-memory")
                        .up()
                        .withData("type", "in-memory")
                        .withData("keys", current != null ? current.size() : 0)
                        .build());
    }

    @PreDestroy
    void shutdown() {
        if (store != null) {
            store.shutdown();
        }
    }
}
