package turnstile.adapter.out.store.redis;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import turnstile.core.config.StoreConfig;
import turnstile.core.port.out.KeyValueStore;
import turnstile.core.port.out.Metrics;
import turnstile.spi.KeyValueStoreProvider;

/**
 * Redis-backed key-value store provider.
 *
 * <p>The recommended provider for production: sessions are shared across instances
 * and expire through native Redis TTLs.
 */
@ApplicationScoped
public class RedisKeyValueStoreProvider implements KeyValueStoreProvider {

    private static final Logger LOG = Logger.getLogger(RedisKeyValueStoreProvider.class);
    private static final int PRIORITY = 100;

    private final ReactiveRedisDataSource redisDataSource;
    private final StoreConfig storeConfig;
    private final Metrics metrics;

    private volatile RedisKeyValueStore store;

    @Inject
    public RedisKeyValueStoreProvider(
            ReactiveRedisDataSource redisDataSource, StoreConfig storeConfig, Metrics metrics) {
        this.redisDataSource = redisDataSource;
        this.storeConfig = storeConfig;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            redisStore().ping().await().atMost(storeConfig.timeout().multipliedBy(2));
            LOG.info("Redis key-value store is available");
            return true;
        } catch (RuntimeException e) {
            LOG.warnf("Redis key-value store is not available: %s", e.getMessage());
            return false;
        }
    }

    @Override
    public KeyValueStore createStore() {
        return redisStore();
    }

    private synchronized RedisKeyValueStore redisStore() {
        if (store == null) {
            store = new RedisKeyValueStore(redisDataSource, storeConfig.timeout(), metrics);
        }
        return store;
    }

    @Override
    public Uni<HealthCheckResponse> healthCheck() {
        long start = System.currentTimeMillis();
        return redisStore()
                .ping()
                .map(ignored -> HealthCheckResponse.named("kv-store-redis")
                        .up()
                        .withData("type", "redis")
                        .withData("keyPrefix", storeConfig.keyPrefix())
                        .withData("latencyMs", System.currentTimeMillis() - start)
                        .build())
                .onFailure()
                .recoverWithItem(e -> HealthCheckResponse.named("kv-store-redis")
                        .down()
                        .withData("type", "redis")
                        .withData("error", String.valueOf(e.getMessage()))
                        .build());
    }
}
