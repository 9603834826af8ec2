package turnstile.adapter.out.store.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.port.out.Metrics;
import turnstile.core.port.out.StoreUnavailableException;

/**
 * Applies timeouts and failure mapping to Redis operations.
 *
 * <p>Two modes:
 * <ul>
 *   <li>{@link #withTimeout} - fail closed: timeouts become {@link RedisTimeoutException},
 *       every other failure becomes {@link StoreUnavailableException}. Used for all reads
 *       and writes the session manager depends on.</li>
 *   <li>{@link #withTimeoutSilent} - fire-and-forget: logs and ignores timeouts and
 *       failures. Used for pub/sub notifications.</li>
 * </ul>
 *
 * <p>Timeouts and failures are recorded as separate metrics
 * ({@code turnstile.store.timeouts.total}, {@code turnstile.store.failures.total}).
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;
    private final String storeName;

    /**
     * @param timeout the timeout for each Redis operation
     * @param metrics metrics sink, may be null
     * @param storeName store name for logs and metric tags
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics, String storeName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.storeName = storeName;
    }

    /**
     * Apply the timeout and map every failure to {@link StoreUnavailableException}.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with {@link StoreUnavailableException} on timeout or error
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, storeName, timeout);
                    recordTimeout(operationName);
                    return new RedisTimeoutException(operationName, storeName);
                })
                .onFailure(error -> !(error instanceof StoreUnavailableException))
                .transform(error -> {
                    LOG.warnv("Redis operation failure: {0} in {1}: {2}", operationName, storeName, error.getMessage());
                    recordFailure(operationName);
                    return new StoreUnavailableException(
                            operationName, "Redis operation failed: " + operationName + " in " + storeName, error);
                });
    }

    /**
     * Apply the timeout and ignore any failure.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @return a Uni that always completes with void
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (silent): {0} in {1} after {2}",
                            operationName, storeName, timeout);
                    recordTimeout(operationName);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (silent): {0} in {1}: {2}",
                            operationName, storeName, error.getMessage());
                    recordFailure(operationName);
                    return null;
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(storeName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(storeName, operationName);
        }
    }

    /**
     * A Redis operation exceeded the configured timeout.
     */
    public static class RedisTimeoutException extends StoreUnavailableException {
        private final String store;

        public RedisTimeoutException(String operation, String store) {
            super(operation, "Redis operation timeout: " + operation + " in " + store);
            this.store = store;
        }

        /** Returns the store where the timeout occurred. */
        public String getStore() {
            return store;
        }
    }
}
