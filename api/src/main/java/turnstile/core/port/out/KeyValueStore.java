package turnstile.core.port.out;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import io.smallrye.mutiny.Uni;

/**
 * Outbound port for the key-value store backing sessions and their indexes.
 *
 * <p>The contract mirrors a Redis-style store: plain values, hashes, sorted sets and
 * lists, each with per-key expiration, plus fire-and-forget pub/sub. Implementations
 * are selected through {@link turnstile.spi.KeyValueStoreProvider}.
 *
 * <p>Failure semantics: a missing key is never an error (reads return empty values).
 * Any I/O failure or timeout fails the returned {@link Uni} with
 * {@link StoreUnavailableException} so callers can tell "absent" from "unknown".
 */
public interface KeyValueStore {

    // Plain values

    Uni<Optional<String>> get(String key);

    /**
     * Store a value with an expiration.
     *
     * @param ttl time to live, null for no expiration
     */
    Uni<Void> set(String key, String value, Duration ttl);

    /**
     * Delete keys of any type.
     *
     * @return number of keys that existed and were removed
     */
    Uni<Long> delete(String... keys);

    Uni<Boolean> exists(String key);

    /**
     * Replace the expiration of an existing key.
     *
     * @return false if the key does not exist
     */
    Uni<Boolean> expire(String key, Duration ttl);

    /**
     * Remaining time to live.
     *
     * @return empty if the key does not exist or has no expiration
     */
    Uni<Optional<Duration>> ttl(String key);

    // Hashes

    Uni<Void> hashPutAll(String key, Map<String, String> fields);

    /**
     * Read all fields of a hash.
     *
     * @return the fields, empty if the key does not exist
     */
    Uni<Map<String, String>> hashGetAll(String key);

    /**
     * Set a single field, but only when the hash already exists.
     *
     * <p>Must be atomic so an expiring hash is never resurrected with a lone field.
     *
     * @return true if the field was written
     */
    Uni<Boolean> hashPutIfExists(String key, String field, String value);

    // Sorted sets

    Uni<Boolean> sortedSetAdd(String key, double score, String member);

    Uni<Long> sortedSetRemove(String key, String... members);

    /**
     * Members in ascending score order; ties keep insertion order for the
     * in-memory adapter and lexicographic order for Redis.
     */
    Uni<List<String>> sortedSetMembers(String key);

    /**
     * Members with {@code min <= score <= max}, ascending by score.
     */
    Uni<List<String>> sortedSetRangeByScore(String key, double min, double max);

    Uni<Long> sortedSetSize(String key);

    Uni<Long> sortedSetCountByScore(String key, double min, double max);

    // Lists

    /**
     * Push a value onto the head of a list.
     *
     * @return length of the list after the push
     */
    Uni<Long> listPushLeft(String key, String value);

    /**
     * Keep only the elements between {@code start} and {@code stop}, both inclusive.
     */
    Uni<Void> listTrim(String key, long start, long stop);

    /**
     * Elements between {@code start} and {@code stop}, both inclusive; negative
     * indexes count from the tail.
     */
    Uni<List<String>> listRange(String key, long start, long stop);

    // Pub/sub

    /**
     * Publish a message. Delivery is best-effort.
     */
    Uni<Void> publish(String channel, String message);

    /**
     * Subscribe to a channel.
     *
     * @return a handle that cancels the subscription
     */
    Uni<Subscription> subscribe(String channel, Consumer<String> onMessage);

    /**
     * Handle for an active pub/sub subscription.
     */
    interface Subscription {
        Uni<Void> unsubscribe();
    }
}
