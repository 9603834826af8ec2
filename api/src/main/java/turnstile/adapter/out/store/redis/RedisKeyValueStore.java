package turnstile.adapter.out.store.redis;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.list.ReactiveListCommands;
import io.quarkus.redis.datasource.pubsub.ReactivePubSubCommands;
import io.quarkus.redis.datasource.sortedset.ReactiveSortedSetCommands;
import io.quarkus.redis.datasource.sortedset.ScoreRange;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.quarkus.redis.datasource.value.SetArgs;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.port.out.KeyValueStore;
import turnstile.core.port.out.Metrics;

/**
 * Redis implementation of {@link KeyValueStore}.
 *
 * <p>Every operation goes through {@link RedisTimeoutHelper#withTimeout} so a slow or
 * unreachable server surfaces as {@link turnstile.core.port.out.StoreUnavailableException}.
 * Publishing is the only best-effort operation.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger LOG = Logger.getLogger(RedisKeyValueStore.class);

    // KEYS[1] = hash key, ARGV[1] = field, ARGV[2] = value
    private static final String HSET_IF_EXISTS_SCRIPT =
            """
            if redis.call('EXISTS', KEYS[1]) == 1 then
                redis.call('HSET', KEYS[1], ARGV[1], ARGV[2])
                return 1
            end
            return 0
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveSortedSetCommands<String, String> sortedSetCommands;
    private final ReactiveListCommands<String, String> listCommands;
    private final ReactivePubSubCommands<String> pubSubCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisKeyValueStore(ReactiveRedisDataSource redisDataSource, Duration timeout, Metrics metrics) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.sortedSetCommands = redisDataSource.sortedSet(String.class, String.class);
        this.listCommands = redisDataSource.list(String.class, String.class);
        this.pubSubCommands = redisDataSource.pubsub(String.class);
        this.timeoutHelper = new RedisTimeoutHelper(timeout, metrics, "redis");
        LOG.infof("Initialized Redis key-value store (timeout: %s)", timeout);
    }

    // Plain values

    @Override
    public Uni<Optional<String>> get(String key) {
        return timeoutHelper.withTimeout(valueCommands.get(key).map(Optional::ofNullable), "get");
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        var op = ttl == null ? valueCommands.set(key, value) : valueCommands.set(key, value, new SetArgs().px(ttl));
        return timeoutHelper.withTimeout(op, "set");
    }

    @Override
    public Uni<Long> delete(String... keys) {
        if (keys.length == 0) {
            return Uni.createFrom().item(0L);
        }
        return timeoutHelper.withTimeout(keyCommands.del(keys).map(Integer::longValue), "delete");
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return timeoutHelper.withTimeout(keyCommands.exists(key), "exists");
    }

    @Override
    public Uni<Boolean> expire(String key, Duration ttl) {
        return timeoutHelper.withTimeout(keyCommands.pexpire(key, ttl.toMillis()), "expire");
    }

    @Override
    public Uni<Optional<Duration>> ttl(String key) {
        // -2: no such key, -1: no expiry
        return timeoutHelper.withTimeout(
                keyCommands
                        .pttl(key)
                        .map(ms -> ms < 0 ? Optional.<Duration>empty() : Optional.of(Duration.ofMillis(ms))),
                "ttl");
    }

    // Hashes

    @Override
    public Uni<Void> hashPutAll(String key, Map<String, String> fields) {
        if (fields.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return timeoutHelper.withTimeout(hashCommands.hset(key, fields).replaceWithVoid(), "hashPutAll");
    }

    @Override
    public Uni<Map<String, String>> hashGetAll(String key) {
        return timeoutHelper.withTimeout(
                hashCommands.hgetall(key).map(fields -> fields == null ? Map.<String, String>of() : fields),
                "hashGetAll");
    }

    @Override
    public Uni<Boolean> hashPutIfExists(String key, String field, String value) {
        // EVAL script numkeys key arg [arg...]
        return timeoutHelper.withTimeout(
                redisDataSource
                        .execute("EVAL", HSET_IF_EXISTS_SCRIPT, "1", key, field, value)
                        .map(response -> response != null && response.toLong() == 1L),
                "hashPutIfExists");
    }

    // Sorted sets

    @Override
    public Uni<Boolean> sortedSetAdd(String key, double score, String member) {
        return timeoutHelper.withTimeout(sortedSetCommands.zadd(key, score, member), "sortedSetAdd");
    }

    @Override
    public Uni<Long> sortedSetRemove(String key, String... members) {
        if (members.length == 0) {
            return Uni.createFrom().item(0L);
        }
        return timeoutHelper.withTimeout(
                sortedSetCommands.zrem(key, members).map(Integer::longValue), "sortedSetRemove");
    }

    @Override
    public Uni<List<String>> sortedSetMembers(String key) {
        return timeoutHelper.withTimeout(sortedSetCommands.zrange(key, 0, -1), "sortedSetMembers");
    }

    @Override
    public Uni<List<String>> sortedSetRangeByScore(String key, double min, double max) {
        return timeoutHelper.withTimeout(
                sortedSetCommands.zrangebyscore(key, scoreRange(min, max)), "sortedSetRangeByScore");
    }

    @Override
    public Uni<Long> sortedSetSize(String key) {
        return timeoutHelper.withTimeout(sortedSetCommands.zcard(key), "sortedSetSize");
    }

    @Override
    public Uni<Long> sortedSetCountByScore(String key, double min, double max) {
        return timeoutHelper.withTimeout(
                sortedSetCommands.zcount(key, scoreRange(min, max)), "sortedSetCountByScore");
    }

    // Lists

    @Override
    public Uni<Long> listPushLeft(String key, String value) {
        return timeoutHelper.withTimeout(listCommands.lpush(key, value), "listPushLeft");
    }

    @Override
    public Uni<Void> listTrim(String key, long start, long stop) {
        return timeoutHelper.withTimeout(listCommands.ltrim(key, start, stop), "listTrim");
    }

    @Override
    public Uni<List<String>> listRange(String key, long start, long stop) {
        return timeoutHelper.withTimeout(listCommands.lrange(key, start, stop), "listRange");
    }

    // Pub/sub

    @Override
    public Uni<Void> publish(String channel, String message) {
        return timeoutHelper.withTimeoutSilent(pubSubCommands.publish(channel, message), "publish");
    }

    @Override
    public Uni<Subscription> subscribe(String channel, Consumer<String> onMessage) {
        return timeoutHelper.withTimeout(
                pubSubCommands
                        .subscribe(channel, onMessage)
                        .map(subscriber -> (Subscription) () -> subscriber.unsubscribe(channel)),
                "subscribe");
    }

    private static ScoreRange<Double> scoreRange(double min, double max) {
        return new ScoreRange<>(finite(min), finite(max));
    }

    private static double finite(double score) {
        if (score == Double.NEGATIVE_INFINITY) {
            return -Double.MAX_VALUE;
        }
        if (score == Double.POSITIVE_INFINITY) {
            return Double.MAX_VALUE;
        }
        return score;
    }

    /**
     * Round-trip to the server, for health checks.
     */
    public Uni<Void> ping() {
        return timeoutHelper.withTimeout(redisDataSource.execute("PING").replaceWithVoid(), "ping");
    }
}
