package turnstile.adapter.out.store.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.port.out.KeyValueStore;

/**
 * In-memory implementation of {@link KeyValueStore}.
 *
 * <p>Intended for development and testing only. Data is lost on restart and is not
 * shared across instances.
 *
 * <p>Every key maps to an entry holding a string, hash, sorted set or list plus an
 * optional expiry. All access to an entry goes through {@link ConcurrentMap#compute}
 * so each operation is atomic per key. Expired entries are dropped on access and by
 * a background sweep.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyValueStore.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<Consumer<String>>> subscribers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "kv-store-cleanup");
            t.setDaemon(true);
            return t;
        });

        // Run cleanup every minute
        cleanupExecutor.scheduleAtFixedRate(this::removeExpiredEntries, 1, 1, TimeUnit.MINUTES);
    }

    // Plain values

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(() -> read(key, e -> Optional.of(e.as(String.class)), Optional.empty()));
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            entries.put(key, new Entry(value, expiryFor(ttl)));
            return null;
        });
    }

    @Override
    public Uni<Long> delete(String... keys) {
        return Uni.createFrom().item(() -> {
            long removed = 0;
            for (var key : keys) {
                var previous = entries.remove(key);
                if (previous != null && !previous.isExpired(now())) {
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> read(key, e -> true, false));
    }

    @Override
    public Uni<Boolean> expire(String key, Duration ttl) {
        return Uni.createFrom().item(() -> write(key, e -> {
            e.expiresAt = expiryFor(ttl);
            return true;
        }));
    }

    @Override
    public Uni<Optional<Duration>> ttl(String key) {
        return Uni.createFrom()
                .item(() -> read(
                        key,
                        e -> e.expiresAt == 0
                                ? Optional.<Duration>empty()
                                : Optional.of(Duration.ofMillis(e.expiresAt - now())),
                        Optional.<Duration>empty()));
    }

    // Hashes

    @Override
    public Uni<Void> hashPutAll(String key, Map<String, String> fields) {
        return Uni.createFrom().item(() -> {
            entries.compute(key, (k, existing) -> {
                var entry = live(existing);
                if (entry == null) {
                    entry = new Entry(new LinkedHashMap<String, String>(), 0);
                }
                entry.<String, String>asMap().putAll(fields);
                return entry;
            });
            return null;
        });
    }

    @Override
    public Uni<Map<String, String>> hashGetAll(String key) {
        return Uni.createFrom()
                .item(() -> read(key, e -> Map.copyOf(e.<String, String>asMap()), Map.<String, String>of()));
    }

    @Override
    public Uni<Boolean> hashPutIfExists(String key, String field, String value) {
        return Uni.createFrom().item(() -> write(key, e -> {
            e.<String, String>asMap().put(field, value);
            return true;
        }));
    }

    // Sorted sets

    @Override
    public Uni<Boolean> sortedSetAdd(String key, double score, String member) {
        return Uni.createFrom().item(() -> {
            boolean[] added = new boolean[1];
            entries.compute(key, (k, existing) -> {
                var entry = live(existing);
                if (entry == null) {
                    entry = new Entry(new LinkedHashMap<String, Double>(), 0);
                }
                added[0] = entry.<String, Double>asMap().put(member, score) == null;
                return entry;
            });
            return added[0];
        });
    }

    @Override
    public Uni<Long> sortedSetRemove(String key, String... members) {
        return Uni.createFrom().item(() -> write(
                key,
                e -> {
                    Map<String, Double> scores = e.asMap();
                    long removed = 0;
                    for (var member : members) {
                        if (scores.remove(member) != null) {
                            removed++;
                        }
                    }
                    return removed;
                },
                0L));
    }

    @Override
    public Uni<List<String>> sortedSetMembers(String key) {
        return sortedSetRangeByScore(key, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    @Override
    public Uni<List<String>> sortedSetRangeByScore(String key, double min, double max) {
        return Uni.createFrom().item(() -> read(
                key,
                e -> e.<String, Double>asMap().entrySet().stream()
                        .filter(s -> s.getValue() >= min && s.getValue() <= max)
                        .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                        .map(Map.Entry::getKey)
                        .toList(),
                List.<String>of()));
    }

    @Override
    public Uni<Long> sortedSetSize(String key) {
        return Uni.createFrom().item(() -> read(key, e -> (long) e.asMap().size(), 0L));
    }

    @Override
    public Uni<Long> sortedSetCountByScore(String key, double min, double max) {
        return Uni.createFrom().item(() -> read(
                key,
                e -> e.<String, Double>asMap().values().stream()
                        .filter(score -> score >= min && score <= max)
                        .count(),
                0L));
    }

    // Lists

    @Override
    public Uni<Long> listPushLeft(String key, String value) {
        return Uni.createFrom().item(() -> {
            long[] size = new long[1];
            entries.compute(key, (k, existing) -> {
                var entry = live(existing);
                if (entry == null) {
                    entry = new Entry(new LinkedList<String>(), 0);
                }
                LinkedList<String> list = entry.asList();
                list.addFirst(value);
                size[0] = list.size();
                return entry;
            });
            return size[0];
        });
    }

    @Override
    public Uni<Void> listTrim(String key, long start, long stop) {
        return Uni.createFrom().item(() -> {
            entries.computeIfPresent(key, (k, existing) -> {
                var entry = live(existing);
                if (entry == null) {
                    return null;
                }
                LinkedList<String> list = entry.asList();
                var kept = new LinkedList<>(slice(list, start, stop));
                if (kept.isEmpty()) {
                    return null;
                }
                list.clear();
                list.addAll(kept);
                return entry;
            });
            return null;
        });
    }

    @Override
    public Uni<List<String>> listRange(String key, long start, long stop) {
        return Uni.createFrom().item(() -> read(key, e -> slice(e.asList(), start, stop), List.<String>of()));
    }

    // Pub/sub

    @Override
    public Uni<Void> publish(String channel, String message) {
        return Uni.createFrom().item(() -> {
            for (var consumer : subscribers.getOrDefault(channel, List.of())) {
                try {
                    consumer.accept(message);
                } catch (RuntimeException e) {
                    LOG.warnv(e, "Subscriber on channel {0} failed", channel);
                }
            }
            return null;
        });
    }

    @Override
    public Uni<Subscription> subscribe(String channel, Consumer<String> onMessage) {
        return Uni.createFrom().item(() -> {
            subscribers
                    .computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>())
                    .add(onMessage);
            return () -> Uni.createFrom().item(() -> {
                subscribers.getOrDefault(channel, List.of()).remove(onMessage);
                return null;
            });
        });
    }

    /**
     * Stop the background cleanup task.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
    }

    /**
     * Number of live keys (for health reporting).
     */
    public int size() {
        var now = now();
        return (int) entries.values().stream().filter(e -> !e.isExpired(now)).count();
    }

    void removeExpiredEntries() {
        var now = now();
        var removed = new int[1];
        entries.forEach((key, entry) -> {
            if (entries.computeIfPresent(key, (k, e) -> e.isExpired(now) ? null : e) == null) {
                removed[0]++;
            }
        });
        if (removed[0] > 0) {
            LOG.debugf("Removed %d expired keys", removed[0]);
        }
    }

    private <T> T read(String key, Function<Entry, T> reader, T absent) {
        return write(key, reader, absent);
    }

    private Boolean write(String key, Function<Entry, Boolean> mutation) {
        return write(key, mutation, false);
    }

    private <T> T write(String key, Function<Entry, T> mutation, T absent) {
        var result = new ArrayList<T>(1);
        entries.computeIfPresent(key, (k, existing) -> {
            var entry = live(existing);
            if (entry != null) {
                result.add(mutation.apply(entry));
            }
            return entry;
        });
        return result.isEmpty() ? absent : result.get(0);
    }

    private Entry live(Entry entry) {
        if (entry == null || entry.isExpired(now())) {
            return null;
        }
        return entry;
    }

    private long expiryFor(Duration ttl) {
        return ttl == null ? 0 : now() + ttl.toMillis();
    }

    private long now() {
        return clock.millis();
    }

    private static List<String> slice(List<String> list, long start, long stop) {
        int size = list.size();
        long from = start < 0 ? Math.max(0, size + start) : start;
        long to = stop < 0 ? size + stop : Math.min(stop, size - 1);
        if (from > to || from >= size) {
            return List.of();
        }
        return new ArrayList<>(list.subList((int) from, (int) to + 1));
    }

    private static final class Entry {
        private final Object value;
        private long expiresAt;

        Entry(Object value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(long now) {
            return expiresAt != 0 && expiresAt <= now;
        }

        <T> T as(Class<T> type) {
            if (!type.isInstance(value)) {
                throw new IllegalStateException("WRONGTYPE operation against a key holding " + describe());
            }
            return type.cast(value);
        }

        @SuppressWarnings("unchecked")
        <K, V> Map<K, V> asMap() {
            return as(LinkedHashMap.class);
        }

        @SuppressWarnings("unchecked")
        LinkedList<String> asList() {
            return as(LinkedList.class);
        }

        private String describe() {
            return value == null ? "nothing" : value.getClass().getSimpleName();
        }
    }
}
