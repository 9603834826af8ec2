package turnstile.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.SessionConfig;
import turnstile.core.config.StoreConfig;
import turnstile.core.model.session.SessionActivity;
import turnstile.core.model.session.SessionEvent;
import turnstile.core.model.session.SessionOptions;
import turnstile.core.model.session.SessionStats;
import turnstile.core.model.session.UserSession;
import turnstile.core.port.in.SessionManagement;
import turnstile.core.port.out.KeyValueStore;
import turnstile.core.port.out.Metrics;
import turnstile.core.service.store.KeyValueStoreRegistry;

/**
 * Implementation of session management operations on top of the key-value store.
 *
 * <p>A session is a hash plus two index entries: the owner's session index and the
 * global active-session index, both sorted sets scored by creation time. Index
 * entries may outlive their hash when the hash expires; readers prune them lazily
 * and {@link #cleanupExpiredSessions()} sweeps the global index.
 *
 * <p>Store failures are never reported as "absent"; they propagate as
 * {@link turnstile.core.port.out.StoreUnavailableException}.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private static final Duration ONE_HOUR = Duration.ofHours(1);
    private static final Duration ONE_DAY = Duration.ofDays(1);

    private final KeyValueStoreRegistry storeRegistry;
    private final SessionConfig config;
    private final SessionKeys keys;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public SessionService(
            KeyValueStoreRegistry storeRegistry, SessionConfig config, StoreConfig storeConfig, Metrics metrics) {
        this(storeRegistry, config, storeConfig, metrics, Clock.systemUTC());
    }

    public SessionService(
            KeyValueStoreRegistry storeRegistry,
            SessionConfig config,
            StoreConfig storeConfig,
            Metrics metrics,
            Clock clock) {
        this.storeRegistry = storeRegistry;
        this.config = config;
        this.keys = new SessionKeys(storeConfig.keyPrefix());
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Options built from configuration, used when callers pass none.
     */
    public SessionOptions defaultOptions() {
        return new SessionOptions(
                config.maxAge(), config.maxConcurrentSessions(), config.extendOnActivity(), config.trackActivity());
    }

    @Override
    public Uni<UserSession> createSession(String sessionId, UserSession session) {
        return createSession(sessionId, session, defaultOptions());
    }

    @Override
    public Uni<UserSession> createSession(String sessionId, UserSession session, SessionOptions options) {
        requireId(sessionId);
        Objects.requireNonNull(session, "session");
        var opts = options != null ? options : defaultOptions();
        var now = clock.millis();
        var sessionKey = keys.session(sessionId);
        var userKey = keys.userSessions(session.userId());

        return discardPrevious(sessionId, session.userId())
                .chain(() -> store().hashPutAll(sessionKey, SessionCodec.toHash(session)))
                .chain(() -> store().expire(sessionKey, opts.maxAge()))
                .chain(() -> store().sortedSetAdd(userKey, now, sessionId))
                .chain(() -> extendIndexExpiry(userKey, opts.maxAge()))
                .chain(() -> store().sortedSetAdd(keys.activeSessions(), now, sessionId))
                .chain(() -> opts.limitsConcurrentSessions()
                        ? enforceLimit(session.userId(), opts.maxConcurrentSessions(), sessionId)
                        : Uni.createFrom().item(0))
                .chain(() -> opts.trackActivity()
                        ? recordActivity(
                                sessionId,
                                new SessionActivity(
                                        SessionActivity.SESSION_CREATED,
                                        now,
                                        provenance(session)),
                                opts.maxAge())
                        : Uni.createFrom().voidItem())
                .call(() -> publish(SessionEvent.Type.CREATED, sessionId, session.userId()))
                .replaceWith(session)
                .invoke(() -> LOG.infof("Session created for user %s", session.userId()));
    }

    @Override
    public Uni<Optional<UserSession>> getSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return store().hashGetAll(keys.session(sessionId)).map(fields -> SessionCodec.fromHash(sessionId, fields));
    }

    @Override
    public Uni<Boolean> updateActivity(String sessionId) {
        return updateActivity(sessionId, defaultOptions());
    }

    @Override
    public Uni<Boolean> updateActivity(String sessionId, SessionOptions options) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(false);
        }
        var opts = options != null ? options : defaultOptions();
        var now = clock.millis();
        var sessionKey = keys.session(sessionId);

        return store().hashPutIfExists(sessionKey, SessionCodec.LAST_ACTIVITY, String.valueOf(now))
                .chain(updated -> {
                    if (!updated) {
                        LOG.debugf("Activity update skipped, session no longer exists");
                        return Uni.createFrom().item(false);
                    }
                    var extended = opts.extendOnActivity()
                            ? slideExpiry(sessionId, opts.maxAge())
                            : Uni.createFrom().voidItem();
                    return extended.chain(() -> opts.trackActivity()
                                    ? recordActivity(
                                            sessionId,
                                            SessionActivity.of(SessionActivity.ACTIVITY_UPDATE, now),
                                            opts.maxAge())
                                    : Uni.createFrom().voidItem())
                            .replaceWith(true);
                });
    }

    @Override
    public Uni<Boolean> destroySession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(false);
        }
        return destroy(sessionId, SessionEvent.Type.DESTROYED);
    }

    @Override
    public Uni<List<String>> getUserSessions(String userId) {
        return loadUserSessions(userId).map(live -> live.stream().map(LiveSession::id).toList());
    }

    @Override
    public Uni<Integer> destroyUserSessions(String userId, String excludeSessionId) {
        return getUserSessions(userId)
                .map(ids -> ids.stream().filter(id -> !id.equals(excludeSessionId)).toList())
                .chain(targets -> destroyAll(targets, SessionEvent.Type.DESTROYED))
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infof("Destroyed %d sessions for user %s", count, userId);
                    }
                });
    }

    @Override
    public Uni<Integer> enforceConcurrentSessionLimit(String userId, int max) {
        return enforceLimit(userId, max, null);
    }

    @Override
    public Uni<Integer> cleanupExpiredSessions() {
        var cutoff = clock.millis() - config.maxAge().toMillis();
        var activeKey = keys.activeSessions();

        return store().sortedSetRangeByScore(activeKey, Double.NEGATIVE_INFINITY, cutoff)
                .chain(candidates -> Multi.createFrom()
                        .iterable(candidates)
                        .onItem()
                        .transformToUniAndConcatenate(id -> store().exists(keys.session(id))
                                .chain(alive -> alive
                                        ? Uni.createFrom().item(false)
                                        : store().sortedSetRemove(activeKey, id).replaceWith(true)))
                        .filter(removed -> removed)
                        .collect()
                        .asList()
                        .map(List::size))
                .invoke(count -> {
                    if (count > 0) {
                        LOG.infof("Removed %d stale entries from the active-session index", count);
                    }
                });
    }

    @Override
    public Uni<List<SessionActivity>> getSessionActivity(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(List.of());
        }
        return store().listRange(keys.activity(sessionId), 0, -1)
                .map(entries -> entries.stream().map(SessionCodec::readActivity).toList());
    }

    @Override
    public Uni<SessionStats> getSessionStats() {
        var now = clock.millis();
        var activeKey = keys.activeSessions();
        return store().sortedSetSize(activeKey)
                .chain(total -> store().sortedSetCountByScore(activeKey, now - ONE_DAY.toMillis(), now)
                        .chain(lastDay -> store().sortedSetCountByScore(activeKey, now - ONE_HOUR.toMillis(), now)
                                .map(lastHour -> new SessionStats(total, lastDay, lastHour))));
    }

    /**
     * Evict the least recently active sessions beyond {@code max}. The protected
     * session (the one being created) is never a candidate.
     */
    private Uni<Integer> enforceLimit(String userId, int max, String protectedSessionId) {
        if (max <= 0) {
            return Uni.createFrom().item(0);
        }
        return loadUserSessions(userId).chain(live -> {
            var excess = live.size() - max;
            if (excess <= 0) {
                return Uni.createFrom().item(0);
            }
            var victims = live.stream()
                    .filter(s -> !s.id().equals(protectedSessionId))
                    .sorted(Comparator.comparingLong((LiveSession s) -> s.session().lastActivity())
                            .thenComparingInt(LiveSession::position))
                    .limit(excess)
                    .map(LiveSession::id)
                    .toList();
            return destroyAll(victims, SessionEvent.Type.EVICTED).invoke(count -> {
                metrics.recordSessionsEvicted(count);
                LOG.infof("Evicted %d sessions for user %s (limit %d)", count, userId, max);
            });
        });
    }

    /**
     * Read every session in a user's index, pruning entries whose hash is gone.
     */
    private Uni<List<LiveSession>> loadUserSessions(String userId) {
        var userKey = keys.userSessions(userId);
        return store().sortedSetMembers(userKey).chain(ids -> {
            if (ids.isEmpty()) {
                return Uni.createFrom().item(List.<LiveSession>of());
            }
            return Multi.createFrom()
                    .iterable(ids)
                    .onItem()
                    .transformToUniAndConcatenate(id -> store().hashGetAll(keys.session(id))
                            .map(fields -> new IndexedEntry(id, ids.indexOf(id), SessionCodec.fromHash(id, fields))))
                    .collect()
                    .asList()
                    .chain(entries -> {
                        var live = new ArrayList<LiveSession>();
                        var stale = new ArrayList<String>();
                        for (var entry : entries) {
                            entry.session()
                                    .filter(s -> s.userId().equals(userId))
                                    .ifPresentOrElse(
                                            s -> live.add(new LiveSession(entry.id(), entry.position(), s)),
                                            () -> stale.add(entry.id()));
                        }
                        if (stale.isEmpty()) {
                            return Uni.createFrom().item(List.copyOf(live));
                        }
                        LOG.debugf("Pruning %d stale session index entries for user %s", stale.size(), userId);
                        return store().sortedSetRemove(userKey, stale.toArray(String[]::new))
                                .replaceWith(List.copyOf(live));
                    });
        });
    }

    private Uni<Integer> destroyAll(List<String> sessionIds, SessionEvent.Type reason) {
        if (sessionIds.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        return Multi.createFrom()
                .iterable(sessionIds)
                .onItem()
                .transformToUniAndConcatenate(id -> destroy(id, reason))
                .filter(destroyed -> destroyed)
                .collect()
                .asList()
                .map(List::size);
    }

    /**
     * Removes whatever an earlier session left under this id, so nothing from it survives
     * into the new hash and the previous owner's index no longer lists the id.
     */
    private Uni<Void> discardPrevious(String sessionId, String newOwner) {
        var sessionKey = keys.session(sessionId);
        return store().hashGetAll(sessionKey).chain(fields -> {
            if (fields.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            var previousOwner = fields.get(SessionCodec.USER_ID);
            if (previousOwner != null && !previousOwner.equals(newOwner)) {
                LOG.warnf("Session id reused across users (previous owner %s, new owner %s)", previousOwner, newOwner);
            }
            var removeFromIndex = previousOwner == null || previousOwner.isBlank()
                    ? Uni.createFrom().item(0L)
                    : store().sortedSetRemove(keys.userSessions(previousOwner), sessionId);
            return removeFromIndex
                    .chain(() -> store().delete(sessionKey, keys.activity(sessionId)))
                    .replaceWithVoid();
        });
    }

    private Uni<Boolean> destroy(String sessionId, SessionEvent.Type reason) {
        var sessionKey = keys.session(sessionId);
        return store().hashGetAll(sessionKey).chain(fields -> {
            var existing = SessionCodec.fromHash(sessionId, fields);
            if (existing.isEmpty()) {
                // Nothing to own the index entries; drop the global one.
                return store().delete(sessionKey)
                        .chain(() -> store().sortedSetRemove(keys.activeSessions(), sessionId))
                        .replaceWith(false);
            }
            var session = existing.get();
            return store().delete(sessionKey)
                    .chain(() -> store().sortedSetRemove(keys.userSessions(session.userId()), sessionId))
                    .chain(() -> store().sortedSetRemove(keys.activeSessions(), sessionId))
                    .chain(() -> config.trackActivity()
                            ? recordActivity(
                                    sessionId,
                                    new SessionActivity(
                                            SessionActivity.SESSION_DESTROYED,
                                            clock.millis(),
                                            Map.of("reason", reason.name().toLowerCase(Locale.ROOT))),
                                    config.maxAge())
                            : Uni.createFrom().voidItem())
                    .call(() -> publish(reason, sessionId, session.userId()))
                    .replaceWith(true)
                    .invoke(() -> LOG.debugf(
                            "Session %s for user %s", reason.name().toLowerCase(Locale.ROOT), session.userId()));
        });
    }

    private Uni<Void> slideExpiry(String sessionId, Duration maxAge) {
        var sessionKey = keys.session(sessionId);
        return store().expire(sessionKey, maxAge)
                .chain(() -> store().expire(keys.activity(sessionId), maxAge))
                .chain(() -> store().hashGetAll(sessionKey))
                .chain(fields -> {
                    var userId = fields.get(SessionCodec.USER_ID);
                    return userId == null
                            ? Uni.createFrom().voidItem()
                            : extendIndexExpiry(keys.userSessions(userId), maxAge);
                });
    }

    /**
     * Set the index TTL to {@code ttl} unless it already lives longer, so an index
     * never expires before one of its sessions.
     */
    private Uni<Void> extendIndexExpiry(String indexKey, Duration ttl) {
        return store().ttl(indexKey).chain(current -> current.isPresent() && current.get().compareTo(ttl) >= 0
                ? Uni.createFrom().voidItem()
                : store().expire(indexKey, ttl).replaceWithVoid());
    }

    private Uni<Void> recordActivity(String sessionId, SessionActivity activity, Duration ttl) {
        var activityKey = keys.activity(sessionId);
        return store().listPushLeft(activityKey, SessionCodec.writeActivity(activity))
                .chain(() -> store().listTrim(activityKey, 0, config.activityLogSize() - 1L))
                .chain(() -> store().expire(activityKey, ttl))
                .replaceWithVoid();
    }

    private Uni<Void> publish(SessionEvent.Type type, String sessionId, String userId) {
        if (!config.events().enabled()) {
            return Uni.createFrom().voidItem();
        }
        var event = new SessionEvent(type, sessionId, userId, clock.millis());
        return store().publish(config.events().channel(), SessionCodec.writeEvent(event));
    }

    private KeyValueStore store() {
        return storeRegistry.getStore();
    }

    private static Map<String, String> provenance(UserSession session) {
        var metadata = new HashMap<String, String>();
        if (session.ipAddress() != null) {
            metadata.put("ipAddress", session.ipAddress());
        }
        if (session.userAgent() != null) {
            metadata.put("userAgent", session.userAgent());
        }
        return metadata;
    }

    private static void requireId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
    }

    private record IndexedEntry(String id, int position, Optional<UserSession> session) {}

    private record LiveSession(String id, int position, UserSession session) {}
}
