package turnstile.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.session.SessionActivity;
import turnstile.core.model.session.SessionOptions;
import turnstile.core.model.session.SessionStats;
import turnstile.core.model.session.UserSession;

/**
 * Inbound port for session lifecycle operations.
 *
 * <p>All operations fail with {@link turnstile.core.port.out.StoreUnavailableException}
 * when the backing store cannot be reached.
 */
public interface SessionManagement {

    /**
     * Create a session and enforce the concurrent-session limit for its owner.
     *
     * <p>The new session is never evicted by its own creation.
     *
     * @param sessionId caller-supplied session identifier
     * @param session the session data
     * @param options lifetime, limit and tracking options
     * @return the stored session
     */
    Uni<UserSession> createSession(String sessionId, UserSession session, SessionOptions options);

    /**
     * Create a session with the configured default options.
     */
    Uni<UserSession> createSession(String sessionId, UserSession session);

    /**
     * Read a session.
     *
     * @return the session, or empty when it never existed or has expired
     */
    Uni<Optional<UserSession>> getSession(String sessionId);

    /**
     * Bump {@code lastActivity} and, when enabled, slide the expiration window.
     *
     * @return false, without side effects, when the session does not exist
     */
    Uni<Boolean> updateActivity(String sessionId, SessionOptions options);

    Uni<Boolean> updateActivity(String sessionId);

    /**
     * Destroy a session and remove it from all indexes.
     *
     * @return false if the session did not exist
     */
    Uni<Boolean> destroySession(String sessionId);

    /**
     * Live session ids of a user, oldest first. Stale index entries are pruned.
     */
    Uni<List<String>> getUserSessions(String userId);

    /**
     * Destroy all sessions of a user except the optionally excluded one.
     *
     * @param excludeSessionId session to keep, may be null
     * @return number of sessions destroyed
     */
    Uni<Integer> destroyUserSessions(String userId, String excludeSessionId);

    /**
     * Evict the least recently active sessions of a user until at most {@code max} remain.
     *
     * @return number of sessions evicted
     */
    Uni<Integer> enforceConcurrentSessionLimit(String userId, int max);

    /**
     * Remove active-index entries whose session hash has expired.
     *
     * @return number of stale entries removed
     */
    Uni<Integer> cleanupExpiredSessions();

    Uni<List<SessionActivity>> getSessionActivity(String sessionId);

    Uni<SessionStats> getSessionStats();
}
