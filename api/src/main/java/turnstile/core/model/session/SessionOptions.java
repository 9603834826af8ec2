package turnstile.core.model.session;

import java.time.Duration;

/**
 * Per-call options for session creation and activity updates.
 *
 * @param maxAge session lifetime; also the sliding window when extending on activity
 * @param maxConcurrentSessions maximum live sessions per user, 0 or less disables the limit
 * @param extendOnActivity whether activity resets the session TTL
 * @param trackActivity whether lifecycle records are appended to the activity log
 */
public record SessionOptions(
        Duration maxAge, int maxConcurrentSessions, boolean extendOnActivity, boolean trackActivity) {

    public static final Duration DEFAULT_MAX_AGE = Duration.ofSeconds(86400);
    public static final int DEFAULT_MAX_CONCURRENT_SESSIONS = 5;

    public SessionOptions {
        if (maxAge == null) {
            maxAge = DEFAULT_MAX_AGE;
        }
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive");
        }
    }

    public static SessionOptions defaults() {
        return new SessionOptions(DEFAULT_MAX_AGE, DEFAULT_MAX_CONCURRENT_SESSIONS, true, true);
    }

    public SessionOptions withMaxConcurrentSessions(int maxConcurrentSessions) {
        return new SessionOptions(maxAge, maxConcurrentSessions, extendOnActivity, trackActivity);
    }

    public SessionOptions withMaxAge(Duration maxAge) {
        return new SessionOptions(maxAge, maxConcurrentSessions, extendOnActivity, trackActivity);
    }

    public SessionOptions withExtendOnActivity(boolean extendOnActivity) {
        return new SessionOptions(maxAge, maxConcurrentSessions, extendOnActivity, trackActivity);
    }

    public SessionOptions withTrackActivity(boolean trackActivity) {
        return new SessionOptions(maxAge, maxConcurrentSessions, extendOnActivity, trackActivity);
    }

    public boolean limitsConcurrentSessions() {
        return maxConcurrentSessions > 0;
    }
}
