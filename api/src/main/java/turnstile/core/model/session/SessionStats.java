package turnstile.core.model.session;

/**
 * Aggregate counts over the global active-session index.
 *
 * @param totalActiveSessions entries currently in the index
 * @param sessionsLast24h entries created within the last 24 hours
 * @param sessionsLastHour entries created within the last hour
 */
public record SessionStats(long totalActiveSessions, long sessionsLast24h, long sessionsLastHour) {}
