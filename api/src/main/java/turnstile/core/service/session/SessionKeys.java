package turnstile.core.service.session;

/**
 * Key layout of session data in the key-value store.
 *
 * <ul>
 *   <li>{@code {prefix}session:{id}} - session hash</li>
 *   <li>{@code {prefix}user_sessions:{userId}} - the user's session ids, scored by creation time</li>
 *   <li>{@code {prefix}active_sessions} - all session ids, scored by creation time</li>
 *   <li>{@code {prefix}session_activity:{id}} - activity log, newest first</li>
 * </ul>
 */
public final class SessionKeys {

    private final String prefix;

    public SessionKeys(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public String session(String sessionId) {
        return prefix + "session:" + sessionId;
    }

    public String userSessions(String userId) {
        return prefix + "user_sessions:" + userId;
    }

    public String activeSessions() {
        return prefix + "active_sessions";
    }

    public String activity(String sessionId) {
        return prefix + "session_activity:" + sessionId;
    }
}
