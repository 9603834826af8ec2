package turnstile.core.model.session;

import java.util.Map;

/**
 * Entry in a session's activity log.
 *
 * @param type activity type, see the constants on this record
 * @param timestamp epoch milliseconds when the activity happened
 * @param metadata free-form details (ip address, user agent, ...)
 */
public record SessionActivity(String type, long timestamp, Map<String, String> metadata) {

    public static final String SESSION_CREATED = "session_created";
    public static final String ACTIVITY_UPDATE = "activity_update";
    public static final String SESSION_DESTROYED = "session_destroyed";
    public static final String UNKNOWN = "unknown";

    public SessionActivity {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static SessionActivity of(String type, long timestamp) {
        return new SessionActivity(type, timestamp, Map.of());
    }

    /** Placeholder for a log entry that could not be parsed. */
    public static SessionActivity unknown() {
        return new SessionActivity(UNKNOWN, 0L, Map.of());
    }
}
