package turnstile.core.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Session lifecycle notification published over the store's pub/sub channel.
 *
 * @param type what happened to the session
 * @param sessionId affected session
 * @param userId owner of the session
 * @param timestamp epoch milliseconds of the change
 */
public record SessionEvent(Type type, String sessionId, String userId, long timestamp) {

    public enum Type {
        @JsonProperty("created")
        CREATED,
        @JsonProperty("destroyed")
        DESTROYED,
        @JsonProperty("evicted")
        EVICTED
    }
}
