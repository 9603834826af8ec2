package turnstile.core.service.session;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import turnstile.core.model.session.SessionActivity;
import turnstile.core.model.session.SessionEvent;
import turnstile.core.model.session.UserSession;

/**
 * Converts sessions to and from their stored hash form, and activity records and
 * lifecycle events to and from JSON.
 */
public final class SessionCodec {

    private static final Logger LOG = Logger.getLogger(SessionCodec.class);

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    static final String USER_ID = "userId";
    static final String USERNAME = "username";
    static final String EMAIL = "email";
    static final String ROLE = "role";
    static final String PERMISSIONS = "permissions";
    static final String LOGIN_TIME = "loginTime";
    static final String LAST_ACTIVITY = "lastActivity";
    static final String IP_ADDRESS = "ipAddress";
    static final String USER_AGENT = "userAgent";
    static final String DEVICE_ID = "deviceId";

    private SessionCodec() {}

    static Map<String, String> toHash(UserSession session) {
        var fields = new LinkedHashMap<String, String>();
        fields.put(USER_ID, session.userId());
        putIfPresent(fields, USERNAME, session.username());
        putIfPresent(fields, EMAIL, session.email());
        putIfPresent(fields, ROLE, session.role());
        fields.put(PERMISSIONS, writeJson(session.permissions().stream().sorted().toList()));
        fields.put(LOGIN_TIME, String.valueOf(session.loginTime()));
        fields.put(LAST_ACTIVITY, String.valueOf(session.lastActivity()));
        putIfPresent(fields, IP_ADDRESS, session.ipAddress());
        putIfPresent(fields, USER_AGENT, session.userAgent());
        putIfPresent(fields, DEVICE_ID, session.deviceId());
        return fields;
    }

    /**
     * Rebuild a session from its hash.
     *
     * @return empty when the hash is empty or too damaged to carry an owner
     */
    static Optional<UserSession> fromHash(String sessionId, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        try {
            var loginTime = Long.parseLong(fields.getOrDefault(LOGIN_TIME, "0"));
            var lastActivity = Long.parseLong(fields.getOrDefault(LAST_ACTIVITY, String.valueOf(loginTime)));
            return Optional.of(new UserSession(
                    fields.get(USER_ID),
                    fields.get(USERNAME),
                    fields.get(EMAIL),
                    fields.get(ROLE),
                    readPermissions(fields.get(PERMISSIONS)),
                    loginTime,
                    Math.max(loginTime, lastActivity),
                    fields.get(IP_ADDRESS),
                    fields.get(USER_AGENT),
                    fields.get(DEVICE_ID)));
        } catch (IllegalArgumentException e) {
            LOG.warnv("Discarding unreadable session {0}: {1}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    static String writeActivity(SessionActivity activity) {
        return writeJson(activity);
    }

    static SessionActivity readActivity(String json) {
        try {
            var activity = OBJECT_MAPPER.readValue(json, SessionActivity.class);
            return activity.type() == null ? SessionActivity.unknown() : activity;
        } catch (JsonProcessingException e) {
            LOG.debugf("Unreadable activity entry: %s", e.getOriginalMessage());
            return SessionActivity.unknown();
        }
    }

    static String writeEvent(SessionEvent event) {
        return writeJson(event);
    }

    public static SessionEvent readEvent(String json) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(json, SessionEvent.class);
    }

    private static Set<String> readPermissions(String json) {
        if (json == null || json.isBlank()) {
            return Set.of();
        }
        try {
            return Set.copyOf(OBJECT_MAPPER.readValue(json, STRING_LIST));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid permissions", e);
        }
    }

    private static String writeJson(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static void putIfPresent(Map<String, String> fields, String name, String value) {
        if (value != null) {
            fields.put(name, value);
        }
    }
}
