package turnstile.adapter.in.dto;

import java.util.Optional;

import turnstile.core.model.session.UserSession;

/**
 * One of the caller's sessions as shown in the session list.
 *
 * @param sessionId     the session identifier
 * @param current       true for the session that made the request
 * @param loginTime     creation time in epoch milliseconds
 * @param lastActivity  last activity time in epoch milliseconds
 * @param ipAddress     client IP address at login
 * @param userAgent     client user agent at login
 * @param deviceId      device identifier, when the client supplied one
 */
public record SessionSummaryDto(
        String sessionId,
        boolean current,
        long loginTime,
        long lastActivity,
        String ipAddress,
        String userAgent,
        Optional<String> deviceId) {

    public static SessionSummaryDto from(String sessionId, UserSession session, String currentSessionId) {
        return new SessionSummaryDto(
                sessionId,
                sessionId.equals(currentSessionId),
                session.loginTime(),
                session.lastActivity(),
                session.ipAddress(),
                session.userAgent(),
                session.deviceIdOptional());
    }
}
