package turnstile.core.model.session;

import java.util.Optional;
import java.util.Set;

/**
 * One authenticated browser or device context.
 *
 * <p>Sessions are created on login and stored server-side as a hash keyed by the
 * session id. Only {@link #lastActivity()} changes after creation.
 *
 * @param userId owning user (must match the token subject)
 * @param username display name of the user
 * @param email user email address
 * @param role user role (e.g. {@code user}, {@code admin})
 * @param permissions capability strings granted to the user
 * @param loginTime creation time in epoch milliseconds
 * @param lastActivity last activity time in epoch milliseconds
 * @param ipAddress client IP address at login
 * @param userAgent client user agent at login
 * @param deviceId optional device identifier, may be null
 */
public record UserSession(
        String userId,
        String username,
        String email,
        String role,
        Set<String> permissions,
        long loginTime,
        long lastActivity,
        String ipAddress,
        String userAgent,
        String deviceId) {

    public UserSession {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
        if (lastActivity < loginTime) {
            throw new IllegalArgumentException("lastActivity cannot precede loginTime");
        }
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public Optional<String> deviceIdOptional() {
        return Optional.ofNullable(deviceId);
    }

    public boolean hasRole(String expected) {
        return expected != null && expected.equals(role);
    }
}
