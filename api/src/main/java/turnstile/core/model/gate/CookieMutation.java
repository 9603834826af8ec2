package turnstile.core.model.gate;

import java.time.Duration;

/**
 * Pending change to a response cookie, applied by the HTTP adapter.
 *
 * @param name cookie name
 * @param value new value, empty when clearing
 * @param maxAge cookie lifetime, zero to expire immediately, null for a browser-session cookie
 * @param path cookie path
 */
public record CookieMutation(String name, String value, Duration maxAge, String path) {

    public CookieMutation {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Cookie name cannot be null or blank");
        }
        value = value == null ? "" : value;
        path = path == null ? "/" : path;
    }

    public static CookieMutation clear(String name) {
        return new CookieMutation(name, "", Duration.ZERO, "/");
    }

    public static CookieMutation set(String name, String value, Duration maxAge) {
        return new CookieMutation(name, value, maxAge, "/");
    }

    public boolean isClear() {
        return Duration.ZERO.equals(maxAge);
    }
}
