package turnstile.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Session lifecycle configuration.
 */
@ConfigMapping(prefix = "turnstile.session")
public interface SessionConfig {

    /**
     * Session lifetime; also the sliding window when extending on activity.
     */
    @WithDefault("PT24H")
    Duration maxAge();

    /**
     * Maximum live sessions per user. 0 disables the limit.
     */
    @WithDefault("5")
    int maxConcurrentSessions();

    /**
     * Reset the session TTL whenever a protected request succeeds.
     */
    @WithDefault("true")
    boolean extendOnActivity();

    /**
     * Append lifecycle records to the per-session activity log.
     */
    @WithDefault("true")
    boolean trackActivity();

    /**
     * Number of activity records kept per session.
     */
    @WithDefault("100")
    int activityLogSize();

    CookieConfig cookie();

    EventsConfig events();

    CleanupConfig cleanup();

    /**
     * Attributes of the credential cookies.
     */
    interface CookieConfig {

        /**
         * Name of the session id cookie.
         */
        @WithDefault("session_id")
        String name();

        @WithDefault("/")
        String path();

        @WithDefault("true")
        boolean secure();

        @WithDefault("true")
        boolean httpOnly();

        /**
         * SameSite attribute: Strict, Lax or None.
         */
        @WithDefault("Lax")
        String sameSite();
    }

    /**
     * Session lifecycle events over the store's pub/sub.
     */
    interface EventsConfig {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("turnstile:session-events")
        String channel();
    }

    /**
     * Periodic sweep of the global active-session index.
     */
    interface CleanupConfig {

        @WithDefault("true")
        boolean enabled();

        /**
         * Sweep interval, e.g. {@code 5m}. Read by the scheduler expression.
         */
        @WithDefault("5m")
        String interval();
    }
}
