package turnstile.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Route classification tables.
 *
 * <p>Path lists match segment-wise: {@code /dashboard} covers {@code /dashboard/x}.
 * Plan rules are {@code path=plan} entries evaluated in declaration order.
 */
@ConfigMapping(prefix = "turnstile.routing")
public interface RoutingConfig {

    /**
     * Requests under this prefix are API calls and are denied with JSON instead of redirects.
     */
    @WithDefault("/api")
    String apiPrefix();

    @WithDefault("/,/landing,/pricing,/demo,/contact,/about,/features,/blog,/careers,/help-center,"
            + "/documentation,/security,/status,/tutorial,/auth/login,/auth/register,/auth/forgot-password,"
            + "/auth/reset-password,/auth/verify-email,/legal/terms,/legal/privacy,/support,"
            + "/api/auth/captcha,/api/auth/register,/api/auth/login,/api/auth/password-reset,"
            + "/api/auth/verify-email,/api/auth/reset-password-confirm")
    List<String> publicPaths();

    @WithDefault("/auth/login,/auth/register,/auth/forgot-password")
    List<String> authOnlyPaths();

    /**
     * Page prefixes that need a session but no particular plan.
     */
    @WithDefault("/dashboard,/portfolio,/trading,/analytics,/settings,/profile")
    List<String> protectedPaths();

    /**
     * API prefixes that need a session. Other API paths are left to their handlers.
     */
    @WithDefault("/api/sessions,/api/admin")
    List<String> protectedApiPaths();

    @WithDefault("/dashboard/analytics=basic,/dashboard/ai-insights=basic,/dashboard/social-trading=basic,"
            + "/dashboard/institutional=premium,/dashboard/advanced-charts=basic,"
            + "/dashboard/portfolio/advanced=basic,/dashboard/watchlist/premium=premium,"
            + "/api/analytics=basic,/api/ai-insights=basic,/api/social-trading=basic,"
            + "/api/institutional=premium")
    List<String> planRules();

    /**
     * Responses for paths under these prefixes are marked non-cacheable.
     */
    @WithDefault("/auth")
    List<String> noCachePaths();

    RedirectConfig redirects();

    BypassConfig bypass();

    /**
     * Redirect targets.
     */
    interface RedirectConfig {

        @WithDefault("/auth/login")
        String login();

        /**
         * Landing page for authenticated callers.
         */
        @WithDefault("/dashboard")
        String authenticatedHome();

        /**
         * Landing page for anonymous callers.
         */
        @WithDefault("/landing")
        String publicHome();

        @WithDefault("/pricing")
        String pricing();
    }

    /**
     * Heuristics for requests the gate never examines.
     */
    interface BypassConfig {

        @WithDefault("/_next/,/static/,/_vercel/,/q/")
        List<String> pathPrefixes();

        @WithDefault("_rsc,_next")
        List<String> queryParameters();

        /**
         * Headers whose mere presence marks a framework-internal request.
         */
        @WithDefault("next-router-state-tree,next-url,x-middleware-prefetch,x-middleware-invoke")
        List<String> presenceHeaders();

        /**
         * Headers that mark a framework-internal request when their value is {@code 1}.
         */
        @WithDefault("rsc,next-router-prefetch")
        List<String> flagHeaders();

        @WithDefault("text/x-component,application/rsc")
        List<String> acceptTypes();
    }
}
