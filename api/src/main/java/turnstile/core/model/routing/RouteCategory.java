package turnstile.core.model.routing;

/**
 * Static category of an inbound request, in evaluation order.
 */
public enum RouteCategory {
    /** Static assets, framework-internal requests and HEAD or OPTIONS page requests. */
    BYPASS,
    /** Exactly {@code /}. */
    ROOT,
    /** Login, registration and password flows; only for unauthenticated callers. */
    AUTH_ONLY,
    /** Requires a valid session but no particular plan. */
    FREE_PROTECTED,
    /** Requires a valid session and a minimum plan from the route table. */
    PAID_PROTECTED,
    /** Declared public; no session required. */
    PUBLIC,
    /** Matched nothing; unauthenticated callers are sent to the public landing page. */
    UNLISTED;

    public boolean requiresAuthentication() {
        return this == FREE_PROTECTED || this == PAID_PROTECTED;
    }
}
