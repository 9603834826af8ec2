package turnstile.core.model.routing;

import turnstile.core.model.auth.SubscriptionPlan;

/**
 * Minimum plan required for a path and everything below it.
 *
 * @param path the path, starting with {@code /}
 * @param requiredPlan minimum plan
 */
public record RouteRule(String path, SubscriptionPlan requiredPlan) {

    public RouteRule {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Rule path must start with '/': " + path);
        }
        if (requiredPlan == null) {
            throw new IllegalArgumentException("Required plan cannot be null");
        }
        path = PathMatching.stripTrailingSlash(path);
    }

    public boolean matchesPrefix(String requestPath) {
        return PathMatching.isUnder(requestPath, path);
    }
}
