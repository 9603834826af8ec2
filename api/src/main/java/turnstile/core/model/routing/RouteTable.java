package turnstile.core.model.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import turnstile.core.model.auth.SubscriptionPlan;

/**
 * Immutable table of plan requirements.
 *
 * <p>Lookup checks the exact-match map first, then the prefix rules in declaration
 * order; the first matching prefix wins.
 */
public final class RouteTable {

    private final Map<String, SubscriptionPlan> exact;
    private final List<RouteRule> prefixes;

    public RouteTable(List<RouteRule> rules) {
        var exactMap = new LinkedHashMap<String, SubscriptionPlan>();
        for (var rule : rules) {
            exactMap.putIfAbsent(rule.path(), rule.requiredPlan());
        }
        this.exact = Collections.unmodifiableMap(exactMap);
        this.prefixes = List.copyOf(rules);
    }

    /**
     * Resolves the minimum plan for a request path.
     *
     * @return the required plan, or empty if no rule covers the path
     */
    public Optional<SubscriptionPlan> requiredPlan(String path) {
        if (path == null) {
            return Optional.empty();
        }
        var normalized = PathMatching.stripTrailingSlash(path);
        var exactMatch = exact.get(normalized);
        if (exactMatch != null) {
            return Optional.of(exactMatch);
        }
        for (var rule : prefixes) {
            if (rule.matchesPrefix(normalized)) {
                return Optional.of(rule.requiredPlan());
            }
        }
        return Optional.empty();
    }

    public int size() {
        return prefixes.size();
    }
}
