package turnstile.core.model.routing;

import java.util.Optional;

import turnstile.core.model.auth.SubscriptionPlan;

/**
 * Outcome of classifying a request.
 *
 * @param category the route category
 * @param requiredPlan minimum plan, only present for {@link RouteCategory#PAID_PROTECTED}
 * @param api whether the request targets the JSON API (denials answer with JSON, not redirects)
 */
public record RouteClassification(RouteCategory category, Optional<SubscriptionPlan> requiredPlan, boolean api) {

    public RouteClassification {
        if (category == null) {
            throw new IllegalArgumentException("Category cannot be null");
        }
        requiredPlan = requiredPlan == null ? Optional.empty() : requiredPlan;
        if (category == RouteCategory.PAID_PROTECTED && requiredPlan.isEmpty()) {
            throw new IllegalArgumentException("Paid-protected routes need a required plan");
        }
    }

    public static RouteClassification of(RouteCategory category, boolean api) {
        return new RouteClassification(category, Optional.empty(), api);
    }

    public static RouteClassification paid(SubscriptionPlan requiredPlan, boolean api) {
        return new RouteClassification(RouteCategory.PAID_PROTECTED, Optional.of(requiredPlan), api);
    }

    public static RouteClassification bypass() {
        return of(RouteCategory.BYPASS, false);
    }

    public boolean isBypass() {
        return category == RouteCategory.BYPASS;
    }

    public boolean requiresAuthentication() {
        return category.requiresAuthentication();
    }
}
