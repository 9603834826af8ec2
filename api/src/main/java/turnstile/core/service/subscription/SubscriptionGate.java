package turnstile.core.service.subscription;

import jakarta.enterprise.context.ApplicationScoped;

import turnstile.core.model.auth.SubscriptionPlan;
import turnstile.core.model.auth.UserClaims;

/**
 * Compares a caller's plan against a required plan.
 *
 * <p>Pure: the effective plan collapses to free for expired and cancelled
 * subscriptions, then plans compare by level.
 */
@ApplicationScoped
public class SubscriptionGate {

    public boolean satisfies(UserClaims claims, SubscriptionPlan requiredPlan) {
        if (requiredPlan == null || requiredPlan == SubscriptionPlan.FREE) {
            return true;
        }
        if (claims == null) {
            return false;
        }
        return claims.effectivePlan().isAtLeast(requiredPlan);
    }
}
