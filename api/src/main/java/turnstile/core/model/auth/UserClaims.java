package turnstile.core.model.auth;

import java.time.Instant;

/**
 * Claims read from a verified access token.
 *
 * @param subject the user id ({@code sub})
 * @param plan the stored subscription plan ({@code subscription_plan})
 * @param status the subscription status ({@code subscription_status})
 * @param expiresAt token expiry ({@code exp})
 */
public record UserClaims(String subject, SubscriptionPlan plan, SubscriptionStatus status, Instant expiresAt) {

    public UserClaims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (plan == null) {
            plan = SubscriptionPlan.FREE;
        }
        if (status == null) {
            status = SubscriptionStatus.ACTIVE;
        }
    }

    /**
     * The plan the caller is actually entitled to.
     *
     * <p>Expired and cancelled subscriptions collapse to {@link SubscriptionPlan#FREE}
     * regardless of the stored plan.
     */
    public SubscriptionPlan effectivePlan() {
        return status.collapsesToFree() ? SubscriptionPlan.FREE : plan;
    }
}
