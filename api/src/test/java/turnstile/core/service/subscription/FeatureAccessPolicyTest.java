package turnstile.core.service.subscription;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.core.model.auth.SubscriptionPlan;
import turnstile.core.model.auth.SubscriptionStatus;
import turnstile.core.model.auth.UserClaims;
import turnstile.support.TestConfigs;

@DisplayName("FeatureAccessPolicy")
class FeatureAccessPolicyTest {

    private FeatureAccessPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new FeatureAccessPolicy(new TestConfigs.TestSubscriptionConfig(), new SubscriptionGate());
    }

    @Test
    @DisplayName("should map features to the plan that unlocks them")
    void shouldResolveRequiredPlan() {
        assertEquals(SubscriptionPlan.BASIC, policy.requiredPlan("real_time_data"));
        assertEquals(SubscriptionPlan.PREMIUM, policy.requiredPlan("institutional_tools"));
    }

    @Test
    @DisplayName("should treat unknown features as free")
    void shouldTreatUnknownAsFree() {
        assertEquals(SubscriptionPlan.FREE, policy.requiredPlan("watchlist"));
        var free = new UserClaims("u", SubscriptionPlan.FREE, SubscriptionStatus.ACTIVE, null);
        assertTrue(policy.canUse(free, "watchlist"));
    }

    @Test
    @DisplayName("should use the effective plan")
    void shouldUseEffectivePlan() {
        var expiredPremium = new UserClaims("u", SubscriptionPlan.PREMIUM, SubscriptionStatus.EXPIRED, null);
        var activeBasic = new UserClaims("u", SubscriptionPlan.BASIC, SubscriptionStatus.ACTIVE, null);

        assertFalse(policy.canUse(expiredPremium, "price_alerts"));
        assertTrue(policy.canUse(activeBasic, "price_alerts"));
        assertFalse(policy.canUse(activeBasic, "priority_support"));
    }

    @Test
    @DisplayName("should list entitlements in table order")
    void shouldListEntitlements() {
        var entitlements =
                policy.entitlements(new UserClaims("u", SubscriptionPlan.BASIC, SubscriptionStatus.TRIAL, null));

        assertEquals(10, entitlements.size());
        assertEquals("real_time_data", entitlements.keySet().iterator().next());
        assertTrue(entitlements.get("ai_insights"));
        assertFalse(entitlements.get("unlimited_watchlists"));
    }

    @Test
    @DisplayName("should reject malformed entries")
    void shouldRejectMalformedEntries() {
        assertThrows(IllegalArgumentException.class, () -> FeatureAccessPolicy.parse(List.of("no_plan")));
        assertThrows(IllegalArgumentException.class, () -> FeatureAccessPolicy.parse(List.of("x=gold")));
    }
}
