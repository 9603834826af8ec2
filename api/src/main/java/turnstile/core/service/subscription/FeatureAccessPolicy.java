package turnstile.core.service.subscription;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import turnstile.core.config.SubscriptionConfig;
import turnstile.core.model.auth.SubscriptionPlan;
import turnstile.core.model.auth.UserClaims;

/**
 * Maps named features to the plan that unlocks them. Features not in the table
 * are available to every plan.
 */
@ApplicationScoped
public class FeatureAccessPolicy {

    private final Map<String, SubscriptionPlan> features;
    private final SubscriptionGate gate;

    @Inject
    public FeatureAccessPolicy(SubscriptionConfig config, SubscriptionGate gate) {
        this(parse(config.features()), gate);
    }

    public FeatureAccessPolicy(Map<String, SubscriptionPlan> features, SubscriptionGate gate) {
        this.features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
        this.gate = gate;
    }

    public SubscriptionPlan requiredPlan(String feature) {
        return features.getOrDefault(feature, SubscriptionPlan.FREE);
    }

    public boolean canUse(UserClaims claims, String feature) {
        return gate.satisfies(claims, requiredPlan(feature));
    }

    /**
     * Every known feature with whether the caller may use it, in table order.
     */
    public Map<String, Boolean> entitlements(UserClaims claims) {
        var result = new LinkedHashMap<String, Boolean>();
        features.forEach((feature, plan) -> result.put(feature, gate.satisfies(claims, plan)));
        return result;
    }

    static Map<String, SubscriptionPlan> parse(List<String> entries) {
        var result = new LinkedHashMap<String, SubscriptionPlan>();
        for (var entry : entries) {
            var eq = entry.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Feature entry must be feature=plan: " + entry);
            }
            var feature = entry.substring(0, eq).trim();
            var plan = SubscriptionPlan.fromWireValue(entry.substring(eq + 1))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown plan in feature entry: " + entry));
            result.put(feature, plan);
        }
        return result;
    }
}
