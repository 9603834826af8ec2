package turnstile.core.model.auth;

import java.util.Locale;
import java.util.Optional;

/**
 * Subscription tiers, totally ordered by {@link #level()}.
 */
public enum SubscriptionPlan {
    FREE(0),
    BASIC(1),
    PREMIUM(2);

    private final int level;

    SubscriptionPlan(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /** Value as it appears in tokens, headers and response bodies. */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAtLeast(SubscriptionPlan required) {
        return level >= required.level;
    }

    /**
     * Parses a wire value such as {@code "basic"}.
     *
     * @return the plan, or empty if the value is not a known plan
     */
    public static Optional<SubscriptionPlan> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (var plan : values()) {
            if (plan.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(plan);
            }
        }
        return Optional.empty();
    }
}
