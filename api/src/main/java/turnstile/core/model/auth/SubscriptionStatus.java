package turnstile.core.model.auth;

import java.util.Locale;
import java.util.Optional;

/**
 * Billing state of a subscription.
 */
public enum SubscriptionStatus {
    ACTIVE,
    TRIAL,
    EXPIRED,
    CANCELLED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Expired and cancelled subscriptions grant nothing beyond the free tier. */
    public boolean collapsesToFree() {
        return this == EXPIRED || this == CANCELLED;
    }

    public static Optional<SubscriptionStatus> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (var status : values()) {
            if (status.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
