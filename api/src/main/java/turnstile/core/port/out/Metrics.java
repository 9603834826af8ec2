package turnstile.core.port.out;

import turnstile.core.model.routing.RouteCategory;

/**
 * Port interface for recording gate metrics.
 */
public interface Metrics {

    boolean isEnabled();

    /**
     * Record a gate decision.
     *
     * @param category the route category of the request
     * @param outcome decision kind (continue, redirect, unauthorized, forbidden, unavailable)
     */
    void recordGateDecision(RouteCategory category, String outcome);

    /**
     * Record a rejected token.
     *
     * @param failure failure category
     */
    void recordTokenFailure(String failure);

    /**
     * Record a session owner mismatch.
     */
    void recordSessionOwnerMismatch();

    /**
     * Record sessions evicted by the concurrent-session limit.
     */
    void recordSessionsEvicted(int count);

    /**
     * Record a store timeout.
     *
     * @param store store name
     * @param operation operation that timed out
     */
    void recordStoreTimeout(String store, String operation);

    /**
     * Record a store failure other than a timeout.
     */
    void recordStoreFailure(String store, String operation);
}
