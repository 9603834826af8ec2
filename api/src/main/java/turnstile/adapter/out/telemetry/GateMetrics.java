package turnstile.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import turnstile.core.config.MetricsConfig;
import turnstile.core.model.routing.RouteCategory;
import turnstile.core.port.out.Metrics;

/**
 * Records gate metrics with Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, so call sites never check
 * configuration themselves.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code turnstile.gate.decisions.total} - decisions by route category and outcome</li>
 *   <li>{@code turnstile.token.failures.total} - rejected tokens by failure category</li>
 *   <li>{@code turnstile.session.owner.mismatch.total} - session cookie presented with another user's token</li>
 *   <li>{@code turnstile.session.evictions.total} - sessions evicted by the concurrent-session limit</li>
 *   <li>{@code turnstile.store.timeouts.total} - store operation timeouts</li>
 *   <li>{@code turnstile.store.failures.total} - store operation failures other than timeouts</li>
 * </ul>
 */
@ApplicationScoped
public class GateMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public GateMetrics(MeterRegistry registry, MetricsConfig config) {
        this.registry = registry;
        this.enabled = registry != null && config != null && config.enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordGateDecision(RouteCategory category, String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.gate.decisions.total")
                .description("Gate decisions by route category and outcome")
                .tag("category", category.name().toLowerCase(Locale.ROOT))
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordTokenFailure(String failure) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.token.failures.total")
                .description("Rejected access tokens")
                .tag("failure", nullSafe(failure))
                .register(registry)
                .increment();
    }

    @Override
    public void recordSessionOwnerMismatch() {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.session.owner.mismatch.total")
                .description("Session cookies presented with a token for a different user")
                .register(registry)
                .increment();
    }

    @Override
    public void recordSessionsEvicted(int count) {
        if (!enabled || count <= 0) {
            return;
        }

        Counter.builder("turnstile.session.evictions.total")
                .description("Sessions evicted by the concurrent-session limit")
                .register(registry)
                .increment(count);
    }

    @Override
    public void recordStoreTimeout(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.store.timeouts.total")
                .description("Key-value store operation timeouts")
                .tag("store", nullSafe(store))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("turnstile.store.failures.total")
                .description("Key-value store operation failures (non-timeout)")
                .tag("store", nullSafe(store))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
