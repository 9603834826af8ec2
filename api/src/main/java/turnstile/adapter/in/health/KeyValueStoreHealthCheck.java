package turnstile.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import turnstile.core.service.store.KeyValueStoreRegistry;

/**
 * Readiness check for the selected key-value store.
 *
 * <p>The instance is not ready while the store is down: every protected route would
 * answer 503.
 */
@Readiness
@ApplicationScoped
public class KeyValueStoreHealthCheck implements AsyncHealthCheck {

    private final KeyValueStoreRegistry registry;

    @Inject
    public KeyValueStoreHealthCheck(KeyValueStoreRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Uni<HealthCheckResponse> call() {
        return registry.getSelectedProvider().healthCheck();
    }
}
