package turnstile.core.service.routing;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import turnstile.core.config.RoutingConfig;
import turnstile.core.model.auth.SubscriptionPlan;
import turnstile.core.model.routing.RouteRule;
import turnstile.core.model.routing.RouteTable;

/**
 * Builds the immutable plan-rule table once at startup.
 */
@ApplicationScoped
public class RouteTableFactory {

    private static final Logger LOG = Logger.getLogger(RouteTableFactory.class);

    @Produces
    @Singleton
    RouteTable routeTable(RoutingConfig config) {
        var table = fromEntries(config.planRules());
        LOG.infof("Loaded %d plan rules", table.size());
        return table;
    }

    /**
     * Parse {@code path=plan} entries, keeping declaration order.
     *
     * @throws IllegalArgumentException on an entry without a path or with an unknown plan
     */
    public static RouteTable fromEntries(List<String> entries) {
        var rules = new ArrayList<RouteRule>();
        for (var entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            var eq = entry.lastIndexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Plan rule must be path=plan: " + entry);
            }
            var path = entry.substring(0, eq).trim();
            var planValue = entry.substring(eq + 1).trim();
            var plan = SubscriptionPlan.fromWireValue(planValue)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown plan in rule: " + entry));
            rules.add(new RouteRule(path, plan));
        }
        return new RouteTable(rules);
    }
}
