package turnstile.core.service.routing;

import java.util.List;
import java.util.Locale;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import turnstile.core.config.RoutingConfig;
import turnstile.core.model.gate.GateRequest;
import turnstile.core.model.routing.PathMatching;
import turnstile.core.model.routing.RouteCategory;
import turnstile.core.model.routing.RouteClassification;
import turnstile.core.model.routing.RouteTable;

/**
 * Statically categorizes requests. Performs no I/O.
 *
 * <p>Page requests are checked in this order: bypass, root, auth-only, plan rules,
 * protected prefixes, public paths, otherwise unlisted. API requests (under the API
 * prefix) are examined only when they are public, covered by a plan rule or under a
 * protected API prefix; everything else is left to the API handler.
 */
@ApplicationScoped
public class RouteClassifier {

    private static final Set<String> BYPASS_METHODS = Set.of("HEAD", "OPTIONS");

    private final RoutingConfig config;
    private final RouteTable routeTable;

    @Inject
    public RouteClassifier(RoutingConfig config, RouteTable routeTable) {
        this.config = config;
        this.routeTable = routeTable;
    }

    public RouteClassification classify(GateRequest request) {
        var path = PathMatching.stripTrailingSlash(PathMatching.withoutMatrixParameters(request.path()));

        if (PathMatching.isUnder(path, config.apiPrefix())) {
            return classifyApi(request, path);
        }

        if (isBypass(request, path)) {
            return RouteClassification.bypass();
        }
        if ("/".equals(path)) {
            return RouteClassification.of(RouteCategory.ROOT, false);
        }
        if (matchesAny(config.authOnlyPaths(), path)) {
            return RouteClassification.of(RouteCategory.AUTH_ONLY, false);
        }
        var requiredPlan = routeTable.requiredPlan(path);
        if (requiredPlan.isPresent()) {
            return RouteClassification.paid(requiredPlan.get(), false);
        }
        if (matchesAny(config.protectedPaths(), path)) {
            return RouteClassification.of(RouteCategory.FREE_PROTECTED, false);
        }
        if (matchesAny(config.publicPaths(), path)) {
            return RouteClassification.of(RouteCategory.PUBLIC, false);
        }
        return RouteClassification.of(RouteCategory.UNLISTED, false);
    }

    private RouteClassification classifyApi(GateRequest request, String path) {
        if ("OPTIONS".equals(request.method())) {
            return RouteClassification.bypass();
        }
        if (matchesAny(config.publicPaths(), path)) {
            return RouteClassification.of(RouteCategory.PUBLIC, true);
        }
        var requiredPlan = routeTable.requiredPlan(path);
        if (requiredPlan.isPresent()) {
            return RouteClassification.paid(requiredPlan.get(), true);
        }
        if (matchesAny(config.protectedApiPaths(), path)) {
            return RouteClassification.of(RouteCategory.FREE_PROTECTED, true);
        }
        return RouteClassification.bypass();
    }

    private boolean isBypass(GateRequest request, String path) {
        var bypass = config.bypass();
        if (BYPASS_METHODS.contains(request.method())) {
            return true;
        }
        for (var prefix : bypass.pathPrefixes()) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        // Files with extensions
        if (path.contains(".")) {
            return true;
        }
        for (var parameter : bypass.queryParameters()) {
            if (request.hasQueryParameter(parameter)) {
                return true;
            }
        }
        for (var header : bypass.presenceHeaders()) {
            if (request.hasHeader(header)) {
                return true;
            }
        }
        for (var header : bypass.flagHeaders()) {
            if (request.header(header).filter("1"::equals).isPresent()) {
                return true;
            }
        }
        var accept = request.header("accept").map(a -> a.toLowerCase(Locale.ROOT));
        if (accept.isPresent()) {
            for (var type : bypass.acceptTypes()) {
                if (accept.get().contains(type)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean matchesAny(List<String> prefixes, String path) {
        for (var prefix : prefixes) {
            if (PathMatching.isUnder(path, PathMatching.stripTrailingSlash(prefix))) {
                return true;
            }
        }
        return false;
    }
}
