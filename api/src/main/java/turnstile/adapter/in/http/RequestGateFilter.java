package turnstile.adapter.in.http;

import java.util.HashMap;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.vertx.web.RouteFilter;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import turnstile.core.model.gate.CookieMutation;
import turnstile.core.model.gate.GateDecision;
import turnstile.core.model.gate.GateRequest;
import turnstile.core.port.in.RequestGateUseCase;
import turnstile.core.service.gate.RequestGateService;

/**
 * Runs every inbound request through the request gate.
 *
 * <p>Identity headers supplied by the client are always removed first, so downstream
 * handlers only ever see identity headers the gate set itself.
 */
@ApplicationScoped
public class RequestGateFilter {

    private static final Logger LOG = Logger.getLogger(RequestGateFilter.class);

    static final List<String> IDENTITY_HEADERS = List.of(
            RequestGateService.USER_ID_HEADER, RequestGateService.PLAN_HEADER, RequestGateService.STATUS_HEADER);

    private static final String JSON = "application/json";

    private final RequestGateUseCase gate;
    private final GateCookieManager cookieManager;

    @Inject
    public RequestGateFilter(RequestGateUseCase gate, GateCookieManager cookieManager) {
        this.gate = gate;
        this.cookieManager = cookieManager;
    }

    @RouteFilter(80)
    void gate(RoutingContext rc) {
        var request = rc.request();
        IDENTITY_HEADERS.forEach(request.headers()::remove);

        gate.evaluate(toGateRequest(rc))
                .subscribe()
                .with(decision -> apply(rc, decision), error -> {
                    LOG.errorv(error, "Request gate failed for {0}", request.path());
                    respondJson(rc, 503, errorBody("Authentication temporarily unavailable", "STORE_UNAVAILABLE"));
                });
    }

    GateRequest toGateRequest(RoutingContext rc) {
        HttpServerRequest request = rc.request();
        var headers = new HashMap<String, String>();
        for (var name : request.headers().names()) {
            headers.put(name, request.headers().get(name));
        }
        var path = rc.normalizedPath() != null ? rc.normalizedPath() : request.path();
        return new GateRequest(
                request.method().name(), path, request.query(), headers, cookieManager.readCookies(request));
    }

    void apply(RoutingContext rc, GateDecision decision) {
        var response = rc.response();
        decision.responseHeaders().forEach((name, value) -> response.putHeader(name, value));
        addCookies(rc, decision.cookies());

        if (decision instanceof GateDecision.Continue proceed) {
            proceed.forwardHeaders().forEach(rc.request().headers()::set);
            rc.next();
        } else if (decision instanceof GateDecision.Redirect redirect) {
            response.setStatusCode(307);
            response.putHeader(HttpHeaders.LOCATION, redirect.location());
            response.end();
        } else if (decision instanceof GateDecision.Unauthorized unauthorized) {
            respondJson(rc, 401, errorBody(unauthorized.message(), "UNAUTHORIZED"));
        } else if (decision instanceof GateDecision.Forbidden forbidden) {
            respondJson(rc, 403, errorBody("Subscription upgrade required", "SUBSCRIPTION_REQUIRED")
                    .put("required_plan", forbidden.requiredPlan().wireValue())
                    .put("current_path", forbidden.currentPath())
                    .put("upgrade_url", forbidden.upgradeUrl()));
        } else if (decision instanceof GateDecision.Unavailable unavailable) {
            respondJson(rc, 503, errorBody(unavailable.message(), "STORE_UNAVAILABLE"));
        }
    }

    private void addCookies(RoutingContext rc, List<CookieMutation> mutations) {
        for (var mutation : mutations) {
            rc.response().addCookie(cookieManager.toCookie(mutation));
        }
    }

    private void respondJson(RoutingContext rc, int status, JsonObject body) {
        var response = rc.response();
        response.setStatusCode(status);
        response.putHeader(HttpHeaders.CONTENT_TYPE, JSON);
        response.end(body.encode());
    }

    static JsonObject errorBody(String message, String code) {
        return new JsonObject().put("error", message).put("code", code);
    }
}
