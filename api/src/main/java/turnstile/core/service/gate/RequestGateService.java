package turnstile.core.service.gate;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.RoutingConfig;
import turnstile.core.config.SessionConfig;
import turnstile.core.config.TokenConfig;
import turnstile.core.model.auth.TokenVerificationResult;
import turnstile.core.model.auth.UserClaims;
import turnstile.core.model.gate.AuthenticationState;
import turnstile.core.model.gate.CookieMutation;
import turnstile.core.model.gate.GateDecision;
import turnstile.core.model.gate.GateRequest;
import turnstile.core.model.routing.PathMatching;
import turnstile.core.model.routing.RouteClassification;
import turnstile.core.model.session.UserSession;
import turnstile.core.port.in.RequestGateUseCase;
import turnstile.core.port.in.SessionManagement;
import turnstile.core.port.out.Metrics;
import turnstile.core.port.out.TokenVerifier;
import turnstile.core.service.routing.RouteClassifier;
import turnstile.core.service.subscription.SubscriptionGate;

/**
 * The request gate: classify, authenticate, apply the plan gate, decide.
 *
 * <p>Per request the steps run strictly in sequence: route classification (no I/O),
 * token verification (no I/O), session lookup, plan comparison. Bypassed requests
 * never reach the token verifier or the store.
 *
 * <p>A session only authenticates a caller when it exists and belongs to the token
 * subject. Store outages deny access to protected routes (503) and leave public
 * routes reachable as an anonymous caller.
 */
@ApplicationScoped
public class RequestGateService implements RequestGateUseCase {

    private static final Logger LOG = Logger.getLogger(RequestGateService.class);

    public static final String USER_ID_HEADER = "x-user-id";
    public static final String PLAN_HEADER = "x-user-subscription-plan";
    public static final String STATUS_HEADER = "x-user-subscription-status";

    static final Map<String, String> NO_CACHE_HEADERS = Collections.unmodifiableMap(orderedMap(
            "Cache-Control", "no-cache, no-store, must-revalidate",
            "Pragma", "no-cache",
            "Expires", "0"));

    private final RouteClassifier classifier;
    private final TokenVerifier tokenVerifier;
    private final SessionManagement sessions;
    private final SubscriptionGate subscriptionGate;
    private final RoutingConfig routingConfig;
    private final String tokenCookie;
    private final String sessionCookie;
    private final Metrics metrics;

    public RequestGateService(
            RouteClassifier classifier,
            TokenVerifier tokenVerifier,
            SessionManagement sessions,
            SubscriptionGate subscriptionGate,
            RoutingConfig routingConfig,
            TokenConfig tokenConfig,
            SessionConfig sessionConfig,
            Metrics metrics) {
        this.classifier = classifier;
        this.tokenVerifier = tokenVerifier;
        this.sessions = sessions;
        this.subscriptionGate = subscriptionGate;
        this.routingConfig = routingConfig;
        this.tokenCookie = tokenConfig.cookieName();
        this.sessionCookie = sessionConfig.cookie().name();
        this.metrics = metrics;
    }

    @Override
    public Uni<GateDecision> evaluate(GateRequest request) {
        var classification = classifier.classify(request);
        if (classification.isBypass()) {
            return Uni.createFrom().item(GateDecision.Continue.unexamined());
        }

        return authenticate(request)
                .call(state -> touch(state, classification))
                .map(state -> decide(request, classification, state))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Gate evaluation failed for {0}", request.path());
                    return new GateDecision.Unavailable(
                            "Authentication temporarily unavailable", NO_CACHE_HEADERS, List.of());
                })
                .invoke(decision -> metrics.recordGateDecision(classification.category(), outcome(decision)));
    }

    /**
     * Resolve who the caller is. Never fails: store errors become
     * {@link AuthenticationState.StoreUnavailable}.
     */
    Uni<AuthenticationState> authenticate(GateRequest request) {
        var cookieToken = request.cookie(tokenCookie);
        var token = cookieToken.or(request::bearerToken);
        var sessionId = request.cookie(sessionCookie);

        if (token.isEmpty() || sessionId.isEmpty()) {
            return Uni.createFrom().item(AuthenticationState.Anonymous.noCredentials());
        }

        var cookiesToClear = new ArrayList<CookieMutation>();
        if (cookieToken.isPresent()) {
            cookiesToClear.add(CookieMutation.clear(tokenCookie));
        }
        cookiesToClear.add(CookieMutation.clear(sessionCookie));

        var verification = tokenVerifier.verify(token.get());
        if (!(verification instanceof TokenVerificationResult.Verified verified)) {
            var reason = verification instanceof TokenVerificationResult.Invalid invalid
                    ? invalid.reason()
                    : "no token";
            LOG.debugv("Rejected access token: {0}", reason);
            return Uni.createFrom().item(new AuthenticationState.Anonymous(reason, cookiesToClear));
        }

        var claims = verified.claims();
        return sessions.getSession(sessionId.get())
                .map(found -> bindSession(sessionId.get(), found, claims, cookiesToClear))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Session store unavailable: {0}", error.getMessage());
                    return new AuthenticationState.StoreUnavailable(error.getMessage());
                });
    }

    /**
     * A session authenticates the caller only when it exists and belongs to the token subject.
     */
    private AuthenticationState bindSession(
            String sessionId, Optional<UserSession> found, UserClaims claims, List<CookieMutation> cookiesToClear) {
        if (found.isEmpty()) {
            LOG.debugv("Session not found for user {0}", claims.subject());
            return new AuthenticationState.Anonymous("session not found", cookiesToClear);
        }
        var session = found.get();
        if (!session.userId().equals(claims.subject())) {
            LOG.warnv(
                    "Session owner mismatch: token subject {0} presented a session owned by {1}",
                    claims.subject(),
                    session.userId());
            metrics.recordSessionOwnerMismatch();
            return new AuthenticationState.Anonymous("session owner mismatch", cookiesToClear);
        }
        return new AuthenticationState.Authenticated(sessionId, session, claims);
    }

    /**
     * Best-effort activity bump for authenticated requests on protected routes.
     */
    private Uni<Boolean> touch(AuthenticationState state, RouteClassification classification) {
        if (!(state instanceof AuthenticationState.Authenticated authenticated)
                || !classification.requiresAuthentication()) {
            return Uni.createFrom().item(false);
        }
        return sessions.updateActivity(authenticated.sessionId()).onFailure().recoverWithItem(error -> {
            LOG.warnv("Activity update failed: {0}", error.getMessage());
            return false;
        });
    }

    GateDecision decide(GateRequest request, RouteClassification classification, AuthenticationState state) {
        var path = request.path();
        var responseHeaders = isNoCachePath(path) ? NO_CACHE_HEADERS : Map.<String, String>of();
        var cookies = state instanceof AuthenticationState.Anonymous anonymous
                ? anonymous.cookiesToClear()
                : List.<CookieMutation>of();
        var claims = state instanceof AuthenticationState.Authenticated authenticated
                ? Optional.of(authenticated.claims())
                : Optional.<UserClaims>empty();
        var redirects = routingConfig.redirects();

        switch (classification.category()) {
            case ROOT:
                return new GateDecision.Redirect(
                        claims.isPresent() ? redirects.authenticatedHome() : redirects.publicHome(),
                        responseHeaders,
                        cookies);

            case AUTH_ONLY:
                if (claims.isPresent()) {
                    return new GateDecision.Redirect(redirects.authenticatedHome(), NO_CACHE_HEADERS, cookies);
                }
                return new GateDecision.Continue(true, Map.of(), responseHeaders, cookies);

            case FREE_PROTECTED:
            case PAID_PROTECTED:
                if (state instanceof AuthenticationState.StoreUnavailable) {
                    return new GateDecision.Unavailable(
                            "Authentication temporarily unavailable", NO_CACHE_HEADERS, cookies);
                }
                if (claims.isEmpty()) {
                    LOG.debugv("Unauthenticated request to protected route {0}", path);
                    if (classification.api()) {
                        return new GateDecision.Unauthorized("Authentication required", NO_CACHE_HEADERS, cookies);
                    }
                    return new GateDecision.Redirect(
                            redirects.login() + "?redirect=" + encode(path), responseHeaders, cookies);
                }
                var requiredPlan = classification.requiredPlan();
                if (requiredPlan.isPresent() && !subscriptionGate.satisfies(claims.get(), requiredPlan.get())) {
                    LOG.debugv(
                            "User {0} on plan {1} needs {2} for {3}",
                            claims.get().subject(),
                            claims.get().effectivePlan().wireValue(),
                            requiredPlan.get().wireValue(),
                            path);
                    if (classification.api()) {
                        return new GateDecision.Forbidden(
                                requiredPlan.get(), path, redirects.pricing(), NO_CACHE_HEADERS, cookies);
                    }
                    return new GateDecision.Redirect(
                            redirects.pricing() + "?upgrade=true&feature=" + encode(path), responseHeaders, cookies);
                }
                return new GateDecision.Continue(true, identityHeaders(claims.get()), responseHeaders, cookies);

            case UNLISTED:
                if (claims.isEmpty()) {
                    return new GateDecision.Redirect(redirects.publicHome(), responseHeaders, cookies);
                }
                return new GateDecision.Continue(true, identityHeaders(claims.get()), responseHeaders, cookies);

            case PUBLIC:
            default:
                return new GateDecision.Continue(
                        true, claims.map(this::identityHeaders).orElse(Map.of()), responseHeaders, cookies);
        }
    }

    private Map<String, String> identityHeaders(UserClaims claims) {
        return orderedMap(
                USER_ID_HEADER, claims.subject(),
                PLAN_HEADER, claims.effectivePlan().wireValue(),
                STATUS_HEADER, claims.status().wireValue());
    }

    private boolean isNoCachePath(String path) {
        for (var prefix : routingConfig.noCachePaths()) {
            if (PathMatching.isUnder(path, PathMatching.stripTrailingSlash(prefix))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Query-encode a path but keep {@code /} readable.
     */
    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("%2F", "/");
    }

    private static String outcome(GateDecision decision) {
        if (decision instanceof GateDecision.Continue) {
            return "continue";
        } else if (decision instanceof GateDecision.Redirect) {
            return "redirect";
        } else if (decision instanceof GateDecision.Unauthorized) {
            return "unauthorized";
        } else if (decision instanceof GateDecision.Forbidden) {
            return "forbidden";
        }
        return "unavailable";
    }

    private static Map<String, String> orderedMap(String... keyValues) {
        var map = new LinkedHashMap<String, String>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
