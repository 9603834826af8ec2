package turnstile.adapter.in.rest;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.adapter.in.dto.EntitlementsDto;
import turnstile.adapter.in.dto.ErrorResponse;
import turnstile.adapter.in.dto.SessionSummaryDto;
import turnstile.adapter.in.http.GateCookieManager;
import turnstile.core.model.gate.CookieMutation;
import turnstile.core.model.session.UserSession;
import turnstile.core.port.in.SessionManagement;
import turnstile.core.service.subscription.FeatureAccessPolicy;

/**
 * REST resource for the caller's own sessions.
 *
 * <p>Every path lives under a protected API prefix, so the request gate has already
 * verified the token and bound the session before these methods run.
 */
@Path("/api/sessions")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

    private static final Logger LOG = Logger.getLogger(SessionResource.class);

    private final SessionManagement sessions;
    private final FeatureAccessPolicy featureAccess;
    private final GateCookieManager cookieManager;

    public SessionResource(
            SessionManagement sessions, FeatureAccessPolicy featureAccess, GateCookieManager cookieManager) {
        this.sessions = sessions;
        this.featureAccess = featureAccess;
        this.cookieManager = cookieManager;
    }

    /**
     * List the caller's live sessions, oldest first.
     */
    @GET
    public Uni<Response> listSessions(@Context HttpHeaders headers) {
        var caller = caller(headers);
        if (caller.isEmpty()) {
            return Uni.createFrom().item(unauthorized());
        }
        var current = caller.get();

        return sessions.getUserSessions(current.userId())
                .flatMap(ids -> loadSummaries(ids, current.sessionId()))
                .map(summaries -> Response.ok(Map.of("sessions", summaries, "count", summaries.size()))
                        .build());
    }

    @GET
    @Path("/current/activity")
    public Uni<Response> currentActivity(@Context HttpHeaders headers) {
        var caller = caller(headers);
        if (caller.isEmpty()) {
            return Uni.createFrom().item(unauthorized());
        }
        var sessionId = caller.get().sessionId();

        return sessions.getSessionActivity(sessionId)
                .map(activity -> Response.ok(Map.of("sessionId", sessionId, "activity", activity))
                        .build());
    }

    /**
     * Features unlocked by the caller's effective plan.
     */
    @GET
    @Path("/entitlements")
    public Response entitlements(@Context HttpHeaders headers) {
        var caller = caller(headers);
        if (caller.isEmpty()) {
            return unauthorized();
        }
        var claims = caller.get().claims();
        return Response.ok(new EntitlementsDto(
                        claims.effectivePlan().wireValue(),
                        claims.status().wireValue(),
                        featureAccess.entitlements(claims)))
                .build();
    }

    /**
     * Log out: destroy the current session and clear both credential cookies.
     */
    @DELETE
    @Path("/current")
    public Uni<Response> logout(@Context HttpHeaders headers) {
        var caller = caller(headers);
        if (caller.isEmpty()) {
            return Uni.createFrom().item(unauthorized());
        }
        var current = caller.get();

        return sessions.destroySession(current.sessionId()).map(destroyed -> {
            LOG.infof("User %s logged out (session existed: %s)", current.userId(), destroyed);
            return Response.noContent()
                    .header(
                            HttpHeaders.SET_COOKIE,
                            cookieManager.toSetCookieHeader(
                                    CookieMutation.clear(cookieManager.getSessionCookieName())))
                    .header(
                            HttpHeaders.SET_COOKIE,
                            cookieManager.toSetCookieHeader(
                                    CookieMutation.clear(cookieManager.getTokenCookieName())))
                    .build();
        });
    }

    /**
     * Log out everywhere except the current session.
     */
    @DELETE
    @Path("/others")
    public Uni<Response> logoutOthers(@Context HttpHeaders headers) {
        var caller = caller(headers);
        if (caller.isEmpty()) {
            return Uni.createFrom().item(unauthorized());
        }
        var current = caller.get();

        return sessions.destroyUserSessions(current.userId(), current.sessionId()).map(count -> {
            LOG.infof("User %s logged out %d other session(s)", current.userId(), count);
            return Response.ok(Map.of("destroyed", count)).build();
        });
    }

    private Uni<List<SessionSummaryDto>> loadSummaries(List<String> ids, String currentSessionId) {
        return Multi.createFrom()
                .iterable(ids)
                .onItem()
                .transformToUniAndConcatenate(
                        id -> sessions.getSession(id).map(found -> summary(id, found, currentSessionId)))
                .select()
                .where(Optional::isPresent)
                .map(Optional::get)
                .collect()
                .asList();
    }

    private static Optional<SessionSummaryDto> summary(
            String sessionId, Optional<UserSession> found, String currentSessionId) {
        return found.map(session -> SessionSummaryDto.from(sessionId, session, currentSessionId));
    }

    private Optional<CallerContext> caller(HttpHeaders headers) {
        return CallerContext.from(headers, cookieManager.getSessionCookieName());
    }

    static Response unauthorized() {
        return Response.status(Response.Status.UNAUTHORIZED)
                .entity(new ErrorResponse("Authentication required", "UNAUTHORIZED"))
                .build();
    }
}
