package turnstile.adapter.in.rest;

import java.util.Map;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.adapter.in.dto.ErrorResponse;
import turnstile.adapter.in.http.GateCookieManager;
import turnstile.core.port.in.SessionManagement;

/**
 * REST resource for session administration.
 *
 * <p>Requires a session whose role is {@value #ADMIN_ROLE}.
 */
@Path("/api/admin/sessions")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AdminSessionResource {

    private static final Logger LOG = Logger.getLogger(AdminSessionResource.class);

    static final String ADMIN_ROLE = "admin";

    private final SessionManagement sessions;
    private final GateCookieManager cookieManager;

    public AdminSessionResource(SessionManagement sessions, GateCookieManager cookieManager) {
        this.sessions = sessions;
        this.cookieManager = cookieManager;
    }

    @GET
    @Path("/stats")
    public Uni<Response> stats(@Context HttpHeaders headers) {
        return asAdmin(headers, () -> sessions.getSessionStats()
                .map(stats -> Response.ok(stats).build()));
    }

    /**
     * Run the expired-session sweep now instead of waiting for the scheduler.
     */
    @POST
    @Path("/cleanup")
    public Uni<Response> cleanup(@Context HttpHeaders headers) {
        return asAdmin(headers, () -> sessions.cleanupExpiredSessions().map(removed -> {
            LOG.infof("Manual session cleanup removed %d stale index entries", removed);
            return Response.ok(Map.of("removed", removed)).build();
        }));
    }

    private Uni<Response> asAdmin(HttpHeaders headers, Supplier<Uni<Response>> action) {
        var caller = CallerContext.from(headers, cookieManager.getSessionCookieName());
        if (caller.isEmpty()) {
            return Uni.createFrom().item(SessionResource.unauthorized());
        }
        var userId = caller.get().userId();

        return sessions.getSession(caller.get().sessionId()).flatMap(session -> {
            if (session.isEmpty() || !session.get().hasRole(ADMIN_ROLE)) {
                LOG.debugv("User {0} denied session administration", userId);
                return Uni.createFrom()
                        .item(Response.status(Response.Status.FORBIDDEN)
                                .entity(new ErrorResponse("Admin role required", "FORBIDDEN"))
                                .build());
            }
            return action.get();
        });
    }
}
