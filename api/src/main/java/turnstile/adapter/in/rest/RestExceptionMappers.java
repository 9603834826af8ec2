package turnstile.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import turnstile.adapter.in.dto.ErrorResponse;
import turnstile.core.port.out.StoreUnavailableException;

/**
 * Maps exceptions escaping the REST endpoints to the JSON error body used by the gate.
 */
@ApplicationScoped
public class RestExceptionMappers {

    private static final Logger LOG = Logger.getLogger(RestExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapStoreUnavailable(StoreUnavailableException e) {
        LOG.warnv("Store unavailable during {0}: {1}", e.getOperation(), e.getMessage());
        return toResponse(
                Response.Status.SERVICE_UNAVAILABLE,
                new ErrorResponse("Session store temporarily unavailable", "STORE_UNAVAILABLE"));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(Response.Status.BAD_REQUEST, new ErrorResponse(e.getMessage(), "BAD_REQUEST"));
    }

    private Response toResponse(Response.Status status, ErrorResponse body) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }
}
