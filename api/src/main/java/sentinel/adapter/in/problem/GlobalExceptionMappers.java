package sentinel.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import sentinel.adapter.in.dto.ErrorResponse;

/**
 * Maps exceptions that escape the resources to {@code {"error": ...}} bodies.
 *
 * <p>Admission decisions never arrive here; they are returned as values. These mappers
 * keep framework and programming errors in the same JSON shape.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapWebApplicationException(WebApplicationException e) {
        final var status = e.getResponse().getStatus();
        LOG.debugv("HTTP error {0}: {1}", status, e.getMessage());
        return toResponse(status, e.getResponse().getStatusInfo().getReasonPhrase());
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(400, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapUnexpected(Exception e) {
        LOG.error("Unhandled exception while processing request", e);
        return toResponse(500, "Internal server error");
    }

    private static Response toResponse(int status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(ErrorResponse.of(message))
                .build();
    }
}
