package sentinel.adapter.in.rest;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import sentinel.adapter.in.dto.ErrorResponse;
import sentinel.adapter.in.dto.ProxyRequestBody;
import sentinel.adapter.in.http.ClientContextExtractor;
import sentinel.core.model.ProxyOutcome;
import sentinel.core.port.in.AdmissionUseCase;

/**
 * Agent-facing proxy endpoint.
 *
 * <p>Agents authenticate with {@code x-agent-token} and describe the upstream call in
 * the JSON body. Successful calls relay the upstream status, content type and raw
 * body; every other outcome is a {@code {"error": ...}} JSON body.
 */
@Path("/v1/proxy")
@ApplicationScoped
public class ProxyResource {

    static final String TOKEN_HEADER = "x-agent-token";

    private final AdmissionUseCase admissionUseCase;
    private final ClientContextExtractor clientContextExtractor;
    private final ObjectMapper objectMapper;

    @Inject
    public ProxyResource(
            AdmissionUseCase admissionUseCase,
            ClientContextExtractor clientContextExtractor,
            ObjectMapper objectMapper) {
        this.admissionUseCase = admissionUseCase;
        this.clientContextExtractor = clientContextExtractor;
        this.objectMapper = objectMapper;
    }

    @POST
    @Path("{service}")
    @Consumes(MediaType.WILDCARD)
    public Uni<Response> proxy(
            @PathParam("service") String service,
            @Context ContainerRequestContext requestContext,
            @Context HttpServerRequest httpRequest,
            String body) {
        final var token = Optional.ofNullable(requestContext.getHeaderString(TOKEN_HEADER));
        final var socketIp = httpRequest != null && httpRequest.remoteAddress() != null
                ? httpRequest.remoteAddress().hostAddress()
                : null;
        final var client = clientContextExtractor.extract(requestContext, socketIp);
        final var request = ProxyRequestBody.parse(objectMapper, body).toModel();

        return admissionUseCase.admit(service, token, request, client).map(ProxyResource::toResponse);
    }

    static Response toResponse(ProxyOutcome outcome) {
        if (outcome instanceof ProxyOutcome.Forwarded forwarded) {
            final var builder = Response.status(forwarded.statusCode());
            forwarded.contentType().ifPresent(type -> builder.header("Content-Type", type));
            if (forwarded.body().length > 0) {
                builder.entity(forwarded.body());
            }
            return builder.build();
        }

        final var failure = (ProxyOutcome.Failure) outcome;
        final var builder = Response.status(failure.statusCode()).type(MediaType.APPLICATION_JSON);
        if (failure instanceof ProxyOutcome.ServiceNotFound notFound) {
            return builder.entity(new ErrorResponse(failure.message(), notFound.available()))
                    .build();
        }
        if (failure instanceof ProxyOutcome.RateLimited rateLimited) {
            builder.header("Retry-After", String.valueOf(rateLimited.retryAfterSeconds()));
        }
        return builder.entity(ErrorResponse.of(failure.message())).build();
    }
}
