package sentinel.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import sentinel.adapter.in.dto.HealthResponse;
import sentinel.core.port.out.ServiceCatalog;

/**
 * Unauthenticated liveness endpoint listing the configured services.
 */
@Path("/health")
@ApplicationScoped
public class HealthResource {

    private final ServiceCatalog catalog;

    @Inject
    public HealthResource(ServiceCatalog catalog) {
        this.catalog = catalog;
    }

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public HealthResponse health() {
        return new HealthResponse("ok", catalog.serviceNames());
    }
}
