package sentinel.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import sentinel.core.port.out.AgentDirectory;
import sentinel.core.port.out.ServiceCatalog;

/**
 * Reports the loaded definitions.
 *
 * <p>Always UP: invalid definitions abort startup, so a running gateway has a usable
 * catalog.
 */
@Readiness
@ApplicationScoped
public class DefinitionsHealthCheck implements HealthCheck {

    private final ServiceCatalog catalog;
    private final AgentDirectory agentDirectory;

    @Inject
    public DefinitionsHealthCheck(ServiceCatalog catalog, AgentDirectory agentDirectory) {
        this.catalog = catalog;
        this.agentDirectory = agentDirectory;
    }

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("definitions")
                .up()
                .withData("services", catalog.serviceNames().size())
                .withData("authMode", agentDirectory.isPerAgentMode() ? "per-agent" : "single-token")
                .withData("agents", agentDirectory.size())
                .build();
    }
}
