package sentinel.adapter.out.config;

import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import sentinel.config.DefinitionsConfig;
import sentinel.config.GatewayConfig;
import sentinel.core.port.out.AgentDirectory;
import sentinel.core.port.out.ServiceCatalog;

/**
 * Produces the service catalog and agent directory from the definition files.
 *
 * <p>Both tables are loaded once; a {@link sentinel.core.model.ConfigurationException}
 * here aborts startup.
 */
@ApplicationScoped
public class DefinitionProducer {

    private static final Logger LOG = Logger.getLogger(DefinitionProducer.class);

    private final DefinitionsConfig definitionsConfig;
    private final GatewayConfig gatewayConfig;
    private final YamlDefinitionLoader loader = new YamlDefinitionLoader();

    @Inject
    public DefinitionProducer(DefinitionsConfig definitionsConfig, GatewayConfig gatewayConfig) {
        this.definitionsConfig = definitionsConfig;
        this.gatewayConfig = gatewayConfig;
    }

    @Produces
    @Singleton
    public ServiceCatalog serviceCatalog() {
        return loader.loadServices(
                Path.of(definitionsConfig.servicesPath()),
                gatewayConfig.defaultTimeout().toMillis());
    }

    @Produces
    @Singleton
    public AgentDirectory agentDirectory(ServiceCatalog catalog) {
        final var agentsPath = Path.of(definitionsConfig.agentsPath());
        return loader.loadAgents(agentsPath, catalog.serviceNames()).orElseGet(() -> {
            LOG.infov("No agents file at {0}, using single-token mode", agentsPath.toAbsolutePath());
            return InMemoryAgentDirectory.singleToken();
        });
    }
}
