package sentinel.adapter.out.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jboss.logging.Logger;

import sentinel.core.model.AgentIdentity;
import sentinel.core.model.ConfigurationException;
import sentinel.core.model.ServiceDefinition;

/**
 * Loads and validates the service and agent definition files.
 *
 * <p>Every problem is reported as a {@link ConfigurationException} naming the offending
 * service or agent. Relative paths resolve against the working directory.
 */
public class YamlDefinitionLoader {

    private static final Logger LOG = Logger.getLogger(YamlDefinitionLoader.class);

    private final ObjectMapper mapper;

    public YamlDefinitionLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param path             the services file
     * @param defaultTimeoutMs deadline for services that declare none
     * @return the validated catalog
     */
    public InMemoryServiceCatalog loadServices(Path path, long defaultTimeoutMs) {
        final var absolute = path.toAbsolutePath();
        if (!Files.isRegularFile(absolute)) {
            throw new ConfigurationException("Config file not found: " + absolute);
        }

        final var file = read(absolute, ServicesFile.class);
        if (file == null || file.services() == null) {
            throw new ConfigurationException("Config must have a top-level 'services' map");
        }

        final Map<String, ServiceDefinition> services = new LinkedHashMap<>();
        for (var entry : file.services().entrySet()) {
            final var name = entry.getKey();
            if (entry.getValue() == null) {
                throw new ConfigurationException("Service \"%s\": definition is empty".formatted(name));
            }
            try {
                services.put(name, entry.getValue().toModel(name, defaultTimeoutMs));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Service \"%s\": %s".formatted(name, e.getMessage()), e);
            }
        }

        LOG.infov("Loaded {0} service(s) from {1}: {2}", services.size(), absolute, services.keySet());
        return new InMemoryServiceCatalog(services, file.toGlobalPolicy());
    }

    /**
     * @param path         the agents file
     * @param serviceNames services an agent may be scoped to
     * @return the validated directory, or empty when the file does not exist
     */
    public Optional<InMemoryAgentDirectory> loadAgents(Path path, Collection<String> serviceNames) {
        final var absolute = path.toAbsolutePath();
        if (!Files.exists(absolute)) {
            return Optional.empty();
        }

        final var file = read(absolute, AgentsFile.class);
        if (file == null || file.agents() == null) {
            throw new ConfigurationException("agents.yaml must have a top-level 'agents' map");
        }

        final var known = new HashSet<>(serviceNames);
        final Map<String, AgentIdentity> byToken = new HashMap<>();
        for (var entry : file.agents().entrySet()) {
            final var name = entry.getKey();
            final var agentEntry = entry.getValue();
            if (agentEntry == null) {
                throw new ConfigurationException("Agent \"%s\": missing or invalid token".formatted(name));
            }
            if (agentEntry.allowedServices() != null && agentEntry.allowedServices().contains(null)) {
                throw new ConfigurationException("Agent \"%s\": allowed_services entries must be strings".formatted(name));
            }

            final AgentIdentity agent;
            try {
                agent = agentEntry.toModel(name);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Agent \"%s\": %s".formatted(name, e.getMessage()), e);
            }

            final var unknown = new ArrayList<String>();
            for (var service : agent.allowedServices()) {
                if (!known.contains(service)) {
                    unknown.add(service);
                }
            }
            if (!unknown.isEmpty()) {
                throw new ConfigurationException(
                        "Agent \"%s\": allowed_services references unknown service(s) %s. Available: %s"
                                .formatted(name, unknown, String.join(", ", serviceNames)));
            }

            final var existing = byToken.putIfAbsent(agent.token(), agent);
            if (existing != null) {
                throw new ConfigurationException("Duplicate agent token: agents \"%s\" and \"%s\" share the same token"
                        .formatted(existing.name(), name));
            }
        }

        LOG.infov("Loaded {0} agent(s) from {1}", byToken.size(), absolute);
        return Optional.of(new InMemoryAgentDirectory(byToken));
    }

    private <T> T read(Path path, Class<T> type) {
        try {
            return mapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse %s: %s".formatted(path, e.getMessage()), e);
        }
    }

}
