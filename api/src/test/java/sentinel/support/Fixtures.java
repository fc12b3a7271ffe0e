package sentinel.support;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import sentinel.adapter.out.config.InMemoryAgentDirectory;
import sentinel.adapter.out.config.InMemoryServiceCatalog;
import sentinel.core.model.AgentIdentity;
import sentinel.core.model.AuthInjection;
import sentinel.core.model.GlobalPolicy;
import sentinel.core.model.ServiceDefinition;

/**
 * Definitions shared by unit tests.
 */
public final class Fixtures {

    public static final String OPENAI_TOKEN = "agt_a1_0123456789abcdef";

    private Fixtures() {}

    public static ServiceDefinition.Builder openai() {
        return ServiceDefinition.builder("openai")
                .baseUrl("https://api.openai.com/v1/")
                .allowedHosts(List.of("api.openai.com"))
                .auth(new AuthInjection.Header("Authorization", "Bearer ${SECRET}"))
                .secretEnv("OPENAI_API_KEY");
    }

    public static ServiceDefinition.Builder maps() {
        return ServiceDefinition.builder("maps")
                .baseUrl("https://maps.test")
                .allowedHosts(List.of("maps.test"))
                .auth(new AuthInjection.Query("key", "${SECRET}"))
                .secretEnv("MAPS_KEY");
    }

    public static AgentIdentity agent(String name, String token, String... services) {
        return new AgentIdentity(name, token, Set.of(services), Optional.empty(), Optional.empty());
    }

    public static InMemoryServiceCatalog catalog(ServiceDefinition... services) {
        return catalog(GlobalPolicy.none(), services);
    }

    public static InMemoryServiceCatalog catalog(GlobalPolicy global, ServiceDefinition... services) {
        final var map = new LinkedHashMap<String, ServiceDefinition>();
        for (var service : services) {
            map.put(service.name(), service);
        }
        return new InMemoryServiceCatalog(map, global);
    }

    public static InMemoryAgentDirectory agents(AgentIdentity... agents) {
        final var byToken = new HashMap<String, AgentIdentity>();
        for (var agent : agents) {
            byToken.put(agent.token(), agent);
        }
        return new InMemoryAgentDirectory(Map.copyOf(byToken));
    }
}
