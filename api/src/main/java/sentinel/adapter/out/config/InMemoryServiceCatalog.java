package sentinel.adapter.out.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import sentinel.core.model.GlobalPolicy;
import sentinel.core.model.ServiceDefinition;
import sentinel.core.port.out.ServiceCatalog;

/**
 * Immutable service table loaded at startup.
 */
public final class InMemoryServiceCatalog implements ServiceCatalog {

    private final Map<String, ServiceDefinition> services;
    private final List<String> names;
    private final GlobalPolicy globalPolicy;

    public InMemoryServiceCatalog(Map<String, ServiceDefinition> services, GlobalPolicy globalPolicy) {
        final var ordered = new LinkedHashMap<>(services);
        this.services = Map.copyOf(ordered);
        this.names = List.copyOf(ordered.keySet());
        this.globalPolicy = globalPolicy != null ? globalPolicy : GlobalPolicy.none();
    }

    @Override
    public Optional<ServiceDefinition> find(String serviceName) {
        if (serviceName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(services.get(serviceName));
    }

    @Override
    public List<String> serviceNames() {
        return names;
    }

    @Override
    public GlobalPolicy globalPolicy() {
        return globalPolicy;
    }
}
