package sentinel.core.port.out;

import java.util.List;
import java.util.Optional;

import sentinel.core.model.GlobalPolicy;
import sentinel.core.model.ServiceDefinition;

/**
 * Read-only view of the loaded service definitions.
 */
public interface ServiceCatalog {

    Optional<ServiceDefinition> find(String serviceName);

    /**
     * Service names in definition order.
     */
    List<String> serviceNames();

    GlobalPolicy globalPolicy();
}
