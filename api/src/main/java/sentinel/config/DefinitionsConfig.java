package sentinel.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Locations of the service and agent definition files.
 *
 * <p>Configuration prefix: {@code sentinel.definitions}
 */
@ConfigMapping(prefix = "sentinel.definitions")
public interface DefinitionsConfig {

    @WithDefault("services.yaml")
    String servicesPath();

    /**
     * When this file does not exist the gateway runs in single-token mode.
     */
    @WithDefault("agents.yaml")
    String agentsPath();
}
