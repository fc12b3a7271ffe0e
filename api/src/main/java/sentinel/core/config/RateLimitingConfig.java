package sentinel.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code sentinel.rate-limiting}
 *
 * <p>Limits themselves are declared per service and per agent in the definition
 * files; this only switches the limiter on or off.
 */
@ConfigMapping(prefix = "sentinel.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();
}
