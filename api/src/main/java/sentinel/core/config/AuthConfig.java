package sentinel.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;

/**
 * Configuration for agent authentication.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code sentinel.auth.legacy-token} - shared token accepted in single-token mode,
 *       i.e. when no agents file exists (defaults to the {@code AGENT_TOKEN} environment variable)</li>
 * </ul>
 */
@ConfigMapping(prefix = "sentinel.auth")
public interface AuthConfig {

    /**
     * Shared token for single-token mode.
     *
     * @return the token, or empty if not configured
     */
    Optional<String> legacyToken();
}
