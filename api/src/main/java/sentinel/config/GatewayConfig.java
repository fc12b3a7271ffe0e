package sentinel.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Gateway-wide request handling settings.
 *
 * <p>Configuration prefix: {@code sentinel.gateway}
 */
@ConfigMapping(prefix = "sentinel.gateway")
public interface GatewayConfig {

    /**
     * Derive the client address from {@code X-Forwarded-For}, {@code Forwarded} and
     * {@code X-Real-IP} before falling back to the socket address. Only enable behind
     * a proxy that overwrites these headers.
     */
    @WithDefault("true")
    boolean trustForwardedHeaders();

    /**
     * Upstream deadline for services that declare no {@code timeout_ms}.
     */
    @WithDefault("PT30S")
    Duration defaultTimeout();
}
