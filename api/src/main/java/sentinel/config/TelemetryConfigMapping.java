package sentinel.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry.
 *
 * <p>All telemetry features are disabled by default.
 *
 * <p>Example configuration:
 * <pre>{@code
 * sentinel.telemetry.enabled=true
 * sentinel.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "sentinel.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle. When disabled, all sub-features are off regardless of their own settings.
     */
    @WithDefault("false")
    boolean enabled();

    MetricsConfig metrics();

    interface MetricsConfig {
        /**
         * Enable metrics collection with Micrometer.
         * Requires sentinel.telemetry.enabled=true to take effect.
         */
        @WithDefault("false")
        boolean enabled();
    }
}
