package sentinel.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Allowlists that apply to one service after override resolution.
 *
 * <p>A list declared on the service replaces the global list entirely; lists are
 * never merged. An absent or empty effective list means unrestricted.
 */
public record EffectivePolicy(Optional<List<String>> allowedIps, Optional<List<String>> allowedOrigins) {

    public static EffectivePolicy resolve(ServiceDefinition service, GlobalPolicy global) {
        return new EffectivePolicy(
                service.allowedIps().or(global::allowedIps),
                service.allowedOrigins().or(global::allowedOrigins));
    }

    public boolean restrictsIps() {
        return allowedIps.map(list -> !list.isEmpty()).orElse(false);
    }

    public boolean restrictsOrigins() {
        return allowedOrigins.map(list -> !list.isEmpty()).orElse(false);
    }
}
