package sentinel.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Gateway-wide allowlists, used only for services that do not declare their own.
 */
public record GlobalPolicy(Optional<List<String>> allowedIps, Optional<List<String>> allowedOrigins) {

    public GlobalPolicy {
        allowedIps = allowedIps == null ? Optional.empty() : allowedIps.map(List::copyOf);
        allowedOrigins = allowedOrigins == null ? Optional.empty() : allowedOrigins.map(List::copyOf);
    }

    public static GlobalPolicy none() {
        return new GlobalPolicy(Optional.empty(), Optional.empty());
    }
}
