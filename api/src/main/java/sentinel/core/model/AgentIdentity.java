package sentinel.core.model;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A scoped caller credential. Agents never see the upstream secrets; they present
 * {@link #token()} and are limited to {@link #allowedServices()}.
 */
public record AgentIdentity(
        String name,
        String token,
        Set<String> allowedServices,
        Optional<Integer> rateLimitPerMinute,
        Optional<List<String>> allowedIps) {

    public static final String TOKEN_PREFIX = "agt_";

    public AgentIdentity {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("missing or invalid token");
        }
        if (!token.startsWith(TOKEN_PREFIX)) {
            throw new IllegalArgumentException("token must start with \"%s\"".formatted(TOKEN_PREFIX));
        }
        if (allowedServices == null || allowedServices.isEmpty()) {
            throw new IllegalArgumentException("allowed_services must be a non-empty array");
        }
        allowedServices = Set.copyOf(allowedServices);
        rateLimitPerMinute = rateLimitPerMinute == null ? Optional.empty() : rateLimitPerMinute;
        rateLimitPerMinute.ifPresent(limit -> {
            if (limit <= 0) {
                throw new IllegalArgumentException("rate_limit_per_minute must be a positive number");
            }
        });
        allowedIps = allowedIps == null ? Optional.empty() : allowedIps.map(List::copyOf);
    }

    public boolean isAllowed(String serviceName) {
        return allowedServices.contains(serviceName);
    }

    @Override
    public String toString() {
        return "AgentIdentity[name=" + name + ", allowedServices=" + allowedServices + "]";
    }
}
