package sentinel.core.model;

import java.util.Objects;

/**
 * Identifies a rate-limit bucket.
 *
 * <p>Service buckets are keyed by the bare service name and agent buckets by
 * {@code agent:{name}}.
 *
 * @param scope what the bucket bounds
 * @param name  the service or agent name
 */
public record RateLimitKey(Scope scope, String name) {

    public enum Scope {
        SERVICE,
        AGENT
    }

    public RateLimitKey {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public static RateLimitKey service(String serviceName) {
        return new RateLimitKey(Scope.SERVICE, serviceName);
    }

    public static RateLimitKey agent(String agentName) {
        return new RateLimitKey(Scope.AGENT, agentName);
    }

    public String toCacheKey() {
        return switch (scope) {
            case SERVICE -> name;
            case AGENT -> "agent:" + name;
        };
    }
}
