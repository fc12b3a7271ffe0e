package sentinel.core.model;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A named upstream API the gateway can forward to.
 *
 * <p>Instances are validated on construction: the base URL must be {@code https},
 * its host must appear in {@code allowedHosts} and the auth template must contain
 * the secret placeholder. Optional policy fields override the matching
 * {@link GlobalPolicy} entries when present.
 *
 * @param name                service name, unique key
 * @param baseUrl             upstream base address
 * @param allowedHosts        hosts the resolved target may point to
 * @param auth                credential injection rule
 * @param secretEnv           name of the environment variable holding the secret
 * @param allowedMethods      upper-case method allowlist
 * @param allowedPathPrefixes path prefix allowlist
 * @param rateLimitPerMinute  per-service fixed-window limit
 * @param allowedIps          per-service IP allowlist
 * @param allowedOrigins      per-service Origin allowlist
 * @param timeoutMs           upstream deadline in milliseconds
 */
public record ServiceDefinition(
        String name,
        URI baseUrl,
        List<String> allowedHosts,
        AuthInjection auth,
        String secretEnv,
        Optional<Set<String>> allowedMethods,
        Optional<List<String>> allowedPathPrefixes,
        Optional<Integer> rateLimitPerMinute,
        Optional<List<String>> allowedIps,
        Optional<List<String>> allowedOrigins,
        long timeoutMs) {

    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    public ServiceDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (baseUrl == null) {
            throw new IllegalArgumentException("missing required field \"base_url\"");
        }
        if (!"https".equalsIgnoreCase(baseUrl.getScheme())) {
            throw new IllegalArgumentException("base_url must use https (got \"%s\")".formatted(baseUrl));
        }
        if (baseUrl.getHost() == null) {
            throw new IllegalArgumentException("base_url has no host (got \"%s\")".formatted(baseUrl));
        }
        if (allowedHosts == null || allowedHosts.isEmpty()) {
            throw new IllegalArgumentException("allowed_hosts must be a non-empty array");
        }
        allowedHosts = List.copyOf(allowedHosts);
        if (!allowedHosts.contains(baseUrl.getHost())) {
            throw new IllegalArgumentException(
                    "base_url host \"%s\" must be in allowed_hosts".formatted(baseUrl.getHost()));
        }
        if (auth == null) {
            throw new IllegalArgumentException("missing required field \"auth\"");
        }
        if (secretEnv == null || secretEnv.isBlank()) {
            throw new IllegalArgumentException("missing required field \"secret_env\"");
        }

        allowedMethods = normalizeMethods(allowedMethods);
        allowedPathPrefixes = copyOf(allowedPathPrefixes);
        allowedPathPrefixes.ifPresent(prefixes -> {
            for (var prefix : prefixes) {
                if (prefix == null || !prefix.startsWith("/")) {
                    throw new IllegalArgumentException("allowed_path_prefixes entries must start with \"/\"");
                }
            }
        });
        rateLimitPerMinute = rateLimitPerMinute == null ? Optional.empty() : rateLimitPerMinute;
        rateLimitPerMinute.ifPresent(limit -> {
            if (limit <= 0) {
                throw new IllegalArgumentException("rate_limit_per_minute must be a positive number");
            }
        });
        allowedIps = copyOf(allowedIps);
        allowedOrigins = copyOf(allowedOrigins);
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeout_ms must be a positive number");
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static Optional<Set<String>> normalizeMethods(Optional<Set<String>> methods) {
        if (methods == null || methods.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(methods.get().stream()
                .map(m -> m.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet()));
    }

    private static Optional<List<String>> copyOf(Optional<List<String>> list) {
        if (list == null || list.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(List.copyOf(list.get()));
    }

    public static final class Builder {
        private final String name;
        private URI baseUrl;
        private List<String> allowedHosts;
        private AuthInjection auth;
        private String secretEnv;
        private Set<String> allowedMethods;
        private List<String> allowedPathPrefixes;
        private Integer rateLimitPerMinute;
        private List<String> allowedIps;
        private List<String> allowedOrigins;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;

        private Builder(String name) {
            this.name = name;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl != null ? URI.create(baseUrl) : null;
            return this;
        }

        public Builder allowedHosts(List<String> allowedHosts) {
            this.allowedHosts = allowedHosts;
            return this;
        }

        public Builder auth(AuthInjection auth) {
            this.auth = auth;
            return this;
        }

        public Builder secretEnv(String secretEnv) {
            this.secretEnv = secretEnv;
            return this;
        }

        public Builder allowedMethods(Set<String> allowedMethods) {
            this.allowedMethods = allowedMethods;
            return this;
        }

        public Builder allowedPathPrefixes(List<String> allowedPathPrefixes) {
            this.allowedPathPrefixes = allowedPathPrefixes;
            return this;
        }

        public Builder rateLimitPerMinute(Integer rateLimitPerMinute) {
            this.rateLimitPerMinute = rateLimitPerMinute;
            return this;
        }

        public Builder allowedIps(List<String> allowedIps) {
            this.allowedIps = allowedIps;
            return this;
        }

        public Builder allowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
            return this;
        }

        public Builder timeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs != null ? timeoutMs : DEFAULT_TIMEOUT_MS;
            return this;
        }

        public ServiceDefinition build() {
            return new ServiceDefinition(
                    name,
                    baseUrl,
                    allowedHosts,
                    auth,
                    secretEnv,
                    Optional.ofNullable(allowedMethods),
                    Optional.ofNullable(allowedPathPrefixes),
                    Optional.ofNullable(rateLimitPerMinute),
                    Optional.ofNullable(allowedIps),
                    Optional.ofNullable(allowedOrigins),
                    timeoutMs);
        }
    }
}
