package sentinel.adapter.out.config;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;

import sentinel.core.model.AuthInjection;
import sentinel.core.model.GlobalPolicy;
import sentinel.core.model.ServiceDefinition;

/**
 * Shape of {@code services.yaml}.
 *
 * <pre>
 * allowed_ips: ["10.0.0.0/8"]
 * services:
 *   openai:
 *     base_url: https://api.openai.com
 *     allowed_hosts: [api.openai.com]
 *     auth: { type: header, header_name: Authorization, template: "Bearer ${SECRET}" }
 *     secret_env: OPENAI_API_KEY
 * </pre>
 */
public record ServicesFile(
        @JsonProperty("services") Map<String, ServiceEntry> services,
        @JsonProperty("allowed_ips") List<String> allowedIps,
        @JsonProperty("allowed_origins") List<String> allowedOrigins) {

    public GlobalPolicy toGlobalPolicy() {
        return new GlobalPolicy(Optional.ofNullable(allowedIps), Optional.ofNullable(allowedOrigins));
    }

    public record ServiceEntry(
            @JsonProperty("base_url") String baseUrl,
            @JsonProperty("allowed_hosts") List<String> allowedHosts,
            @JsonProperty("auth") AuthEntry auth,
            @JsonProperty("secret_env") String secretEnv,
            @JsonProperty("allowed_methods") List<String> allowedMethods,
            @JsonProperty("allowed_path_prefixes") List<String> allowedPathPrefixes,
            @JsonProperty("timeout_ms") Long timeoutMs,
            @JsonProperty("rate_limit_per_minute") Integer rateLimitPerMinute,
            @JsonProperty("allowed_ips") List<String> allowedIps,
            @JsonProperty("allowed_origins") List<String> allowedOrigins) {

        /**
         * @throws IllegalArgumentException when a field is missing or invalid
         */
        public ServiceDefinition toModel(String name, long defaultTimeoutMs) {
            requireField(baseUrl, "base_url");
            requireField(allowedHosts, "allowed_hosts");
            requireField(auth, "auth");
            requireField(secretEnv, "secret_env");

            return ServiceDefinition.builder(name)
                    .baseUrl(baseUrl)
                    .allowedHosts(allowedHosts)
                    .auth(auth.toModel())
                    .secretEnv(secretEnv)
                    .allowedMethods(allowedMethods != null ? new LinkedHashSet<>(allowedMethods) : null)
                    .allowedPathPrefixes(allowedPathPrefixes)
                    .rateLimitPerMinute(rateLimitPerMinute)
                    .allowedIps(allowedIps)
                    .allowedOrigins(allowedOrigins)
                    .timeoutMs(timeoutMs != null ? timeoutMs : defaultTimeoutMs)
                    .build();
        }

        private static void requireField(Object value, String field) {
            if (value == null) {
                throw new IllegalArgumentException("missing required field \"%s\"".formatted(field));
            }
        }
    }

    public record AuthEntry(
            @JsonProperty("type") String type,
            @JsonProperty("header_name") String headerName,
            @JsonProperty("query_param") String queryParam,
            @JsonProperty("template") String template) {

        public AuthInjection toModel() {
            if ("header".equals(type)) {
                return new AuthInjection.Header(headerName, template);
            }
            if ("query".equals(type)) {
                return new AuthInjection.Query(queryParam, template);
            }
            throw new IllegalArgumentException("auth.type must be \"header\" or \"query\"");
        }
    }
}
