package sentinel.adapter.out.config;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;

import sentinel.core.model.AgentIdentity;

/**
 * Shape of {@code agents.yaml}.
 *
 * <pre>
 * agents:
 *   research-bot:
 *     token: agt_...
 *     allowed_services: [openai]
 *     rate_limit_per_minute: 30
 * </pre>
 */
public record AgentsFile(@JsonProperty("agents") Map<String, AgentEntry> agents) {

    public record AgentEntry(
            @JsonProperty("token") String token,
            @JsonProperty("allowed_services") List<String> allowedServices,
            @JsonProperty("rate_limit_per_minute") Integer rateLimitPerMinute,
            @JsonProperty("allowed_ips") List<String> allowedIps) {

        public AgentIdentity toModel(String name) {
            return new AgentIdentity(
                    name,
                    token,
                    allowedServices != null ? Set.copyOf(allowedServices) : Set.of(),
                    Optional.ofNullable(rateLimitPerMinute),
                    Optional.ofNullable(allowedIps));
        }
    }
}
