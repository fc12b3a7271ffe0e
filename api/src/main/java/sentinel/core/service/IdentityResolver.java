package sentinel.core.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.runtime.Startup;
import org.jboss.logging.Logger;

import sentinel.core.config.AuthConfig;
import sentinel.core.model.Caller;
import sentinel.core.model.ConfigurationException;
import sentinel.core.model.IdentityResolution;
import sentinel.core.port.out.AgentDirectory;

/**
 * Maps the presented {@code x-agent-token} to a caller.
 *
 * <p>With agent definitions loaded, the token must belong to an agent. Without them
 * the gateway is in single-token mode: the token must equal the configured shared
 * token and the caller has no agent identity.
 */
@Startup
@ApplicationScoped
public class IdentityResolver {

    private static final Logger LOG = Logger.getLogger(IdentityResolver.class);

    private final AgentDirectory directory;
    private final byte[] legacyToken;

    @Inject
    public IdentityResolver(AgentDirectory directory, AuthConfig authConfig) {
        this.directory = directory;
        if (directory.isPerAgentMode()) {
            this.legacyToken = null;
            LOG.infov("Auth mode: per-agent tokens ({0} agent(s))", directory.size());
        } else {
            final var token = authConfig.legacyToken().filter(t -> !t.isBlank());
            if (token.isEmpty()) {
                throw new ConfigurationException(
                        "AGENT_TOKEN (sentinel.auth.legacy-token) is required when no agents file is configured");
            }
            this.legacyToken = token.get().getBytes(StandardCharsets.UTF_8);
            LOG.info("Auth mode: legacy (single shared token)");
        }
    }

    public IdentityResolution resolve(Optional<String> presentedToken) {
        if (presentedToken.isEmpty() || presentedToken.get().isEmpty()) {
            return new IdentityResolution.Unauthenticated("Unauthorized: missing x-agent-token");
        }
        final var token = presentedToken.get();

        if (directory.isPerAgentMode()) {
            return directory
                    .findByToken(token)
                    .<IdentityResolution>map(agent -> new IdentityResolution.Authenticated(Caller.of(agent)))
                    .orElseGet(() -> new IdentityResolution.Unauthenticated("Unauthorized: invalid agent token"));
        }

        if (!MessageDigest.isEqual(legacyToken, token.getBytes(StandardCharsets.UTF_8))) {
            return new IdentityResolution.Unauthenticated("Unauthorized: invalid or missing x-agent-token");
        }
        return new IdentityResolution.Authenticated(Caller.legacy());
    }
}
