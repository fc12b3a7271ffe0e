package sentinel.adapter.out.config;

import java.util.Map;
import java.util.Optional;

import sentinel.core.model.AgentIdentity;
import sentinel.core.port.out.AgentDirectory;

/**
 * Immutable token table loaded at startup. The instance returned by {@link #singleToken()}
 * holds no agents and selects single-token mode.
 */
public final class InMemoryAgentDirectory implements AgentDirectory {

    private static final InMemoryAgentDirectory SINGLE_TOKEN = new InMemoryAgentDirectory(null);

    private final Map<String, AgentIdentity> byToken;

    /**
     * @param byToken agents keyed by token, or null for single-token mode
     */
    public InMemoryAgentDirectory(Map<String, AgentIdentity> byToken) {
        this.byToken = byToken != null ? Map.copyOf(byToken) : null;
    }

    public static InMemoryAgentDirectory singleToken() {
        return SINGLE_TOKEN;
    }

    @Override
    public boolean isPerAgentMode() {
        return byToken != null;
    }

    @Override
    public Optional<AgentIdentity> findByToken(String token) {
        if (byToken == null || token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byToken.get(token));
    }

    @Override
    public int size() {
        return byToken != null ? byToken.size() : 0;
    }
}
