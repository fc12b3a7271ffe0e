package sentinel.core.port.out;

import java.util.Optional;

import sentinel.core.model.AgentIdentity;

/**
 * Read-only view of the loaded agent definitions.
 *
 * <p>When no agent definitions exist the gateway runs in single-token mode and
 * {@link #isPerAgentMode()} is false.
 */
public interface AgentDirectory {

    boolean isPerAgentMode();

    Optional<AgentIdentity> findByToken(String token);

    int size();
}
