package sentinel.core.model;

import java.util.Optional;

/**
 * The authenticated principal of a request. In single-token mode there is no agent
 * identity and the caller is reported as {@code legacy}.
 */
public record Caller(Optional<AgentIdentity> agent) {

    public static final String LEGACY_NAME = "legacy";

    private static final Caller LEGACY = new Caller(Optional.empty());

    public Caller {
        if (agent == null) {
            agent = Optional.empty();
        }
    }

    public static Caller legacy() {
        return LEGACY;
    }

    public static Caller of(AgentIdentity agent) {
        return new Caller(Optional.of(agent));
    }

    public String name() {
        return agent.map(AgentIdentity::name).orElse(LEGACY_NAME);
    }
}
