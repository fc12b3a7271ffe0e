package sentinel.core.model;

public sealed interface PolicyDecision {

    record Permitted(ServiceDefinition service) implements PolicyDecision {}

    record Rejected(ProxyOutcome.Failure failure) implements PolicyDecision {}

    static PolicyDecision permitted(ServiceDefinition service) {
        return new Permitted(service);
    }

    static PolicyDecision rejected(ProxyOutcome.Failure failure) {
        return new Rejected(failure);
    }
}
