package sentinel.core.model;

public sealed interface IdentityResolution {

    record Authenticated(Caller caller) implements IdentityResolution {}

    record Unauthenticated(String reason) implements IdentityResolution {}
}
