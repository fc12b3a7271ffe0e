package sentinel.adapter.out.secret;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import sentinel.core.port.out.SecretSource;

/**
 * Reads upstream secrets from process environment variables.
 *
 * <p>Variables are read on every lookup, never cached, and an empty value counts as
 * unset.
 */
@ApplicationScoped
public class EnvironmentSecretSource implements SecretSource {

    @Override
    public Optional<String> lookup(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(System.getenv(name)).filter(value -> !value.isEmpty());
    }
}
