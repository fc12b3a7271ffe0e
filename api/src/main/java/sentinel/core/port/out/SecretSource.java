package sentinel.core.port.out;

import java.util.Optional;

/**
 * Resolves upstream secrets by name.
 */
public interface SecretSource {

    /**
     * @param name the variable name from the service definition
     * @return the secret, or empty when unset or blank
     */
    Optional<String> lookup(String name);
}
