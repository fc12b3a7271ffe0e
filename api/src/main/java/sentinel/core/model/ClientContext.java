package sentinel.core.model;

import java.util.Optional;

/**
 * Facts about the caller that policy checks need: the resolved client address and
 * the browser provenance headers.
 */
public record ClientContext(String address, Optional<String> origin, Optional<String> referer) {

    public ClientContext {
        if (address == null) {
            address = "unknown";
        }
        if (origin == null) {
            origin = Optional.empty();
        }
        if (referer == null) {
            referer = Optional.empty();
        }
    }

    public static ClientContext of(String address) {
        return new ClientContext(address, Optional.empty(), Optional.empty());
    }

    public static ClientContext of(String address, String origin) {
        return new ClientContext(address, Optional.ofNullable(origin), Optional.empty());
    }

    /**
     * The Origin header, falling back to Referer.
     */
    public Optional<String> provenance() {
        return origin.or(() -> referer);
    }
}
