package sentinel.core.model;

import java.util.Map;
import java.util.Optional;

/**
 * What an agent asks the gateway to send upstream.
 *
 * @param method  HTTP method as supplied (may be null or any case)
 * @param path    path relative to the service base address
 * @param headers caller headers, sanitized before forwarding
 * @param body    request payload, ignored for GET and HEAD
 */
public record ProxyRequest(String method, String path, Map<String, String> headers, Optional<Payload> body) {

    public ProxyRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (body == null) {
            body = Optional.empty();
        }
    }

    public static ProxyRequest of(String method, String path) {
        return new ProxyRequest(method, path, Map.of(), Optional.empty());
    }

    /**
     * Serialized request body.
     *
     * @param text the body text
     * @param json true when the caller sent a JSON value that was serialized, false for a plain string
     */
    public record Payload(String text, boolean json) {

        public static Payload text(String text) {
            return new Payload(text, false);
        }

        public static Payload json(String text) {
            return new Payload(text, true);
        }
    }
}
