package sentinel.core.model;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A fully prepared upstream request: caller headers sanitized, credential injected,
 * target resolved against the service base address, deadline attached.
 */
public record PreparedProxyRequest(
        String method, URI targetUri, Map<String, List<String>> headers, byte[] body, Duration timeout) {

    public PreparedProxyRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (targetUri == null) {
            throw new IllegalArgumentException("targetUri is required");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }

    @Override
    public String toString() {
        // The target may carry a query-injected credential
        return "PreparedProxyRequest[method=" + method + ", host=" + targetUri.getHost() + ", path="
                + targetUri.getRawPath() + "]";
    }
}
