package sentinel.adapter.in.http;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;

import sentinel.config.GatewayConfig;
import sentinel.core.model.ClientContext;

/**
 * Extract the client address and provenance headers from HTTP requests.
 *
 * <p>When forwarding headers are trusted, the client address is taken from, in order:
 * <ol>
 *   <li>X-Forwarded-For (first IP in chain)</li>
 *   <li>RFC 7239 Forwarded header ({@code for=})</li>
 *   <li>X-Real-IP</li>
 *   <li>Socket remote address (fallback)</li>
 * </ol>
 * Bracketed IPv6 literals and {@code :port} suffixes are reduced to the bare address.
 */
@ApplicationScoped
public class ClientContextExtractor {

    private final boolean trustForwardedHeaders;

    @Inject
    public ClientContextExtractor(GatewayConfig gatewayConfig) {
        this(gatewayConfig.trustForwardedHeaders());
    }

    ClientContextExtractor(boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    /**
     * @param request  the JAX-RS request context
     * @param socketIp the direct connection's remote IP address, may be null
     */
    public ClientContext extract(ContainerRequestContext request, String socketIp) {
        var address = trustForwardedHeaders ? extractIpFromHeaders(request) : null;
        if (address == null || address.isEmpty()) {
            address = socketIp;
        }

        return new ClientContext(
                normalizeAddress(address),
                nonEmpty(request.getHeaderString("Origin")),
                nonEmpty(request.getHeaderString("Referer")));
    }

    private String extractIpFromHeaders(ContainerRequestContext request) {
        var xForwardedFor = request.getHeaderString("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }

        var forwarded = request.getHeaderString("Forwarded");
        if (forwarded != null && !forwarded.isEmpty()) {
            var forParam = extractForwardedParam(forwarded, "for");
            if (forParam != null) {
                return forParam;
            }
        }

        var xRealIp = request.getHeaderString("X-Real-IP");
        if (xRealIp != null && !xRealIp.isEmpty()) {
            return xRealIp.trim();
        }

        return null;
    }

    private String extractForwardedParam(String forwarded, String param) {
        // First entry is the original client
        var firstEntry = forwarded.split(",")[0].trim();

        for (var part : firstEntry.split(";")) {
            var keyValue = part.trim().split("=", 2);
            if (keyValue.length == 2 && keyValue[0].trim().equalsIgnoreCase(param)) {
                var value = keyValue[1].trim();
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                return value;
            }
        }

        return null;
    }

    /**
     * Reduces {@code [v6]:port}, {@code [v6]} and {@code v4:port} to the bare address.
     * Unbracketed IPv6 literals are returned unchanged.
     */
    static String normalizeAddress(String address) {
        if (address == null) {
            return null;
        }
        var value = address.trim();
        if (value.startsWith("[")) {
            var close = value.indexOf(']');
            return close > 0 ? value.substring(1, close) : value.substring(1);
        }
        var firstColon = value.indexOf(':');
        if (firstColon > 0 && firstColon == value.lastIndexOf(':')) {
            return value.substring(0, firstColon);
        }
        return value;
    }

    private static Optional<String> nonEmpty(String value) {
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
