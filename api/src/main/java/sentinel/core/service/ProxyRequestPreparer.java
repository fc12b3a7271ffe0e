package sentinel.core.service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import sentinel.core.model.Credential;
import sentinel.core.model.PreparedProxyRequest;
import sentinel.core.model.ProxyRequest;
import sentinel.core.model.ServiceDefinition;

/**
 * Turns an admitted proxy request into the upstream request:
 * - caller headers with credential-bearing and hop-by-hop headers removed
 * - the service credential injected
 * - the caller path resolved against the service base address
 * - a body only for methods other than GET and HEAD
 */
@ApplicationScoped
public class ProxyRequestPreparer {

    /**
     * Headers a caller may never set, whatever the service configuration.
     */
    static final Set<String> STRIPPED_HEADERS =
            Set.of("authorization", "cookie", "set-cookie", "proxy-authorization", "x-api-key", "host");

    /**
     * HTTP hop-by-hop headers that must not be forwarded to the upstream server.
     * These are connection-specific headers per RFC 2616 Section 13.5.1.
     */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "te", "trailer", "transfer-encoding", "upgrade");

    private static final Set<String> BODYLESS_METHODS = Set.of("GET", "HEAD");

    private final SecretInjector secretInjector;

    @Inject
    public ProxyRequestPreparer(SecretInjector secretInjector) {
        this.secretInjector = secretInjector;
    }

    public PreparedProxyRequest prepare(ServiceDefinition service, ProxyRequest request, Credential credential) {
        final var method = request.method().toUpperCase(Locale.ROOT);
        final var headers = sanitizeHeaders(request.headers());

        var targetUri = service.baseUrl().resolve(request.path());
        targetUri = secretInjector.inject(credential, service.auth(), targetUri, headers);

        byte[] body = null;
        if (!BODYLESS_METHODS.contains(method) && request.body().isPresent()) {
            final var payload = request.body().get();
            body = payload.text().getBytes(StandardCharsets.UTF_8);
            if (payload.json() && !hasHeader(headers, "content-type")) {
                headers.put("Content-Type", List.of("application/json"));
            }
        }

        return new PreparedProxyRequest(method, targetUri, headers, body, Duration.ofMillis(service.timeoutMs()));
    }

    /**
     * Copies caller headers, dropping every header in {@link #STRIPPED_HEADERS} and
     * the hop-by-hop set, compared case-insensitively.
     *
     * @return a new mutable header map
     */
    public Map<String, List<String>> sanitizeHeaders(Map<String, String> callerHeaders) {
        final Map<String, List<String>> headers = new HashMap<>();
        for (var entry : callerHeaders.entrySet()) {
            final var name = entry.getKey();
            if (name == null || entry.getValue() == null || shouldSkipHeader(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            headers.put(name, List.of(entry.getValue()));
        }
        return headers;
    }

    private boolean shouldSkipHeader(String lowerName) {
        if (STRIPPED_HEADERS.contains(lowerName)) {
            return true;
        }
        if (HOP_BY_HOP_HEADERS.contains(lowerName)) {
            return true;
        }
        // Content-Length is set by the HTTP client
        return "content-length".equals(lowerName);
    }

    private static boolean hasHeader(Map<String, List<String>> headers, String name) {
        for (var key : headers.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }
}
