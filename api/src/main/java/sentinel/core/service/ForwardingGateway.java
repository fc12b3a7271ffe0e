package sentinel.core.service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import sentinel.core.model.AccessLogEntry;
import sentinel.core.model.Caller;
import sentinel.core.model.Credential;
import sentinel.core.model.ProxyOutcome;
import sentinel.core.model.ProxyRequest;
import sentinel.core.model.ProxyResponse;
import sentinel.core.model.ServiceDefinition;
import sentinel.core.port.out.ProxyClient;

/**
 * Issues the upstream call for an admitted request and relays the result.
 *
 * <p>Successful calls relay the upstream status, {@code content-type} and raw body.
 * Deadline breaches become 504 with the configured timeout; any other transport
 * failure becomes 502 with a redacted description. Every call writes one line to
 * the {@code sentinel.access} logger.
 */
@ApplicationScoped
public class ForwardingGateway {

    private static final Logger ACCESS_LOG = Logger.getLogger("sentinel.access");
    private static final String REDACTED = "[REDACTED]";

    private final ProxyRequestPreparer requestPreparer;
    private final ProxyClient proxyClient;

    @Inject
    public ForwardingGateway(ProxyRequestPreparer requestPreparer, ProxyClient proxyClient) {
        this.requestPreparer = requestPreparer;
        this.proxyClient = proxyClient;
    }

    /**
     * @param startNanos {@link System#nanoTime()} when the pipeline started, for latency
     */
    public Uni<ProxyOutcome> forward(
            ServiceDefinition service, ProxyRequest request, Credential credential, Caller caller, long startNanos) {
        final var prepared = requestPreparer.prepare(service, request, credential);

        final var targetHost = prepared.targetUri().getHost();
        if (targetHost == null || !service.allowedHosts().contains(targetHost)) {
            final var message = "Resolved host \"%s\" is not in allowed_hosts for service \"%s\""
                    .formatted(targetHost, service.name());
            ACCESS_LOG.info(AccessLogEntry.failure(
                            caller.name(), service.name(), prepared.method(), request.path(), message,
                            elapsedMs(startNanos))
                    .toLogLine());
            return Uni.createFrom().item(ProxyOutcome.badRequest(message));
        }

        return Uni.createFrom()
                .deferred(() -> proxyClient.forward(prepared))
                .map(response -> onResponse(service, prepared.method(), request.path(), caller, response, startNanos))
                .onFailure()
                .recoverWithItem(error ->
                        onFailure(service, prepared.method(), request.path(), caller, credential, error, startNanos));
    }

    private ProxyOutcome onResponse(
            ServiceDefinition service,
            String method,
            String path,
            Caller caller,
            ProxyResponse response,
            long startNanos) {
        ACCESS_LOG.info(AccessLogEntry.success(
                        caller.name(), service.name(), method, path, response.statusCode(), elapsedMs(startNanos))
                .toLogLine());
        return ProxyOutcome.Forwarded.from(response);
    }

    private ProxyOutcome onFailure(
            ServiceDefinition service,
            String method,
            String path,
            Caller caller,
            Credential credential,
            Throwable error,
            long startNanos) {
        final var description = redact(describe(error), credential);
        ACCESS_LOG.info(AccessLogEntry.failure(
                        caller.name(), service.name(), method, path, description, elapsedMs(startNanos))
                .toLogLine());

        if (isTimeout(error)) {
            return new ProxyOutcome.UpstreamTimeout(service.timeoutMs());
        }
        return new ProxyOutcome.UpstreamUnavailable(description);
    }

    static boolean isTimeout(Throwable error) {
        var current = error;
        while (current != null) {
            if (current instanceof TimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    static String describe(Throwable error) {
        final var message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Removes every form of the credential that could appear in a transport error,
     * such as a URL echoed back by the HTTP client.
     */
    static String redact(String text, Credential credential) {
        var result = text;
        for (var value : new String[] {credential.rendered(), credential.secret()}) {
            if (value == null || value.isEmpty()) {
                continue;
            }
            result = result.replace(value, REDACTED);
            result = result.replace(URLEncoder.encode(value, StandardCharsets.UTF_8), REDACTED);
        }
        return result;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
