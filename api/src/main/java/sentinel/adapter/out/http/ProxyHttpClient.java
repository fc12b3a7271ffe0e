package sentinel.adapter.out.http;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import io.smallrye.mutiny.Uni;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.mutiny.core.Vertx;

import sentinel.adapter.out.telemetry.SpanAttributes;
import sentinel.core.model.PreparedProxyRequest;
import sentinel.core.model.ProxyResponse;
import sentinel.core.port.out.ProxyClient;

/**
 * HTTP adapter for forwarding prepared proxy requests using the Vert.x HTTP client.
 *
 * <p>Redirects are never followed, so an injected credential only ever reaches the
 * resolved target.
 *
 * <p>The prepared timeout is a hard deadline over the whole exchange (connect, headers
 * and body). When it fires the in-flight request is reset, which closes the upstream
 * connection, and the {@code Uni} fails with a {@link TimeoutException}. Cancelling the
 * {@code Uni} resets the request the same way.
 *
 * <p>W3C Trace Context headers are propagated to upstream services.
 */
@ApplicationScoped
public class ProxyHttpClient implements ProxyClient {

    private static final TextMapSetter<HttpClientRequest> HEADER_SETTER =
            (carrier, key, value) -> carrier.putHeader(key, value);

    private final Vertx vertx;
    private final Tracer tracer;
    private final TextMapPropagator propagator;
    private HttpClient httpClient;

    @Inject
    public ProxyHttpClient(Vertx vertx, Tracer tracer, TextMapPropagator propagator) {
        this.vertx = vertx;
        this.tracer = tracer;
        this.propagator = propagator;
    }

    @PostConstruct
    void init() {
        this.httpClient = vertx.getDelegate().createHttpClient(new HttpClientOptions());
    }

    @PreDestroy
    void close() {
        if (httpClient != null) {
            httpClient.close();
        }
    }

    @Override
    public Uni<ProxyResponse> forward(PreparedProxyRequest preparedRequest) {
        final var targetUri = preparedRequest.targetUri();
        final var timeoutMs = preparedRequest.timeout().toMillis();

        final var span = tracer.spanBuilder("HTTP " + preparedRequest.method())
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(SpanAttributes.HTTP_METHOD, preparedRequest.method())
                .setAttribute(SpanAttributes.HTTP_URL, withoutQuery(targetUri))
                .setAttribute(SpanAttributes.NET_PEER_NAME, targetUri.getHost())
                .setAttribute(SpanAttributes.NET_PEER_PORT, (long) getPort(targetUri))
                .setAttribute(SpanAttributes.UPSTREAM_TIMEOUT_MS, timeoutMs)
                .startSpan();

        return Uni.createFrom()
                .<ProxyResponse>emitter(emitter -> {
                    final var core = vertx.getDelegate();
                    final var settled = new AtomicBoolean();
                    final var inFlight = new AtomicReference<HttpClientRequest>();

                    final var timerId = core.setTimer(timeoutMs, id -> {
                        if (settled.compareAndSet(false, true)) {
                            resetIfPresent(inFlight.get());
                            emitter.fail(new TimeoutException(
                                    "Upstream did not complete within " + timeoutMs + "ms"));
                        }
                    });

                    // cancellation from downstream releases the connection as well
                    emitter.onTermination(() -> {
                        core.cancelTimer(timerId);
                        if (settled.compareAndSet(false, true)) {
                            resetIfPresent(inFlight.get());
                        }
                    });

                    httpClient
                            .request(toRequestOptions(preparedRequest))
                            .compose(request -> {
                                inFlight.set(request);
                                if (settled.get()) {
                                    request.reset();
                                    return Future.failedFuture(new TimeoutException(
                                            "Upstream did not complete within " + timeoutMs + "ms"));
                                }
                                propagator.inject(Context.current().with(span), request, HEADER_SETTER);
                                return send(request, preparedRequest.body());
                            })
                            .compose(response -> response.body().map(body -> toProxyResponse(response, body)))
                            .onComplete(result -> {
                                core.cancelTimer(timerId);
                                if (!settled.compareAndSet(false, true)) {
                                    return;
                                }
                                if (result.succeeded()) {
                                    emitter.complete(result.result());
                                } else {
                                    emitter.fail(result.cause());
                                }
                            });
                })
                .invoke(response -> {
                    span.setAttribute(SpanAttributes.HTTP_STATUS_CODE, (long) response.statusCode());
                    if (response.statusCode() >= 500) {
                        span.setStatus(StatusCode.ERROR, "HTTP " + response.statusCode());
                    }
                    span.end();
                })
                .onFailure()
                .invoke(error -> {
                    // exception messages can echo the target URL, so only the type is recorded
                    span.setStatus(StatusCode.ERROR, error.getClass().getSimpleName());
                    span.end();
                });
    }

    private static RequestOptions toRequestOptions(PreparedProxyRequest preparedRequest) {
        final var options = new RequestOptions()
                .setMethod(HttpMethod.valueOf(preparedRequest.method()))
                .setAbsoluteURI(preparedRequest.targetUri().toString())
                .setFollowRedirects(false);
        for (var entry : preparedRequest.headers().entrySet()) {
            for (var value : entry.getValue()) {
                options.addHeader(entry.getKey(), value);
            }
        }
        return options;
    }

    private static Future<HttpClientResponse> send(HttpClientRequest request, byte[] body) {
        if (body != null && body.length > 0) {
            return request.send(Buffer.buffer(body));
        }
        return request.send();
    }

    private static void resetIfPresent(HttpClientRequest request) {
        if (request != null) {
            request.reset();
        }
    }

    private static int getPort(URI uri) {
        var port = uri.getPort();
        if (port == -1) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return port;
    }

    private static String withoutQuery(URI uri) {
        final var path = uri.getRawPath() == null ? "" : uri.getRawPath();
        return uri.getScheme() + "://" + uri.getRawAuthority() + path;
    }

    private static ProxyResponse toProxyResponse(HttpClientResponse response, Buffer body) {
        final Map<String, List<String>> headers = new HashMap<>();

        for (var name : response.headers().names()) {
            headers.computeIfAbsent(name, k -> new ArrayList<>())
                    .addAll(response.headers().getAll(name));
        }

        final var responseBody = body != null ? body.getBytes() : new byte[0];
        return new ProxyResponse(response.statusCode(), headers, responseBody);
    }
}
