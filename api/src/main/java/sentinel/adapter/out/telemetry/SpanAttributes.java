package sentinel.adapter.out.telemetry;

/**
 * Constants for span attributes used in distributed tracing.
 *
 * <p>Upstream spans never carry headers or the query string, since either may hold an
 * injected credential.
 *
 * @see <a href="https://opentelemetry.io/docs/specs/semconv/">OpenTelemetry Semantic Conventions</a>
 */
public final class SpanAttributes {

    private SpanAttributes() {}

    /** HTTP method (GET, POST, etc.). */
    public static final String HTTP_METHOD = "http.method";

    /** Scheme, host and path of the HTTP request. */
    public static final String HTTP_URL = "http.url";

    /** HTTP response status code. */
    public static final String HTTP_STATUS_CODE = "http.status_code";

    /** Remote host name. */
    public static final String NET_PEER_NAME = "net.peer.name";

    /** Remote port number. */
    public static final String NET_PEER_PORT = "net.peer.port";

    /** Configured upstream deadline in milliseconds. */
    public static final String UPSTREAM_TIMEOUT_MS = "sentinel.upstream.timeout_ms";
}
