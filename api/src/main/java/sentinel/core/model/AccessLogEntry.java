package sentinel.core.model;

/**
 * Metadata recorded for one forwarded call. Holds no headers, bodies or credentials.
 *
 * @param agent     caller name ({@code legacy} in single-token mode)
 * @param service   target service
 * @param method    upper-case HTTP method
 * @param path      caller-supplied path
 * @param status    upstream status, or -1 when the call failed
 * @param error     failure description when the call failed, else null
 * @param latencyMs time spent in the pipeline
 */
public record AccessLogEntry(
        String agent, String service, String method, String path, int status, String error, long latencyMs) {

    public static AccessLogEntry success(
            String agent, String service, String method, String path, int status, long latencyMs) {
        return new AccessLogEntry(agent, service, method, path, status, null, latencyMs);
    }

    public static AccessLogEntry failure(
            String agent, String service, String method, String path, String error, long latencyMs) {
        return new AccessLogEntry(agent, service, method, path, -1, error, latencyMs);
    }

    public boolean failed() {
        return error != null;
    }

    /**
     * Renders the entry as a single {@code key=value} log line.
     */
    public String toLogLine() {
        var outcome = failed() ? "error=\"" + error.replace("\"", "'") + "\"" : "status=" + status;
        return "PROXY agent=%s service=%s method=%s path=%s %s latency_ms=%d"
                .formatted(agent, service, method, path, outcome, latencyMs);
    }
}
