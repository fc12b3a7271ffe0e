package sentinel.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of admitting one proxy request: either the relayed upstream response or a
 * terminal failure with the status the caller receives.
 */
public sealed interface ProxyOutcome {

    int statusCode();

    /**
     * Upstream response relayed to the caller.
     */
    record Forwarded(int statusCode, Optional<String> contentType, byte[] body) implements ProxyOutcome {
        public Forwarded {
            if (contentType == null) {
                contentType = Optional.empty();
            }
            if (body == null) {
                body = new byte[0];
            }
        }

        public static Forwarded from(ProxyResponse response) {
            return new Forwarded(response.statusCode(), response.header("content-type"), response.body());
        }
    }

    /**
     * Any outcome that is reported to the caller as a {@code {error}} body.
     */
    sealed interface Failure extends ProxyOutcome {
        String message();
    }

    record ServiceNotFound(String serviceName, List<String> available) implements Failure {
        public ServiceNotFound {
            available = available == null ? List.of() : List.copyOf(available);
        }

        @Override
        public int statusCode() {
            return 404;
        }

        @Override
        public String message() {
            return "Unknown service: \"%s\"".formatted(serviceName);
        }
    }

    /**
     * Rejected by authentication, policy, validation or server configuration before
     * any upstream call was made.
     */
    record Denied(Reason reason, String message) implements Failure {
        @Override
        public int statusCode() {
            return reason.statusCode();
        }
    }

    record RateLimited(String message, long retryAfterSeconds) implements Failure {
        @Override
        public int statusCode() {
            return 429;
        }
    }

    record UpstreamTimeout(long timeoutMs) implements Failure {
        @Override
        public int statusCode() {
            return 504;
        }

        @Override
        public String message() {
            return "Upstream request timed out (%dms)".formatted(timeoutMs);
        }
    }

    record UpstreamUnavailable(String description) implements Failure {
        @Override
        public int statusCode() {
            return 502;
        }

        @Override
        public String message() {
            return "Upstream request failed: " + description;
        }
    }

    enum Reason {
        BAD_REQUEST(400),
        UNAUTHORIZED(401),
        FORBIDDEN(403),
        MISCONFIGURED(500);

        private final int statusCode;

        Reason(int statusCode) {
            this.statusCode = statusCode;
        }

        public int statusCode() {
            return statusCode;
        }
    }

    static Denied badRequest(String message) {
        return new Denied(Reason.BAD_REQUEST, message);
    }

    static Denied unauthorized(String message) {
        return new Denied(Reason.UNAUTHORIZED, message);
    }

    static Denied forbidden(String message) {
        return new Denied(Reason.FORBIDDEN, message);
    }

    static Denied misconfigured(String message) {
        return new Denied(Reason.MISCONFIGURED, message);
    }
}
