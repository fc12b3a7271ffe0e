package sentinel.core.service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

import sentinel.core.model.ProxyRequest;
import sentinel.core.model.ServiceDefinition;
import sentinel.core.model.ValidationResult;

/**
 * Checks that a proxy request's method and path conform to the target service's
 * declared policy. The path must stay relative to the service base address so the
 * gateway cannot be used as an open relay.
 */
@ApplicationScoped
public class RequestShapeValidator {

    private static final Pattern ABSOLUTE_URL = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");
    private static final Pattern ENCODED_DOT = Pattern.compile("%2e", Pattern.CASE_INSENSITIVE);

    public ValidationResult validate(ServiceDefinition service, ProxyRequest request) {
        final var rawMethod = request.method();
        if (rawMethod == null || rawMethod.isBlank()) {
            return ValidationResult.invalid("Missing or invalid 'method'");
        }

        final var method = rawMethod.toUpperCase(Locale.ROOT);
        if (service.allowedMethods().isPresent()) {
            final var allowed = service.allowedMethods().get();
            if (!allowed.contains(method)) {
                return ValidationResult.invalid("Method \"%s\" not allowed. Allowed: %s"
                        .formatted(method, String.join(", ", new TreeSet<>(allowed))));
            }
        }

        final var path = request.path();
        if (path == null || path.isEmpty()) {
            return ValidationResult.invalid("Missing or invalid 'path'");
        }

        // Checked before the leading-slash rule so absolute URLs get the precise message
        if (ABSOLUTE_URL.matcher(path).find()) {
            return ValidationResult.invalid("Path must be a relative path, not a full URL");
        }

        if (!path.startsWith("/")) {
            return ValidationResult.invalid("Path must start with '/'");
        }

        // "//host/x" resolves to another host
        if (path.startsWith("//")) {
            return ValidationResult.invalid("Path must be a relative path, not a scheme-relative URL");
        }

        if (!isUriReference(path)) {
            return ValidationResult.invalid("Path is not a valid URI reference");
        }

        // resolution against the base address would collapse these and escape the allowed prefixes
        if (hasDotSegment(stripQuery(path))) {
            return ValidationResult.invalid("Path must not contain '.' or '..' segments");
        }

        if (service.allowedPathPrefixes().isPresent()) {
            final var prefixes = service.allowedPathPrefixes().get();
            final var pathOnly = stripQuery(path);
            var ok = false;
            for (var prefix : prefixes) {
                if (pathOnly.startsWith(prefix)) {
                    ok = true;
                    break;
                }
            }
            if (!ok) {
                return ValidationResult.invalid("Path \"%s\" not allowed. Allowed prefixes: %s"
                        .formatted(pathOnly, String.join(", ", prefixes)));
            }
        }

        return ValidationResult.valid();
    }

    static String stripQuery(String path) {
        final var query = path.indexOf('?');
        return query >= 0 ? path.substring(0, query) : path;
    }

    static boolean hasDotSegment(String pathOnly) {
        for (var segment : pathOnly.split("/", -1)) {
            final var decoded = ENCODED_DOT.matcher(segment).replaceAll(".");
            if (decoded.equals(".") || decoded.equals("..")) {
                return true;
            }
        }
        return false;
    }

    private static boolean isUriReference(String path) {
        try {
            new URI(path);
            return true;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
