package sentinel.core.model;

/**
 * How a service's real credential is rendered into an outgoing request.
 *
 * <p>The variant is fixed when the service definition is loaded, so the forwarding
 * path never has to check which fields are present.
 */
public sealed interface AuthInjection {

    /**
     * Placeholder replaced by the resolved secret in {@link #template()}.
     */
    String SECRET_PLACEHOLDER = "${SECRET}";

    String template();

    /**
     * Renders the template with the given secret. Only the first placeholder is replaced.
     *
     * @param secret the raw secret value
     * @return the rendered credential
     */
    default String render(String secret) {
        var template = template();
        var idx = template.indexOf(SECRET_PLACEHOLDER);
        if (idx < 0) {
            return template;
        }
        return template.substring(0, idx) + secret + template.substring(idx + SECRET_PLACEHOLDER.length());
    }

    /**
     * Credential sent as an HTTP header, e.g. {@code Authorization: Bearer ${SECRET}}.
     */
    record Header(String headerName, String template) implements AuthInjection {
        public Header {
            if (headerName == null || headerName.isBlank()) {
                throw new IllegalArgumentException("header auth requires header_name and template");
            }
            requireTemplate(template);
        }
    }

    /**
     * Credential sent as a query parameter on the upstream URL.
     */
    record Query(String paramName, String template) implements AuthInjection {
        public Query {
            if (paramName == null || paramName.isBlank()) {
                throw new IllegalArgumentException("query auth requires query_param and template");
            }
            requireTemplate(template);
        }
    }

    private static void requireTemplate(String template) {
        if (template == null || !template.contains(SECRET_PLACEHOLDER)) {
            throw new IllegalArgumentException("auth.template must contain ${SECRET} placeholder");
        }
    }
}
