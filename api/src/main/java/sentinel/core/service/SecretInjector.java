package sentinel.core.service;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import sentinel.core.model.AuthInjection;
import sentinel.core.model.Credential;
import sentinel.core.model.ServiceDefinition;
import sentinel.core.port.out.SecretSource;

/**
 * Resolves a service's real credential and writes it into the outgoing request.
 *
 * <p>Header credentials replace any caller header of the same name, compared
 * case-insensitively. Query credentials replace any caller parameter of the same
 * name. The credential is never logged.
 */
@ApplicationScoped
public class SecretInjector {

    private final SecretSource secretSource;

    @Inject
    public SecretInjector(SecretSource secretSource) {
        this.secretSource = secretSource;
    }

    /**
     * Looks up the service's secret and renders it into the auth template.
     *
     * @param service the target service
     * @return the credential, or empty when the secret variable is not set
     */
    public Optional<Credential> resolve(ServiceDefinition service) {
        return secretSource
                .lookup(service.secretEnv())
                .map(secret -> new Credential(service.auth().render(secret), secret));
    }

    /**
     * Applies the credential. Header mode mutates {@code headers}; query mode returns
     * a new target.
     *
     * @return the target URI to call
     */
    public URI inject(Credential credential, AuthInjection auth, URI target, Map<String, List<String>> headers) {
        if (auth instanceof AuthInjection.Header header) {
            headers.keySet().removeIf(name -> name.equalsIgnoreCase(header.headerName()));
            headers.put(header.headerName(), List.of(credential.rendered()));
            return target;
        }
        final var query = (AuthInjection.Query) auth;
        return withQueryParam(target, query.paramName(), credential.rendered());
    }

    static URI withQueryParam(URI target, String name, String value) {
        final var pairs = new ArrayList<String>();
        final var rawQuery = target.getRawQuery();
        if (rawQuery != null && !rawQuery.isEmpty()) {
            for (var pair : rawQuery.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                final var eq = pair.indexOf('=');
                final var rawName = eq >= 0 ? pair.substring(0, eq) : pair;
                if (!decode(rawName).equals(name)) {
                    pairs.add(pair);
                }
            }
        }
        pairs.add(encode(name) + "=" + encode(value));

        final var builder = new StringBuilder()
                .append(target.getScheme())
                .append("://")
                .append(target.getRawAuthority());
        if (target.getRawPath() != null) {
            builder.append(target.getRawPath());
        }
        builder.append('?').append(String.join("&", pairs));
        return URI.create(builder.toString());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
