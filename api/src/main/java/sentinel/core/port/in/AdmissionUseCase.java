package sentinel.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import sentinel.core.model.ClientContext;
import sentinel.core.model.ProxyOutcome;
import sentinel.core.model.ProxyRequest;

/**
 * Admits one agent request: authenticate, authorize, validate, rate limit, inject the
 * credential and forward.
 */
public interface AdmissionUseCase {

    /**
     * @param serviceName    target service from the request path
     * @param presentedToken the {@code x-agent-token} header, if any
     * @param request        the agent's proxy request
     * @param client         caller address and provenance headers
     * @return the outcome; never a failed {@code Uni}
     */
    Uni<ProxyOutcome> admit(
            String serviceName, Optional<String> presentedToken, ProxyRequest request, ClientContext client);
}
