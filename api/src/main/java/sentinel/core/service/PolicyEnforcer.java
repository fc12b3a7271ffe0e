package sentinel.core.service;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import sentinel.core.model.Caller;
import sentinel.core.model.ClientContext;
import sentinel.core.model.EffectivePolicy;
import sentinel.core.model.PolicyDecision;
import sentinel.core.model.ProxyOutcome;
import sentinel.core.port.out.ServiceCatalog;

/**
 * Decides whether a caller may reach a service from where it is calling.
 *
 * <p>Checks run in a fixed order and the first failure wins:
 * <ol>
 *   <li>the service exists</li>
 *   <li>the agent, if any, is scoped to the service</li>
 *   <li>the client address is in the effective IP allowlist</li>
 *   <li>the client address is in the agent's own IP allowlist</li>
 *   <li>the Origin (or Referer) is in the effective Origin allowlist</li>
 * </ol>
 *
 * <p>The service and agent IP lists are both enforced: the first bounds the
 * destination, the second the caller.
 */
@ApplicationScoped
public class PolicyEnforcer {

    private final ServiceCatalog catalog;
    private final AddressMatcher addressMatcher;

    @Inject
    public PolicyEnforcer(ServiceCatalog catalog, AddressMatcher addressMatcher) {
        this.catalog = catalog;
        this.addressMatcher = addressMatcher;
    }

    public PolicyDecision evaluate(String serviceName, Caller caller, ClientContext client) {
        final var serviceOpt = catalog.find(serviceName);
        if (serviceOpt.isEmpty()) {
            return PolicyDecision.rejected(new ProxyOutcome.ServiceNotFound(serviceName, catalog.serviceNames()));
        }
        final var service = serviceOpt.get();

        if (caller.agent().isPresent() && !caller.agent().get().isAllowed(serviceName)) {
            return PolicyDecision.rejected(ProxyOutcome.forbidden("Agent \"%s\" is not authorized for service \"%s\""
                    .formatted(caller.name(), serviceName)));
        }

        final var policy = EffectivePolicy.resolve(service, catalog.globalPolicy());

        if (policy.restrictsIps()) {
            final var ipFailure = checkIp(client.address(), policy.allowedIps().get(), "service", serviceName);
            if (ipFailure != null) {
                return PolicyDecision.rejected(ipFailure);
            }
        }

        final var agentIps = caller.agent().flatMap(a -> a.allowedIps());
        if (agentIps.isPresent() && !agentIps.get().isEmpty()) {
            final var ipFailure = checkIp(client.address(), agentIps.get(), "agent", caller.name());
            if (ipFailure != null) {
                return PolicyDecision.rejected(ipFailure);
            }
        }

        if (policy.restrictsOrigins()) {
            final var provenance = client.provenance();
            if (provenance.isEmpty()) {
                return PolicyDecision.rejected(ProxyOutcome.forbidden(
                        "Origin not allowed for service \"%s\": missing Origin or Referer header"
                                .formatted(serviceName)));
            }
            if (!originAllowed(provenance.get(), policy.allowedOrigins().get())) {
                return PolicyDecision.rejected(ProxyOutcome.forbidden("Origin \"%s\" is not allowed for service \"%s\""
                        .formatted(provenance.get(), serviceName)));
            }
        }

        return PolicyDecision.permitted(service);
    }

    private ProxyOutcome.Failure checkIp(String address, List<String> allowed, String kind, String subject) {
        if (addressMatcher.parse(address).isEmpty()) {
            return ProxyOutcome.forbidden(
                    "Could not determine client IP address (got \"%s\")".formatted(address));
        }
        if (!addressMatcher.matchesAny(address, allowed)) {
            return ProxyOutcome.forbidden(
                    "IP \"%s\" is not allowed for %s \"%s\"".formatted(address, kind, subject));
        }
        return null;
    }

    static boolean originAllowed(String presented, List<String> allowed) {
        final var normalized = stripTrailingSlashes(presented);
        for (var entry : allowed) {
            if (stripTrailingSlashes(entry).equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    static String stripTrailingSlashes(String value) {
        var end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
