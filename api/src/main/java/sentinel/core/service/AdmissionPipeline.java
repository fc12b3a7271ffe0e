package sentinel.core.service;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import sentinel.core.model.Caller;
import sentinel.core.model.ClientContext;
import sentinel.core.model.IdentityResolution;
import sentinel.core.model.PolicyDecision;
import sentinel.core.model.ProxyOutcome;
import sentinel.core.model.ProxyRequest;
import sentinel.core.model.RateLimitKey;
import sentinel.core.model.ServiceDefinition;
import sentinel.core.model.ValidationResult;
import sentinel.core.port.in.AdmissionUseCase;
import sentinel.core.port.out.Metrics;
import sentinel.core.port.out.RateLimiter;

/**
 * Runs the admission checks for one request in a fixed order and forwards it when
 * every check passes. The first failing check decides the outcome.
 *
 * <ol>
 *   <li>identity</li>
 *   <li>service, scope, IP and origin policy</li>
 *   <li>request shape</li>
 *   <li>service rate limit, then agent rate limit</li>
 *   <li>secret resolution</li>
 *   <li>upstream call</li>
 * </ol>
 */
@ApplicationScoped
public class AdmissionPipeline implements AdmissionUseCase {

    private static final Logger LOG = Logger.getLogger(AdmissionPipeline.class);

    private final IdentityResolver identityResolver;
    private final PolicyEnforcer policyEnforcer;
    private final RequestShapeValidator shapeValidator;
    private final RateLimiter rateLimiter;
    private final SecretInjector secretInjector;
    private final ForwardingGateway forwardingGateway;
    private final Metrics metrics;

    @Inject
    public AdmissionPipeline(
            IdentityResolver identityResolver,
            PolicyEnforcer policyEnforcer,
            RequestShapeValidator shapeValidator,
            RateLimiter rateLimiter,
            SecretInjector secretInjector,
            ForwardingGateway forwardingGateway,
            Metrics metrics) {
        this.identityResolver = identityResolver;
        this.policyEnforcer = policyEnforcer;
        this.shapeValidator = shapeValidator;
        this.rateLimiter = rateLimiter;
        this.secretInjector = secretInjector;
        this.forwardingGateway = forwardingGateway;
        this.metrics = metrics;
    }

    @Override
    public Uni<ProxyOutcome> admit(
            String serviceName, Optional<String> presentedToken, ProxyRequest request, ClientContext client) {
        final var startNanos = System.nanoTime();

        final var identity = identityResolver.resolve(presentedToken);
        if (identity instanceof IdentityResolution.Unauthenticated unauthenticated) {
            return reject(serviceName, ProxyOutcome.unauthorized(unauthenticated.reason()), startNanos);
        }
        final var caller = ((IdentityResolution.Authenticated) identity).caller();

        final var decision = policyEnforcer.evaluate(serviceName, caller, client);
        if (decision instanceof PolicyDecision.Rejected rejected) {
            return reject(serviceName, rejected.failure(), startNanos);
        }
        final var service = ((PolicyDecision.Permitted) decision).service();

        final var validation = shapeValidator.validate(service, request);
        if (validation instanceof ValidationResult.Invalid invalid) {
            return reject(serviceName, ProxyOutcome.badRequest(invalid.reason()), startNanos);
        }

        final var rateLimited = checkRateLimits(service, caller);
        if (rateLimited.isPresent()) {
            return reject(serviceName, rateLimited.get(), startNanos);
        }

        final var credential = secretInjector.resolve(service);
        if (credential.isEmpty()) {
            LOG.warnv("Secret variable {0} for service {1} is not set", service.secretEnv(), service.name());
            return reject(
                    serviceName,
                    ProxyOutcome.misconfigured(
                            "Server misconfigured: env var \"%s\" is not set".formatted(service.secretEnv())),
                    startNanos);
        }

        return forwardingGateway
                .forward(service, request, credential.get(), caller, startNanos)
                .invoke(outcome -> metrics.recordOutcome(serviceName, outcome, elapsedMs(startNanos)));
    }

    /**
     * Service bucket first. A request rejected by the service limit never charges the
     * agent bucket; a request admitted by the service limit stays charged there even
     * when the agent limit rejects it.
     */
    private Optional<ProxyOutcome.RateLimited> checkRateLimits(ServiceDefinition service, Caller caller) {
        if (!rateLimiter.isEnabled()) {
            return Optional.empty();
        }

        if (service.rateLimitPerMinute().isPresent()) {
            final int limit = service.rateLimitPerMinute().get();
            final var serviceDecision = rateLimiter.checkAndConsume(RateLimitKey.service(service.name()), limit);
            if (!serviceDecision.allowed()) {
                metrics.recordRateLimitExceeded(service.name(), RateLimitKey.Scope.SERVICE);
                return Optional.of(new ProxyOutcome.RateLimited(
                        "Rate limit exceeded for service \"%s\". Limit: %d/min".formatted(service.name(), limit),
                        serviceDecision.retryAfterSeconds()));
            }
        }

        final var agent = caller.agent();
        if (agent.isPresent() && agent.get().rateLimitPerMinute().isPresent()) {
            final int limit = agent.get().rateLimitPerMinute().get();
            final var agentDecision =
                    rateLimiter.checkAndConsume(RateLimitKey.agent(agent.get().name()), limit);
            if (!agentDecision.allowed()) {
                metrics.recordRateLimitExceeded(service.name(), RateLimitKey.Scope.AGENT);
                return Optional.of(new ProxyOutcome.RateLimited(
                        "Rate limit exceeded for agent \"%s\". Limit: %d/min".formatted(agent.get().name(), limit),
                        agentDecision.retryAfterSeconds()));
            }
        }

        return Optional.empty();
    }

    private Uni<ProxyOutcome> reject(String serviceName, ProxyOutcome.Failure failure, long startNanos) {
        LOG.debugv("Rejected request for service {0}: {1} {2}", serviceName, failure.statusCode(), failure.message());
        metrics.recordOutcome(serviceName, failure, elapsedMs(startNanos));
        return Uni.createFrom().item(failure);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
