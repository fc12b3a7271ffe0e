package sentinel.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sentinel.core.model.AgentIdentity;
import sentinel.core.model.AuthInjection;
import sentinel.core.model.Caller;
import sentinel.core.model.ClientContext;
import sentinel.core.model.GlobalPolicy;
import sentinel.core.model.PolicyDecision;
import sentinel.core.model.ProxyOutcome;
import sentinel.core.model.ServiceDefinition;
import sentinel.support.Fixtures;

@DisplayName("PolicyEnforcer")
class PolicyEnforcerTest {

    private final AddressMatcher addressMatcher = new AddressMatcher();

    private PolicyEnforcer enforcer(GlobalPolicy global, ServiceDefinition... services) {
        return new PolicyEnforcer(Fixtures.catalog(global, services), addressMatcher);
    }

    private PolicyEnforcer enforcer(ServiceDefinition... services) {
        return enforcer(GlobalPolicy.none(), services);
    }

    private static ProxyOutcome.Failure failure(PolicyDecision decision) {
        return assertInstanceOf(PolicyDecision.Rejected.class, decision).failure();
    }

    @Nested
    @DisplayName("Service and scope")
    class ServiceAndScopeTests {

        @Test
        @DisplayName("should report unknown services with the available names")
        void shouldReportUnknownService() {
            var decision = enforcer(Fixtures.openai().build(), Fixtures.maps().build())
                    .evaluate("stripe", Caller.legacy(), ClientContext.of("10.0.0.1"));

            var notFound = assertInstanceOf(ProxyOutcome.ServiceNotFound.class, failure(decision));
            assertEquals(List.of("openai", "maps"), notFound.available());
            assertEquals(404, notFound.statusCode());
        }

        @Test
        @DisplayName("should forbid agents not scoped to the service")
        void shouldForbidUnscopedAgent() {
            var agent = Fixtures.agent("a1", Fixtures.OPENAI_TOKEN, "openai");
            var decision = enforcer(Fixtures.openai().build(), serviceNamed("stripe"))
                    .evaluate("stripe", Caller.of(agent), ClientContext.of("10.0.0.1"));

            var denied = failure(decision);
            assertEquals(403, denied.statusCode());
            assertEquals("Agent \"a1\" is not authorized for service \"stripe\"", denied.message());
        }

        @Test
        @DisplayName("should permit the legacy caller for any known service")
        void shouldPermitLegacyCaller() {
            var decision = enforcer(Fixtures.openai().build())
                    .evaluate("openai", Caller.legacy(), ClientContext.of("unknown"));

            assertInstanceOf(PolicyDecision.Permitted.class, decision);
        }
    }

    @Nested
    @DisplayName("IP allowlists")
    class IpTests {

        @Test
        @DisplayName("should apply the service list")
        void shouldApplyServiceList() {
            var service = Fixtures.openai().allowedIps(List.of("10.0.0.0/24")).build();
            var policy = enforcer(service);

            var rejected = failure(policy.evaluate("openai", Caller.legacy(), ClientContext.of("10.0.1.5")));
            assertEquals("IP \"10.0.1.5\" is not allowed for service \"openai\"", rejected.message());

            assertInstanceOf(
                    PolicyDecision.Permitted.class,
                    policy.evaluate("openai", Caller.legacy(), ClientContext.of("10.0.0.9")));
        }

        @Test
        @DisplayName("should fall back to the global list")
        void shouldFallBackToGlobalList() {
            var global = new GlobalPolicy(Optional.of(List.of("192.168.0.0/16")), Optional.empty());

            var decision = enforcer(global, Fixtures.openai().build())
                    .evaluate("openai", Caller.legacy(), ClientContext.of("10.0.0.1"));

            assertEquals(403, failure(decision).statusCode());
        }

        @Test
        @DisplayName("should let the service list override the global list")
        void shouldOverrideGlobalList() {
            var global = new GlobalPolicy(Optional.of(List.of("192.168.0.0/16")), Optional.empty());
            var service = Fixtures.openai().allowedIps(List.of("10.0.0.0/8")).build();

            var decision = enforcer(global, service).evaluate("openai", Caller.legacy(), ClientContext.of("10.1.1.1"));

            assertInstanceOf(PolicyDecision.Permitted.class, decision);
        }

        @Test
        @DisplayName("should treat an empty service list as unrestricted")
        void shouldTreatEmptyListAsUnrestricted() {
            var global = new GlobalPolicy(Optional.of(List.of("192.168.0.0/16")), Optional.empty());
            var service = Fixtures.openai().allowedIps(List.of()).build();

            var decision = enforcer(global, service).evaluate("openai", Caller.legacy(), ClientContext.of("10.1.1.1"));

            assertInstanceOf(PolicyDecision.Permitted.class, decision);
        }

        @Test
        @DisplayName("should reject an unparseable client address")
        void shouldRejectUnparseableAddress() {
            var service = Fixtures.openai().allowedIps(List.of("0.0.0.0/0")).build();

            var decision = enforcer(service).evaluate("openai", Caller.legacy(), ClientContext.of("unknown"));

            assertEquals("Could not determine client IP address (got \"unknown\")", failure(decision).message());
        }

        @Test
        @DisplayName("should check the agent list in addition to the service list")
        void shouldCheckAgentListAdditively() {
            var service = Fixtures.openai().allowedIps(List.of("10.0.0.0/8")).build();
            var agent = new AgentIdentity(
                    "a1", Fixtures.OPENAI_TOKEN, Set.of("openai"), Optional.empty(), Optional.of(List.of("10.0.0.0/24")));
            var policy = enforcer(service);

            var rejected = failure(policy.evaluate("openai", Caller.of(agent), ClientContext.of("10.5.0.1")));
            assertEquals("IP \"10.5.0.1\" is not allowed for agent \"a1\"", rejected.message());

            assertInstanceOf(
                    PolicyDecision.Permitted.class,
                    policy.evaluate("openai", Caller.of(agent), ClientContext.of("10.0.0.1")));
        }
    }

    @Nested
    @DisplayName("Origin allowlists")
    class OriginTests {

        private final ServiceDefinition service =
                Fixtures.openai().allowedOrigins(List.of("https://app.example.com/")).build();

        @Test
        @DisplayName("should accept a matching origin ignoring trailing slashes")
        void shouldAcceptMatchingOrigin() {
            var decision = enforcer(service)
                    .evaluate("openai", Caller.legacy(), ClientContext.of("10.0.0.1", "https://app.example.com"));

            assertInstanceOf(PolicyDecision.Permitted.class, decision);
        }

        @Test
        @DisplayName("should fall back to Referer")
        void shouldFallBackToReferer() {
            var client = new ClientContext("10.0.0.1", Optional.empty(), Optional.of("https://app.example.com//"));

            assertInstanceOf(PolicyDecision.Permitted.class, enforcer(service).evaluate("openai", Caller.legacy(), client));
        }

        @Test
        @DisplayName("should reject a missing header")
        void shouldRejectMissingHeader() {
            var decision = enforcer(service).evaluate("openai", Caller.legacy(), ClientContext.of("10.0.0.1"));

            assertEquals(
                    "Origin not allowed for service \"openai\": missing Origin or Referer header",
                    failure(decision).message());
        }

        @Test
        @DisplayName("should reject a different origin")
        void shouldRejectDifferentOrigin() {
            var decision = enforcer(service)
                    .evaluate("openai", Caller.legacy(), ClientContext.of("10.0.0.1", "https://evil.example.com"));

            assertEquals(403, failure(decision).statusCode());
        }
    }

    private static ServiceDefinition serviceNamed(String name) {
        return ServiceDefinition.builder(name)
                .baseUrl("https://api.stripe.com")
                .allowedHosts(List.of("api.stripe.com"))
                .auth(new AuthInjection.Header("Authorization", "Bearer ${SECRET}"))
                .secretEnv("STRIPE_KEY")
                .build();
    }
}
