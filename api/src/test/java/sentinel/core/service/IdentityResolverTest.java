package sentinel.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sentinel.adapter.out.config.InMemoryAgentDirectory;
import sentinel.core.config.AuthConfig;
import sentinel.core.model.ConfigurationException;
import sentinel.core.model.IdentityResolution;
import sentinel.support.Fixtures;

@DisplayName("IdentityResolver")
class IdentityResolverTest {

    private static AuthConfig legacyToken(String token) {
        return () -> Optional.ofNullable(token);
    }

    private static String reason(IdentityResolution resolution) {
        return assertInstanceOf(IdentityResolution.Unauthenticated.class, resolution).reason();
    }

    @Nested
    @DisplayName("Per-agent mode")
    class PerAgentTests {

        private final IdentityResolver resolver = new IdentityResolver(
                Fixtures.agents(Fixtures.agent("a1", Fixtures.OPENAI_TOKEN, "openai")), legacyToken(null));

        @Test
        @DisplayName("should resolve a known token to its agent")
        void shouldResolveKnownToken() {
            var resolution = resolver.resolve(Optional.of(Fixtures.OPENAI_TOKEN));

            var caller = assertInstanceOf(IdentityResolution.Authenticated.class, resolution).caller();
            assertEquals("a1", caller.name());
            assertTrue(caller.agent().isPresent());
        }

        @Test
        @DisplayName("should reject an unknown token")
        void shouldRejectUnknownToken() {
            assertEquals("Unauthorized: invalid agent token", reason(resolver.resolve(Optional.of("agt_other"))));
        }

        @Test
        @DisplayName("should reject a missing or empty token")
        void shouldRejectMissingToken() {
            assertEquals("Unauthorized: missing x-agent-token", reason(resolver.resolve(Optional.empty())));
            assertEquals("Unauthorized: missing x-agent-token", reason(resolver.resolve(Optional.of(""))));
        }
    }

    @Nested
    @DisplayName("Single-token mode")
    class SingleTokenTests {

        private final IdentityResolver resolver =
                new IdentityResolver(InMemoryAgentDirectory.singleToken(), legacyToken("shared-secret"));

        @Test
        @DisplayName("should accept the shared token as the legacy caller")
        void shouldAcceptSharedToken() {
            var resolution = resolver.resolve(Optional.of("shared-secret"));

            var caller = assertInstanceOf(IdentityResolution.Authenticated.class, resolution).caller();
            assertEquals("legacy", caller.name());
            assertTrue(caller.agent().isEmpty());
        }

        @Test
        @DisplayName("should reject any other token")
        void shouldRejectOtherToken() {
            assertEquals(
                    "Unauthorized: invalid or missing x-agent-token",
                    reason(resolver.resolve(Optional.of("shared-secret-2"))));
        }

        @Test
        @DisplayName("should refuse to start without a shared token")
        void shouldRefuseToStartWithoutToken() {
            assertThrows(
                    ConfigurationException.class,
                    () -> new IdentityResolver(InMemoryAgentDirectory.singleToken(), legacyToken("  ")));
            assertThrows(
                    ConfigurationException.class,
                    () -> new IdentityResolver(InMemoryAgentDirectory.singleToken(), legacyToken(null)));
        }
    }
}
