package sentinel.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sentinel.core.model.AuthInjection;
import sentinel.core.model.Credential;
import sentinel.support.FakeSecretSource;
import sentinel.support.Fixtures;

@DisplayName("SecretInjector")
class SecretInjectorTest {

    private final FakeSecretSource secrets = new FakeSecretSource().with("OPENAI_API_KEY", "sk-live-123");
    private final SecretInjector injector = new SecretInjector(secrets);

    @Nested
    @DisplayName("Resolution")
    class ResolutionTests {

        @Test
        @DisplayName("should render the template with the secret")
        void shouldRender() {
            var credential = injector.resolve(Fixtures.openai().build()).orElseThrow();

            assertEquals("Bearer sk-live-123", credential.rendered());
            assertEquals("sk-live-123", credential.secret());
            assertFalse(credential.toString().contains("sk-live"));
        }

        @Test
        @DisplayName("should return empty when the variable is unset")
        void shouldReturnEmptyWhenUnset() {
            assertTrue(injector.resolve(Fixtures.maps().build()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Header injection")
    class HeaderTests {

        @Test
        @DisplayName("should replace a caller header regardless of case")
        void shouldReplaceCallerHeader() {
            Map<String, List<String>> headers = new HashMap<>();
            headers.put("authorization", List.of("Bearer forged"));
            headers.put("Accept", List.of("application/json"));
            var target = URI.create("https://api.openai.com/v1/models");

            var result = injector.inject(
                    new Credential("Bearer real", "real"),
                    new AuthInjection.Header("Authorization", "Bearer ${SECRET}"),
                    target,
                    headers);

            assertEquals(target, result);
            assertEquals(List.of("Bearer real"), headers.get("Authorization"));
            assertFalse(headers.containsKey("authorization"));
            assertEquals(List.of("application/json"), headers.get("Accept"));
        }
    }

    @Nested
    @DisplayName("Query injection")
    class QueryTests {

        private final AuthInjection.Query auth = new AuthInjection.Query("key", "${SECRET}");

        @Test
        @DisplayName("should append the parameter")
        void shouldAppendParam() {
            var result = injector.inject(
                    new Credential("abc", "abc"), auth, URI.create("https://maps.test/geo"), new HashMap<>());

            assertEquals("https://maps.test/geo?key=abc", result.toString());
        }

        @Test
        @DisplayName("should replace a caller parameter of the same name and keep others")
        void shouldReplaceCallerParam() {
            var result = injector.inject(
                    new Credential("abc", "abc"),
                    auth,
                    URI.create("https://maps.test/geo?q=paris&key=forged"),
                    new HashMap<>());

            assertEquals("https://maps.test/geo?q=paris&key=abc", result.toString());
        }

        @Test
        @DisplayName("should encode reserved characters in the secret")
        void shouldEncodeValue() {
            var result = injector.inject(
                    new Credential("a&b=c", "a&b=c"), auth, URI.create("https://maps.test/geo"), new HashMap<>());

            assertEquals("key=a%26b%3Dc", result.getRawQuery());
        }
    }
}
