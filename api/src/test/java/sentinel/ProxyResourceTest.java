package sentinel;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.notNullValue;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Runs against the definitions in {@code src/test/resources/definitions}. None of the
 * services' secret variables are set, so admitted requests end in a 500.
 */
@QuarkusTest
@DisplayName("Proxy endpoint")
class ProxyResourceTest {

    private static final String RESEARCH_TOKEN = "agt_research_0123456789";
    private static final String LIMITED_TOKEN = "agt_limited_0123456789";

    private static final String FORECAST = "{\"method\": \"GET\", \"path\": \"/forecast?city=oslo\"}";

    @Nested
    @DisplayName("Health")
    class HealthTests {

        @Test
        @DisplayName("should list configured services")
        void shouldListServices() {
            given().when()
                    .get("/health")
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("ok"))
                    .body("services", contains("weather", "search", "internal"));
        }

        @Test
        @DisplayName("should report definitions in the readiness check")
        void shouldReportReadiness() {
            given().when()
                    .get("/q/health/ready")
                    .then()
                    .statusCode(200)
                    .body("checks.name", hasItem("definitions"));
        }
    }

    @Nested
    @DisplayName("Authentication")
    class AuthenticationTests {

        @Test
        @DisplayName("should reject a missing token")
        void shouldRejectMissingToken() {
            given().contentType(ContentType.JSON)
                    .body(FORECAST)
                    .when()
                    .post("/v1/proxy/weather")
                    .then()
                    .statusCode(401)
                    .body("error", equalTo("Unauthorized: missing x-agent-token"));
        }

        @Test
        @DisplayName("should reject an unknown token")
        void shouldRejectUnknownToken() {
            given().header("x-agent-token", "agt_unknown")
                    .contentType(ContentType.JSON)
                    .body(FORECAST)
                    .when()
                    .post("/v1/proxy/weather")
                    .then()
                    .statusCode(401)
                    .body("error", equalTo("Unauthorized: invalid agent token"));
        }
    }

    @Nested
    @DisplayName("Policy")
    class PolicyTests {

        @Test
        @DisplayName("should list available services for an unknown one")
        void shouldReportUnknownService() {
            given().header("x-agent-token", RESEARCH_TOKEN)
                    .contentType(ContentType.JSON)
                    .body(FORECAST)
                    .when()
                    .post("/v1/proxy/stripe")
                    .then()
                    .statusCode(404)
                    .body("error", equalTo("Unknown service: \"stripe\""))
                    .body("available", contains("weather", "search", "internal"));
        }

        @Test
        @DisplayName("should forbid services outside the agent's scope")
        void shouldForbidUnscopedService() {
            given().header("x-agent-token", LIMITED_TOKEN)
                    .contentType(ContentType.JSON)
                    .body("{\"method\": \"GET\", \"path\": \"/q\"}")
                    .when()
                    .post("/v1/proxy/search")
                    .then()
                    .statusCode(403)
                    .body("error", equalTo("Agent \"limited-bot\" is not authorized for service \"search\""));
        }

        @Test
        @DisplayName("should forbid clients outside the service IP allowlist")
        void shouldForbidOutsideIpRange() {
            given().header("x-agent-token", RESEARCH_TOKEN)
                    .header("X-Forwarded-For", "10.0.9.1")
                    .contentType(ContentType.JSON)
                    .body("{\"method\": \"GET\", \"path\": \"/q\"}")
                    .when()
                    .post("/v1/proxy/search")
                    .then()
                    .statusCode(403)
                    .body("error", equalTo("IP \"10.0.9.1\" is not allowed for service \"search\""));
        }

        @Test
        @DisplayName("should admit clients inside the service IP allowlist")
        void shouldAdmitInsideIpRange() {
            given().header("x-agent-token", RESEARCH_TOKEN)
                    .header("X-Forwarded-For", "10.0.3.200, 127.0.0.1")
                    .contentType(ContentType.JSON)
                    .body("{\"method\": \"GET\", \"path\": \"/q\"}")
                    .when()
                    .post("/v1/proxy/search")
                    .then()
                    .statusCode(500)
                    .body("error", containsString("SENTINEL_TEST_UNSET_SEARCH_KEY"));
        }

        @Test
        @DisplayName("should require an Origin for origin-restricted services")
        void shouldRequireOrigin() {
            given().header("x-agent-token", RESEARCH_TOKEN)
                    .contentType(ContentType.JSON)
                    .body("{\"method\": \"GET\", \"path\": \"/status\"}")
                    .when()
                    .post("/v1/proxy/internal")
                    .then()
                    .statusCode(403)
                    .body("error", containsString("missing Origin or Referer"));
        }

        @Test
        @DisplayName("should reject foreign origins")
        void shouldRejectForeignOrigin() {
            given().header("x-agent-token", RESEARCH_TOKEN)
                    .header("Origin", "https://evil.example.com")
                    .contentType(ContentType.JSON)
                    .body("{\"method\": \"GET\", \"path\": \"/status\"}")
                    .when()
                    .post("/v1/proxy/internal")
                    .then()
                    .statusCode(403);
        }
    }

    @Nested
    @DisplayName("Request shape")
    class ShapeTests {

        @Test
        @DisplayName("should reject a malformed body as a missing method")
        void shouldRejectMalformedBody() {
            given().header("x-agent-token", RESEARCH_TOKEN)
                    .contentType(ContentType.JSON)
                    .body("{not json")
                    .when()
                    .post("/v1/proxy/weather")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("Missing or invalid 'method'"));
        }

        @Test
        @DisplayName("should reject absolute URLs as paths")
        void shouldRejectAbsoluteUrl() {
            given().header("x-agent-token", RESEARCH_TOKEN)
                    .contentType(ContentType.JSON)
                    .body("{\"method\": \"GET\", \"path\": \"http://evil.test/x\"}")
                    .when()
                    .post("/v1/proxy/weather")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("Path must be a relative path, not a full URL"));
        }

        @Test
        @DisplayName("should reject methods outside the allowlist")
        void shouldRejectMethod() {
            given().header("x-agent-token", RESEARCH_TOKEN)
                    .contentType(ContentType.JSON)
                    .body("{\"method\": \"delete\", \"path\": \"/forecast\"}")
                    .when()
                    .post("/v1/proxy/weather")
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("Method \"DELETE\" not allowed. Allowed: GET, POST"));
        }
    }

    @Test
    @DisplayName("should rate limit a service after its per-minute budget")
    void shouldRateLimitService() {
        for (var i = 0; i < 2; i++) {
            given().header("x-agent-token", RESEARCH_TOKEN)
                    .contentType(ContentType.JSON)
                    .body(FORECAST)
                    .when()
                    .post("/v1/proxy/weather")
                    .then()
                    .statusCode(500)
                    .body("error", containsString("SENTINEL_TEST_UNSET_WEATHER_KEY"));
        }

        given().header("x-agent-token", RESEARCH_TOKEN)
                .contentType(ContentType.JSON)
                .body(FORECAST)
                .when()
                .post("/v1/proxy/weather")
                .then()
                .statusCode(429)
                .header("Retry-After", notNullValue())
                .body("error", equalTo("Rate limit exceeded for service \"weather\". Limit: 2/min"));
    }
}
