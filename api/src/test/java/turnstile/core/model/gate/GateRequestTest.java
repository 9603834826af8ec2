package turnstile.core.model.gate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("GateRequest")
class GateRequestTest {

    private static GateRequest withHeaders(Map<String, String> headers) {
        return new GateRequest("get", "/dashboard", null, headers, Map.of());
    }

    @Test
    @DisplayName("should normalize method and empty path")
    void shouldNormalize() {
        var request = new GateRequest("post", "", null, null, null);

        assertEquals("POST", request.method());
        assertEquals("/", request.path());
        assertTrue(request.headers().isEmpty());
    }

    @Test
    @DisplayName("should look up headers case-insensitively")
    void shouldMatchHeadersIgnoringCase() {
        var request = withHeaders(Map.of("Next-Router-State-Tree", "x"));

        assertTrue(request.hasHeader("next-router-state-tree"));
        assertEquals(Optional.of("x"), request.header("NEXT-ROUTER-STATE-TREE"));
    }

    @Test
    @DisplayName("should treat blank cookies as absent")
    void shouldIgnoreBlankCookies() {
        var request = new GateRequest("GET", "/", null, Map.of(), Map.of("session_id", "", "access_token", "t"));

        assertEquals(Optional.empty(), request.cookie("session_id"));
        assertEquals(Optional.of("t"), request.cookie("access_token"));
    }

    @Nested
    @DisplayName("hasQueryParameter")
    class QueryTests {

        @ParameterizedTest
        @ValueSource(strings = {"_rsc=abc", "_rsc", "a=1&_rsc=", "x=y&%5Frsc=1"})
        @DisplayName("should find the parameter with or without value")
        void shouldFindParameter(String query) {
            assertTrue(new GateRequest("GET", "/", query, Map.of(), Map.of()).hasQueryParameter("_rsc"));
        }

        @Test
        @DisplayName("should not match values or prefixes")
        void shouldNotMatchValues() {
            var request = new GateRequest("GET", "/", "q=_rsc&_rscx=1", Map.of(), Map.of());

            assertFalse(request.hasQueryParameter("_rsc"));
            assertFalse(GateRequest.get("/").hasQueryParameter("_rsc"));
        }
    }

    @Nested
    @DisplayName("bearerToken")
    class BearerTests {

        @Test
        @DisplayName("should extract the token regardless of scheme case")
        void shouldExtractToken() {
            assertEquals(Optional.of("abc"), withHeaders(Map.of("Authorization", "bearer abc")).bearerToken());
        }

        @Test
        @DisplayName("should ignore other schemes and empty tokens")
        void shouldIgnoreOtherSchemes() {
            assertEquals(Optional.empty(), withHeaders(Map.of("Authorization", "Basic dXNlcg==")).bearerToken());
            assertEquals(Optional.empty(), withHeaders(Map.of("Authorization", "Bearer   ")).bearerToken());
            assertEquals(Optional.empty(), withHeaders(Map.of()).bearerToken());
        }
    }
}
