package turnstile.core.service.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import turnstile.core.model.auth.SubscriptionPlan;
import turnstile.core.model.gate.GateRequest;
import turnstile.core.model.routing.RouteCategory;
import turnstile.support.TestConfigs;

@DisplayName("RouteClassifier")
class RouteClassifierTest {

    private RouteClassifier classifier;

    @BeforeEach
    void setUp() {
        var config = new TestConfigs.TestRoutingConfig();
        classifier = new RouteClassifier(config, RouteTableFactory.fromEntries(config.planRules()));
    }

    private RouteCategory categoryOf(String path) {
        return classifier.classify(GateRequest.get(path)).category();
    }

    private static GateRequest withHeader(String path, String name, String value) {
        return new GateRequest("GET", path, null, Map.of(name, value), Map.of());
    }

    @Nested
    @DisplayName("page requests")
    class PageTests {

        @Test
        @DisplayName("should classify the root")
        void shouldClassifyRoot() {
            assertEquals(RouteCategory.ROOT, categoryOf("/"));
        }

        @Test
        @DisplayName("should classify auth-only pages before public ones")
        void shouldClassifyAuthOnly() {
            assertEquals(RouteCategory.AUTH_ONLY, categoryOf("/auth/login"));
            assertEquals(RouteCategory.AUTH_ONLY, categoryOf("/auth/register/"));
            assertEquals(RouteCategory.PUBLIC, categoryOf("/auth/reset-password"));
        }

        @Test
        @DisplayName("should classify plan rules with their required plan")
        void shouldClassifyPaidRoutes() {
            var exact = classifier.classify(GateRequest.get("/dashboard/institutional"));
            var nested = classifier.classify(GateRequest.get("/dashboard/analytics/overview"));

            assertEquals(RouteCategory.PAID_PROTECTED, exact.category());
            assertEquals(Optional.of(SubscriptionPlan.PREMIUM), exact.requiredPlan());
            assertFalse(exact.api());
            assertEquals(Optional.of(SubscriptionPlan.BASIC), nested.requiredPlan());
        }

        @Test
        @DisplayName("should classify protected prefixes as free-protected")
        void shouldClassifyFreeProtected() {
            assertEquals(RouteCategory.FREE_PROTECTED, categoryOf("/dashboard"));
            assertEquals(RouteCategory.FREE_PROTECTED, categoryOf("/settings/notifications"));
            assertEquals(RouteCategory.FREE_PROTECTED, categoryOf("/dashboard/watchlist"));
        }

        @Test
        @DisplayName("should classify public pages")
        void shouldClassifyPublic() {
            assertEquals(RouteCategory.PUBLIC, categoryOf("/pricing"));
            assertEquals(RouteCategory.PUBLIC, categoryOf("/blog/first-post"));
            assertEquals(RouteCategory.PUBLIC, categoryOf("/legal/terms"));
        }

        @Test
        @DisplayName("should ignore matrix parameters when matching rules")
        void shouldIgnoreMatrixParameters() {
            var page = classifier.classify(GateRequest.get("/dashboard/institutional;x=1"));
            var nested = classifier.classify(GateRequest.get("/dashboard;v=2/institutional/desk"));

            assertEquals(Optional.of(SubscriptionPlan.PREMIUM), page.requiredPlan());
            assertEquals(Optional.of(SubscriptionPlan.PREMIUM), nested.requiredPlan());
        }

        @Test
        @DisplayName("should classify everything else as unlisted")
        void shouldClassifyUnlisted() {
            assertEquals(RouteCategory.UNLISTED, categoryOf("/markets"));
            assertEquals(RouteCategory.UNLISTED, categoryOf("/dashboards"));
        }
    }

    @Nested
    @DisplayName("bypass")
    class BypassTests {

        @ParameterizedTest
        @ValueSource(strings = {"/_next/static/chunk.js", "/static/logo", "/q/health", "/favicon.ico", "/robots.txt"})
        @DisplayName("should bypass assets and framework paths")
        void shouldBypassAssets(String path) {
            assertTrue(classifier.classify(GateRequest.get(path)).isBypass());
        }

        @ParameterizedTest
        @ValueSource(strings = {"HEAD", "OPTIONS"})
        @DisplayName("should bypass HEAD and OPTIONS page requests")
        void shouldBypassHeadAndOptions(String method) {
            var request = new GateRequest(method, "/dashboard", null, Map.of(), Map.of());
            assertTrue(classifier.classify(request).isBypass());
        }

        @ParameterizedTest
        @ValueSource(strings = {"POST", "PUT", "DELETE"})
        @DisplayName("should gate state-changing page requests")
        void shouldGateWrites(String method) {
            var request = new GateRequest(method, "/dashboard/institutional", null, Map.of(), Map.of());
            var classification = classifier.classify(request);

            assertEquals(RouteCategory.PAID_PROTECTED, classification.category());
            assertEquals(Optional.of(SubscriptionPlan.PREMIUM), classification.requiredPlan());
        }

        @Test
        @DisplayName("should bypass framework query parameters")
        void shouldBypassQueryParameters() {
            var request = new GateRequest("GET", "/dashboard", "_rsc=1a2b", Map.of(), Map.of());
            var plain = new GateRequest("GET", "/dashboard", "tab=positions", Map.of(), Map.of());

            assertTrue(classifier.classify(request).isBypass());
            assertFalse(classifier.classify(plain).isBypass());
        }

        @Test
        @DisplayName("should bypass framework headers")
        void shouldBypassHeaders() {
            assertTrue(classifier.classify(withHeader("/dashboard", "RSC", "1")).isBypass());
            assertTrue(classifier.classify(withHeader("/dashboard", "Next-Router-State-Tree", "x")).isBypass());
            assertTrue(classifier.classify(withHeader("/dashboard", "Accept", "text/x-component")).isBypass());
            assertFalse(classifier.classify(withHeader("/dashboard", "rsc", "0")).isBypass());
            assertFalse(classifier.classify(withHeader("/dashboard", "Accept", "text/html")).isBypass());
        }
    }

    @Nested
    @DisplayName("API requests")
    class ApiTests {

        @Test
        @DisplayName("should let preflight requests through")
        void shouldBypassOptions() {
            var request = new GateRequest("OPTIONS", "/api/sessions", null, Map.of(), Map.of());
            assertTrue(classifier.classify(request).isBypass());
        }

        @Test
        @DisplayName("should classify public API endpoints")
        void shouldClassifyPublicApi() {
            var classification = classifier.classify(GateRequest.get("/api/auth/login"));

            assertEquals(RouteCategory.PUBLIC, classification.category());
            assertTrue(classification.api());
        }

        @Test
        @DisplayName("should apply plan rules to API paths regardless of method")
        void shouldClassifyPaidApi() {
            var request = new GateRequest("POST", "/api/institutional/orders", null, Map.of(), Map.of());
            var classification = classifier.classify(request);

            assertEquals(RouteCategory.PAID_PROTECTED, classification.category());
            assertEquals(Optional.of(SubscriptionPlan.PREMIUM), classification.requiredPlan());
            assertTrue(classification.api());
        }

        @Test
        @DisplayName("should protect session and admin endpoints")
        void shouldProtectSessionApi() {
            var sessions = classifier.classify(GateRequest.get("/api/sessions"));
            var admin = classifier.classify(new GateRequest("POST", "/api/admin/sessions/cleanup", null, null, null));

            assertEquals(RouteCategory.FREE_PROTECTED, sessions.category());
            assertTrue(sessions.api());
            assertEquals(RouteCategory.FREE_PROTECTED, admin.category());
        }

        @Test
        @DisplayName("should not let matrix parameters skip API plan rules")
        void shouldIgnoreApiMatrixParameters() {
            var classification = classifier.classify(GateRequest.get("/api/institutional;x"));

            assertEquals(RouteCategory.PAID_PROTECTED, classification.category());
            assertEquals(Optional.of(SubscriptionPlan.PREMIUM), classification.requiredPlan());
        }

        @Test
        @DisplayName("should leave other API paths to their handlers")
        void shouldBypassOtherApi() {
            assertTrue(classifier.classify(GateRequest.get("/api/market/quotes")).isBypass());
        }
    }
}
