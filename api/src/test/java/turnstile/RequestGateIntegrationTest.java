package turnstile;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;

import java.util.Set;
import java.util.UUID;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.specification.RequestSpecification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import turnstile.core.model.session.UserSession;
import turnstile.core.port.in.SessionManagement;
import turnstile.support.TestTokens;

@QuarkusTest
@DisplayName("Request gate integration")
class RequestGateIntegrationTest {

    @Inject
    SessionManagement sessions;

    private String userId;
    private String sessionId;

    @BeforeEach
    void setUp() {
        userId = "user-" + UUID.randomUUID();
        sessionId = UUID.randomUUID().toString();
    }

    private void login(String role) {
        var now = System.currentTimeMillis();
        var session = new UserSession(
                userId, "trader", "trader@example.com", role, Set.of(), now, now, "127.0.0.1", "rest-assured", null);
        sessions.createSession(sessionId, session).await().indefinitely();
    }

    private RequestSpecification as(String plan) {
        return given().redirects()
                .follow(false)
                .cookie("access_token", TestTokens.token(userId, plan, "active"))
                .cookie("session_id", sessionId);
    }

    @Nested
    @DisplayName("Anonymous callers")
    class AnonymousTests {

        @Test
        @DisplayName("should be redirected from protected pages to login")
        void shouldRedirectToLogin() {
            given().redirects()
                    .follow(false)
                    .when()
                    .get("/dashboard")
                    .then()
                    .statusCode(307)
                    .header("Location", "/auth/login?redirect=/dashboard");
        }

        @Test
        @DisplayName("should get JSON 401 from protected APIs")
        void shouldRejectApi() {
            given().when()
                    .get("/api/sessions")
                    .then()
                    .statusCode(401)
                    .body("code", is("UNAUTHORIZED"))
                    .body("error", is("Authentication required"));
        }

        @Test
        @DisplayName("should not be able to spoof identity headers")
        void shouldIgnoreSpoofedIdentity() {
            given().header("x-user-id", "admin")
                    .header("x-user-subscription-plan", "premium")
                    .cookie("session_id", sessionId)
                    .when()
                    .get("/api/sessions/entitlements")
                    .then()
                    .statusCode(401);
        }

        @Test
        @DisplayName("should reach the readiness endpoint")
        void shouldReachHealth() {
            given().when().get("/q/health/ready").then().statusCode(200);
        }
    }

    @Nested
    @DisplayName("Authenticated callers")
    class AuthenticatedTests {

        @Test
        @DisplayName("should list their own sessions")
        void shouldListSessions() {
            login("user");

            as("basic").when()
                    .get("/api/sessions")
                    .then()
                    .statusCode(200)
                    .body("count", is(1))
                    .body("sessions[0].sessionId", is(sessionId))
                    .body("sessions[0].current", is(true));
        }

        @Test
        @DisplayName("should see entitlements for their effective plan")
        void shouldSeeEntitlements() {
            login("user");

            as("basic").when()
                    .get("/api/sessions/entitlements")
                    .then()
                    .statusCode(200)
                    .body("plan", is("basic"))
                    .body("features.real_time_data", is(true))
                    .body("features.institutional_tools", is(false));
        }

        @Test
        @DisplayName("should get 403 with upgrade details for a higher plan API")
        void shouldRequireUpgrade() {
            login("user");

            as("free").when()
                    .get("/api/analytics/summary")
                    .then()
                    .statusCode(403)
                    .body("code", is("SUBSCRIPTION_REQUIRED"))
                    .body("required_plan", is("basic"))
                    .body("upgrade_url", is("/pricing"));
        }

        @Test
        @DisplayName("should be sent to pricing for a higher plan page")
        void shouldRedirectToPricing() {
            login("user");

            as("free").when()
                    .get("/dashboard/analytics")
                    .then()
                    .statusCode(307)
                    .header("Location", "/pricing?upgrade=true&feature=/dashboard/analytics");
        }

        @Test
        @DisplayName("should be sent away from login")
        void shouldLeaveLogin() {
            login("user");

            as("free").when()
                    .get("/auth/login")
                    .then()
                    .statusCode(307)
                    .header("Location", "/dashboard")
                    .header("Cache-Control", containsString("no-store"));
        }

        @Test
        @DisplayName("should lose access after logging out")
        void shouldLogOut() {
            login("user");

            as("basic").when()
                    .delete("/api/sessions/current")
                    .then()
                    .statusCode(204)
                    .header("Set-Cookie", containsString("Max-Age=0"));

            as("basic").when().get("/api/sessions").then().statusCode(401);
        }
    }

    @Nested
    @DisplayName("Admin endpoints")
    class AdminTests {

        @Test
        @DisplayName("should refuse regular users")
        void shouldRefuseUsers() {
            login("user");

            as("premium").when()
                    .get("/api/admin/sessions/stats")
                    .then()
                    .statusCode(403)
                    .body("code", is("FORBIDDEN"));
        }

        @Test
        @DisplayName("should report statistics to admins")
        void shouldReportStats() {
            login("admin");

            as("premium").when()
                    .get("/api/admin/sessions/stats")
                    .then()
                    .statusCode(200)
                    .body("totalActiveSessions", greaterThanOrEqualTo(1));
        }
    }
}
