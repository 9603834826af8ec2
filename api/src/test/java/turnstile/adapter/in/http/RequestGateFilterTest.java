package turnstile.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import io.vertx.core.MultiMap;
import io.vertx.core.http.Cookie;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import turnstile.core.model.auth.SubscriptionPlan;
import turnstile.core.model.gate.CookieMutation;
import turnstile.core.model.gate.GateDecision;
import turnstile.core.model.gate.GateRequest;
import turnstile.core.port.in.RequestGateUseCase;
import turnstile.core.port.out.StoreUnavailableException;
import turnstile.support.TestConfigs;

@DisplayName("RequestGateFilter")
class RequestGateFilterTest {

    private RequestGateUseCase gate;
    private RequestGateFilter filter;
    private RoutingContext ctx;
    private HttpServerRequest request;
    private HttpServerResponse response;
    private MultiMap requestHeaders;

    @BeforeEach
    void setUp() {
        gate = mock(RequestGateUseCase.class);
        var cookieManager =
                new GateCookieManager(new TestConfigs.TestSessionConfig(), new TestConfigs.TestTokenConfig());
        filter = new RequestGateFilter(gate, cookieManager);

        ctx = mock(RoutingContext.class);
        request = mock(HttpServerRequest.class);
        response = mock(HttpServerResponse.class, RETURNS_SELF);
        requestHeaders = MultiMap.caseInsensitiveMultiMap();

        when(ctx.request()).thenReturn(request);
        when(ctx.response()).thenReturn(response);
        when(ctx.normalizedPath()).thenReturn("/dashboard");
        when(request.headers()).thenReturn(requestHeaders);
        when(request.method()).thenReturn(HttpMethod.GET);
        when(request.path()).thenReturn("/dashboard");
        when(request.cookies()).thenReturn(Set.of());
    }

    private GateRequest runGate(GateDecision decision) {
        var captor = ArgumentCaptor.forClass(GateRequest.class);
        when(gate.evaluate(captor.capture())).thenReturn(Uni.createFrom().item(decision));

        filter.gate(ctx);

        return captor.getValue();
    }

    private JsonObject writtenBody() {
        var captor = ArgumentCaptor.forClass(String.class);
        verify(response).end(captor.capture());
        return new JsonObject(captor.getValue());
    }

    @Nested
    @DisplayName("Request translation")
    class RequestTranslationTests {

        @Test
        @DisplayName("should strip client supplied identity headers before gating")
        void shouldStripSpoofedIdentity() {
            requestHeaders.add("x-user-id", "admin");
            requestHeaders.add("X-User-Subscription-Plan", "premium");
            requestHeaders.add("accept", "text/html");

            var seen = runGate(GateDecision.Continue.unexamined());

            assertFalse(seen.hasHeader("x-user-id"));
            assertFalse(seen.hasHeader("x-user-subscription-plan"));
            assertEquals("text/html", seen.header("accept").orElseThrow());
            assertNull(requestHeaders.get("x-user-id"));
        }

        @Test
        @DisplayName("should pass cookies, query and method to the gate")
        void shouldTranslateRequest() {
            when(request.query()).thenReturn("_rsc=1");
            when(request.cookies()).thenReturn(Set.of(Cookie.cookie("session_id", "sess-1")));

            var seen = runGate(GateDecision.Continue.unexamined());

            assertEquals("GET", seen.method());
            assertEquals("/dashboard", seen.path());
            assertEquals("sess-1", seen.cookie("session_id").orElseThrow());
            assertEquals("_rsc=1", seen.query());
        }
    }

    @Nested
    @DisplayName("Decision handling")
    class DecisionTests {

        @Test
        @DisplayName("should forward identity headers and continue")
        void shouldContinue() {
            var decision = new GateDecision.Continue(
                    true, Map.of("x-user-id", "user-1", "x-user-subscription-plan", "basic"), Map.of(), List.of());

            runGate(decision);

            verify(ctx).next();
            assertEquals("user-1", requestHeaders.get("x-user-id"));
            assertEquals("basic", requestHeaders.get("x-user-subscription-plan"));
        }

        @Test
        @DisplayName("should redirect with 307 and clear cookies")
        void shouldRedirect() {
            var decision = new GateDecision.Redirect(
                    "/auth/login?redirect=/dashboard",
                    Map.of("Cache-Control", "no-store"),
                    List.of(CookieMutation.clear("session_id")));

            runGate(decision);

            verify(response).setStatusCode(307);
            verify(response).putHeader(HttpHeaders.LOCATION, "/auth/login?redirect=/dashboard");
            verify(response).putHeader("Cache-Control", "no-store");
            verify(response).end();
            verify(ctx, never()).next();

            var cookie = ArgumentCaptor.forClass(Cookie.class);
            verify(response).addCookie(cookie.capture());
            assertEquals("session_id", cookie.getValue().getName());
            assertEquals("", cookie.getValue().getValue());
        }

        @Test
        @DisplayName("should answer API callers with JSON 401")
        void shouldRespondUnauthorized() {
            runGate(new GateDecision.Unauthorized("Authentication required", Map.of(), List.of()));

            verify(response).setStatusCode(401);
            var body = writtenBody();
            assertEquals("Authentication required", body.getString("error"));
            assertEquals("UNAUTHORIZED", body.getString("code"));
        }

        @Test
        @DisplayName("should describe the required plan on 403")
        void shouldRespondForbidden() {
            runGate(new GateDecision.Forbidden(
                    SubscriptionPlan.PREMIUM, "/api/institutional", "/pricing", Map.of(), List.of()));

            verify(response).setStatusCode(403);
            var body = writtenBody();
            assertEquals("SUBSCRIPTION_REQUIRED", body.getString("code"));
            assertEquals("premium", body.getString("required_plan"));
            assertEquals("/api/institutional", body.getString("current_path"));
            assertEquals("/pricing", body.getString("upgrade_url"));
        }

        @Test
        @DisplayName("should answer 503 when the store is unavailable")
        void shouldRespondUnavailable() {
            runGate(new GateDecision.Unavailable("Authentication temporarily unavailable", Map.of(), List.of()));

            verify(response).setStatusCode(503);
            assertEquals("STORE_UNAVAILABLE", writtenBody().getString("code"));
        }

        @Test
        @DisplayName("should answer 503 when the gate itself fails")
        void shouldRespondUnavailableOnFailure() {
            when(gate.evaluate(any()))
                    .thenReturn(Uni.createFrom().failure(new StoreUnavailableException("hgetall", "down")));

            filter.gate(ctx);

            verify(response).setStatusCode(503);
            verify(ctx, never()).next();
            assertEquals("STORE_UNAVAILABLE", writtenBody().getString("code"));
        }
    }

    @Nested
    @DisplayName("GateCookieManager")
    class CookieTests {

        private final GateCookieManager cookies =
                new GateCookieManager(new TestConfigs.TestSessionConfig(), new TestConfigs.TestTokenConfig());

        @Test
        @DisplayName("should apply configured attributes to cleared cookies")
        void shouldEncodeClear() {
            var header = cookies.toSetCookieHeader(CookieMutation.clear("access_token"));

            assertTrue(header.startsWith("access_token="));
            assertTrue(header.contains("Max-Age=0"));
            assertTrue(header.contains("Secure"));
            assertTrue(header.contains("HTTPOnly") || header.contains("HttpOnly"));
            assertTrue(header.contains("SameSite=Lax"));
        }

        @Test
        @DisplayName("should leave browser-session cookies without max age")
        void shouldOmitMaxAgeWhenNull() {
            var header = cookies.toSetCookieHeader(new CookieMutation("session_id", "abc", null, "/"));

            assertFalse(header.contains("Max-Age"));
        }

        @Test
        @DisplayName("should set max age in seconds")
        void shouldSetMaxAge() {
            var cookie = cookies.toCookie(CookieMutation.set("session_id", "abc", Duration.ofHours(1)));

            assertEquals(3600L, cookie.getMaxAge());
        }

        @Test
        @DisplayName("should ignore blank credential cookies")
        void shouldIgnoreBlankCookies() {
            when(request.getCookie("session_id")).thenReturn(Cookie.cookie("session_id", " "));
            when(request.getCookie("access_token")).thenReturn(Cookie.cookie("access_token", "jwt"));

            assertTrue(cookies.extractSessionId(request).isEmpty());
            assertEquals("jwt", cookies.extractToken(request).orElseThrow());
        }
    }
}
