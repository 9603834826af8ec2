package turnstile.adapter.in.http;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.vertx.core.http.Cookie;
import io.vertx.core.http.CookieSameSite;
import io.vertx.core.http.HttpServerRequest;

import turnstile.core.config.SessionConfig;
import turnstile.core.config.TokenConfig;
import turnstile.core.model.gate.CookieMutation;

/**
 * Reads the credential cookies and turns {@link CookieMutation}s into response cookies.
 */
@ApplicationScoped
public class GateCookieManager {

    private final SessionConfig.CookieConfig cookieConfig;
    private final String sessionCookie;
    private final String tokenCookie;

    @Inject
    public GateCookieManager(SessionConfig sessionConfig, TokenConfig tokenConfig) {
        this.cookieConfig = sessionConfig.cookie();
        this.sessionCookie = cookieConfig.name();
        this.tokenCookie = tokenConfig.cookieName();
    }

    /**
     * All request cookies by name. Later duplicates do not override the first value.
     */
    public Map<String, String> readCookies(HttpServerRequest request) {
        var cookies = new HashMap<String, String>();
        for (Cookie cookie : request.cookies()) {
            if (cookie.getValue() != null) {
                cookies.putIfAbsent(cookie.getName(), cookie.getValue());
            }
        }
        return cookies;
    }

    public Optional<String> extractSessionId(HttpServerRequest request) {
        return extract(request, sessionCookie);
    }

    public Optional<String> extractToken(HttpServerRequest request) {
        return extract(request, tokenCookie);
    }

    /**
     * Builds the response cookie for a mutation using the configured attributes.
     */
    public Cookie toCookie(CookieMutation mutation) {
        Cookie cookie = Cookie.cookie(mutation.name(), mutation.value())
                .setPath(mutation.path())
                .setSecure(cookieConfig.secure())
                .setHttpOnly(cookieConfig.httpOnly())
                .setSameSite(parseSameSite(cookieConfig.sameSite()));

        if (mutation.maxAge() != null) {
            cookie.setMaxAge(mutation.maxAge().toSeconds());
        }
        return cookie;
    }

    /**
     * Header value for a mutation, for callers that write {@code Set-Cookie} themselves.
     */
    public String toSetCookieHeader(CookieMutation mutation) {
        return toCookie(mutation).encode();
    }

    public String getSessionCookieName() {
        return sessionCookie;
    }

    public String getTokenCookieName() {
        return tokenCookie;
    }

    private Optional<String> extract(HttpServerRequest request, String name) {
        Cookie cookie = request.getCookie(name);
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    private CookieSameSite parseSameSite(String sameSite) {
        return switch (sameSite.toUpperCase(Locale.ROOT)) {
            case "STRICT" -> CookieSameSite.STRICT;
            case "NONE" -> CookieSameSite.NONE;
            default -> CookieSameSite.LAX;
        };
    }
}
