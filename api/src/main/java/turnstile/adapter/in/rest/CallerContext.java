package turnstile.adapter.in.rest;

import java.util.Optional;

import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;

import turnstile.core.model.auth.SubscriptionPlan;
import turnstile.core.model.auth.SubscriptionStatus;
import turnstile.core.model.auth.UserClaims;
import turnstile.core.service.gate.RequestGateService;

/**
 * The authenticated caller as established by the request gate.
 *
 * <p>Only the gate sets the identity headers; client-supplied copies are stripped
 * before the gate runs.
 */
record CallerContext(String userId, String sessionId, UserClaims claims) {

    static Optional<CallerContext> from(HttpHeaders headers, String sessionCookieName) {
        var userId = headers.getHeaderString(RequestGateService.USER_ID_HEADER);
        Cookie sessionCookie = headers.getCookies().get(sessionCookieName);
        if (userId == null
                || userId.isBlank()
                || sessionCookie == null
                || sessionCookie.getValue() == null
                || sessionCookie.getValue().isBlank()) {
            return Optional.empty();
        }
        var plan = Optional.ofNullable(headers.getHeaderString(RequestGateService.PLAN_HEADER))
                .flatMap(SubscriptionPlan::fromWireValue)
                .orElse(SubscriptionPlan.FREE);
        var status = Optional.ofNullable(headers.getHeaderString(RequestGateService.STATUS_HEADER))
                .flatMap(SubscriptionStatus::fromWireValue)
                .orElse(SubscriptionStatus.ACTIVE);
        return Optional.of(
                new CallerContext(userId, sessionCookie.getValue(), new UserClaims(userId, plan, status, null)));
    }
}
