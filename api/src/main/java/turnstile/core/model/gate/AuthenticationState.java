package turnstile.core.model.gate;

import java.util.List;

import turnstile.core.model.auth.UserClaims;
import turnstile.core.model.session.UserSession;

/**
 * Whether the caller of a request proved who they are.
 */
public sealed interface AuthenticationState {

    /**
     * No usable credential. When a presented credential was rejected the cookies that
     * carried it are listed for clearing.
     *
     * @param reason short reason for logs
     * @param cookiesToClear credential cookies to expire on the response
     */
    record Anonymous(String reason, List<CookieMutation> cookiesToClear) implements AuthenticationState {
        public Anonymous {
            cookiesToClear = cookiesToClear == null ? List.of() : List.copyOf(cookiesToClear);
        }

        public static Anonymous noCredentials() {
            return new Anonymous("no credentials", List.of());
        }
    }

    /**
     * Valid token backed by a live session owned by the token subject.
     */
    record Authenticated(String sessionId, UserSession session, UserClaims claims) implements AuthenticationState {}

    /**
     * The session store could not be reached, so authentication is undecided.
     */
    record StoreUnavailable(String reason) implements AuthenticationState {}
}
