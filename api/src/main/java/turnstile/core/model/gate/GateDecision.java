package turnstile.core.model.gate;

import java.util.List;
import java.util.Map;

import turnstile.core.model.auth.SubscriptionPlan;

/**
 * Terminal outcome of gating one request.
 *
 * <p>Every decision carries the headers and cookie mutations the HTTP adapter must
 * apply to the outgoing response.
 */
public sealed interface GateDecision {

    Map<String, String> responseHeaders();

    List<CookieMutation> cookies();

    /**
     * Let the request through.
     *
     * @param examined false when the request bypassed the gate entirely
     * @param forwardHeaders headers to set on the forwarded request
     */
    record Continue(
            boolean examined,
            Map<String, String> forwardHeaders,
            Map<String, String> responseHeaders,
            List<CookieMutation> cookies)
            implements GateDecision {
        public Continue {
            forwardHeaders = Map.copyOf(forwardHeaders);
            responseHeaders = Map.copyOf(responseHeaders);
            cookies = List.copyOf(cookies);
        }

        public static Continue unexamined() {
            return new Continue(false, Map.of(), Map.of(), List.of());
        }
    }

    /**
     * Send the caller elsewhere (HTTP 307).
     */
    record Redirect(String location, Map<String, String> responseHeaders, List<CookieMutation> cookies)
            implements GateDecision {
        public Redirect {
            responseHeaders = Map.copyOf(responseHeaders);
            cookies = List.copyOf(cookies);
        }
    }

    /**
     * JSON 401 for API callers without a valid session.
     */
    record Unauthorized(String message, Map<String, String> responseHeaders, List<CookieMutation> cookies)
            implements GateDecision {
        public Unauthorized {
            responseHeaders = Map.copyOf(responseHeaders);
            cookies = List.copyOf(cookies);
        }
    }

    /**
     * JSON 403 for API callers whose plan is too low.
     */
    record Forbidden(
            SubscriptionPlan requiredPlan,
            String currentPath,
            String upgradeUrl,
            Map<String, String> responseHeaders,
            List<CookieMutation> cookies)
            implements GateDecision {
        public Forbidden {
            responseHeaders = Map.copyOf(responseHeaders);
            cookies = List.copyOf(cookies);
        }
    }

    /**
     * JSON 503 when the session store failed on a route that needs it.
     */
    record Unavailable(String message, Map<String, String> responseHeaders, List<CookieMutation> cookies)
            implements GateDecision {
        public Unavailable {
            responseHeaders = Map.copyOf(responseHeaders);
            cookies = List.copyOf(cookies);
        }
    }
}
