package turnstile.core.model.gate;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Transport-neutral view of an inbound HTTP request.
 *
 * @param method HTTP method, upper case
 * @param path normalized request path
 * @param query raw query string without the leading {@code ?}, may be null
 * @param headers request headers with lower-cased names (first value only)
 * @param cookies request cookies by name
 */
public record GateRequest(
        String method, String path, String query, Map<String, String> headers, Map<String, String> cookies) {

    public GateRequest {
        method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        path = path == null || path.isEmpty() ? "/" : path;
        headers = lowerCaseKeys(headers);
        cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
    }

    public static GateRequest get(String path) {
        return new GateRequest("GET", path, null, Map.of(), Map.of());
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean hasHeader(String name) {
        return headers.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Optional<String> cookie(String name) {
        var value = cookies.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Returns true when the query string carries the parameter, with or without a value.
     */
    public boolean hasQueryParameter(String name) {
        if (query == null || query.isEmpty()) {
            return false;
        }
        for (var pair : query.split("&")) {
            var eq = pair.indexOf('=');
            var key = eq < 0 ? pair : pair.substring(0, eq);
            if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Extracts the bearer token from the {@code Authorization} header.
     */
    public Optional<String> bearerToken() {
        return header("authorization")
                .filter(h -> h.regionMatches(true, 0, "Bearer ", 0, 7))
                .map(h -> h.substring(7).trim())
                .filter(t -> !t.isEmpty());
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        var result = new HashMap<String, String>();
        source.forEach((k, v) -> {
            if (k != null && v != null) {
                result.putIfAbsent(k.toLowerCase(Locale.ROOT), v);
            }
        });
        return Map.copyOf(result);
    }
}
