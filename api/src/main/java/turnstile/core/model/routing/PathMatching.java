package turnstile.core.model.routing;

/**
 * Segment-aware path comparison shared by the route table and the classifier.
 */
public final class PathMatching {

    private PathMatching() {}

    /**
     * Returns true when {@code path} equals {@code prefix} or lies below it.
     *
     * <p>{@code /dashboard} matches {@code /dashboard} and {@code /dashboard/x},
     * never {@code /dashboardx}. The root prefix {@code /} only matches itself.
     */
    public static boolean isUnder(String path, String prefix) {
        if (path == null || prefix == null) {
            return false;
        }
        if ("/".equals(prefix)) {
            return "/".equals(path);
        }
        if (!path.startsWith(prefix)) {
            return false;
        }
        return path.length() == prefix.length() || path.charAt(prefix.length()) == '/';
    }

    /**
     * Drops {@code ;name=value} matrix parameters from every segment, the way JAX-RS
     * does before routing, so {@code /api/institutional;v=1} is gated like
     * {@code /api/institutional}.
     */
    public static String withoutMatrixParameters(String path) {
        if (path == null || path.indexOf(';') < 0) {
            return path;
        }
        var result = new StringBuilder(path.length());
        var inParameters = false;
        for (int i = 0; i < path.length(); i++) {
            var c = path.charAt(i);
            if (c == '/') {
                inParameters = false;
            } else if (c == ';') {
                inParameters = true;
            }
            if (!inParameters) {
                result.append(c);
            }
        }
        return result.length() == 0 ? "/" : result.toString();
    }

    public static String stripTrailingSlash(String path) {
        if (path.length() > 1 && path.endsWith("/")) {
            return path.substring(0, path.length() - 1);
        }
        return path;
    }
}
