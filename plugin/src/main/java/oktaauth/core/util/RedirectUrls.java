package oktaauth.core.util;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Map;

/**
 * Resolution of redirect targets against the gateway's external base URL.
 *
 * <p>Absolute URLs are kept as given. Relative URLs are joined to the base
 * by appending their path to the base path and merging both query strings.
 */
public final class RedirectUrls {

    private RedirectUrls() {}

    /**
     * Pick the redirect target for a request.
     *
     * @param redirect The {@code redirect} query parameter, may be null
     * @param defaultUrl Used when {@code redirect} is absent, blank or unparseable
     * @param baseUrl Base for relative values; null keeps relative values relative
     * @return The resolved target
     */
    public static String determine(String redirect, String defaultUrl, String baseUrl) {
        if (redirect != null && !redirect.isBlank() && isSupported(redirect)) {
            return absolute(redirect, baseUrl);
        }
        return absolute(defaultUrl, baseUrl);
    }

    /**
     * Check whether a value parses as an http(s) or relative URL.
     */
    public static boolean isSupported(String url) {
        try {
            parse(url);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static String absolute(String url, String baseUrl) {
        return absolute(url, baseUrl, Map.of());
    }

    /**
     * Resolve a URL against a base and add query parameters.
     *
     * @param url Absolute or relative URL
     * @param baseUrl Base for relative URLs, may be null
     * @param queries Parameters to add; they replace existing ones of the same name
     * @return The resolved URL
     * @throws IllegalArgumentException if {@code url} is not a valid http(s) or relative URL
     */
    public static String absolute(String url, String baseUrl, Map<String, String> queries) {
        final var trimmed = url.trim();
        final var uri = parse(trimmed);
        if (uri.getScheme() != null || uri.getRawAuthority() != null || baseUrl == null || baseUrl.isBlank()) {
            return withQuery(trimmed, queries);
        }
        return withQuery(join(URI.create(baseUrl.trim()), uri), queries);
    }

    /**
     * Add query parameters to a URL, replacing parameters of the same name.
     */
    public static String withQuery(String url, Map<String, String> queries) {
        if (queries.isEmpty()) {
            return url;
        }
        var remainder = url;
        var fragment = "";
        final var hash = remainder.indexOf('#');
        if (hash >= 0) {
            fragment = remainder.substring(hash);
            remainder = remainder.substring(0, hash);
        }
        var query = "";
        final var questionMark = remainder.indexOf('?');
        if (questionMark >= 0) {
            query = remainder.substring(questionMark + 1);
            remainder = remainder.substring(0, questionMark);
        }

        final var pairs = new ArrayList<String>();
        for (final var pair : query.split("&")) {
            if (!pair.isEmpty() && !queries.containsKey(decode(pair.split("=", 2)[0]))) {
                pairs.add(pair);
            }
        }
        queries.forEach((name, value) -> pairs.add(encode(name) + "=" + encode(value)));
        return remainder + "?" + String.join("&", pairs) + fragment;
    }

    private static URI parse(String url) {
        final var uri = URI.create(url.trim());
        if (uri.getScheme() != null
                && !"http".equalsIgnoreCase(uri.getScheme())
                && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("Unsupported redirect scheme: " + uri.getScheme());
        }
        return uri;
    }

    private static String join(URI base, URI relative) {
        var basePath = base.getRawPath() == null ? "" : base.getRawPath();
        if (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        var path = relative.getRawPath() == null ? "" : relative.getRawPath();
        if (!path.isEmpty() && !path.startsWith("/")) {
            path = "/" + path;
        }
        var joinedPath = basePath + path;
        if (joinedPath.isEmpty()) {
            joinedPath = "/";
        }

        final var result = new StringBuilder()
                .append(base.getScheme())
                .append("://")
                .append(base.getRawAuthority())
                .append(joinedPath);
        final var query = mergeQueries(base.getRawQuery(), relative.getRawQuery());
        if (!query.isEmpty()) {
            result.append('?').append(query);
        }
        if (relative.getRawFragment() != null) {
            result.append('#').append(relative.getRawFragment());
        }
        return result.toString();
    }

    private static String mergeQueries(String first, String second) {
        if (first == null || first.isEmpty()) {
            return second == null ? "" : second;
        }
        if (second == null || second.isEmpty()) {
            return first;
        }
        return first + "&" + second;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
