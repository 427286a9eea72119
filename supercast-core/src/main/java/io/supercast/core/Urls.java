package io.supercast.core;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal helpers for splitting a request path from its query string.
 */
public final class Urls {
    private Urls() {}

    /**
     * Returns {@code path} without its query string and fragment.
     */
    public static String pathOnly(String path) {
        if (path == null) return "";
        int cut = indexOfAny(path, '?', '#');
        return cut < 0 ? path : path.substring(0, cut);
    }

    /**
     * Returns the raw query string of {@code path}, or {@code null} if it has none.
     */
    public static String rawQuery(String path) {
        if (path == null) return null;
        int q = path.indexOf('?');
        if (q < 0) return null;
        int hash = path.indexOf('#', q);
        return hash < 0 ? path.substring(q + 1) : path.substring(q + 1, hash);
    }

    /**
     * Decodes a form-encoded query string into an insertion-ordered map. A key without
     * {@code =} maps to the empty string; the last occurrence of a repeated key wins.
     */
    public static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> out = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) return out;
        for (String part : rawQuery.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            if (eq < 0) {
                out.put(decode(part), "");
            } else {
                out.put(decode(part.substring(0, eq)), decode(part.substring(eq + 1)));
            }
        }
        return out;
    }

    /**
     * Percent-encodes one path segment. Unlike form encoding, a space becomes {@code %20}
     * and {@code /} is escaped, so the value stays a single segment.
     */
    public static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) return i;
        }
        return -1;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
