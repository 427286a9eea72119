package io.supercast.core;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal helpers for case-insensitive header lookup and header name normalization.
 */
public final class Headers {
    private Headers() {}

    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getKey() == null) continue;
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                Iterable<String> vals = e.getValue();
                if (vals == null) return Optional.empty();
                for (String v : vals) {
                    if (v != null) return Optional.of(v);
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Canonicalizes a header name to {@code Title-Case}, e.g. {@code idempotency-key}
     * becomes {@code Idempotency-Key}.
     *
     * @param name the header name as supplied by a caller
     * @return the canonical name
     */
    public static String normalizeName(String name) {
        String[] parts = name.trim().split("-", -1);
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append('-');
            String part = parts[i];
            if (part.isEmpty()) continue;
            sb.append(part.substring(0, 1).toUpperCase(Locale.ROOT))
                    .append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /**
     * Returns a copy of {@code headers} with every name canonicalized. Entries with a
     * {@code null} name or value are dropped; later entries win on a name collision.
     */
    public static Map<String, String> normalize(Map<String, String> headers) {
        Map<String, String> out = new LinkedHashMap<>();
        if (headers == null) return out;
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            out.put(normalizeName(e.getKey()), e.getValue());
        }
        return out;
    }
}
