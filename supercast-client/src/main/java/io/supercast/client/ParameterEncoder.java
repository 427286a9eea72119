package io.supercast.client;

import java.lang.reflect.Array;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Form-encodes nested parameters using bracket notation: {@code a[b]=1} for nested maps and
 * {@code a[0]=x} for sequences, with the index always written.
 *
 * <p>An encoder lives for one logical call. The request body or query is encoded once for the
 * transport and again for logging; the second call returns the cached string for the same
 * map instance. Instances are not thread-safe.
 */
public final class ParameterEncoder {

    private final Map<Object, String> cache = new IdentityHashMap<>();

    public String encode(Map<String, ?> params) {
        if (params == null) {
            return "";
        }
        String cached = cache.get(params);
        if (cached != null) {
            return cached;
        }
        List<String> pairs = new ArrayList<>();
        flatten(null, params, pairs);
        String encoded = String.join("&", pairs);
        cache.put(params, encoded);
        return encoded;
    }

    /**
     * Always throws; this encoder is write-only.
     */
    public Map<String, Object> decode(String encoded) {
        throw new UnsupportedOperationException(getClass().getName() + " does not implement decode");
    }

    private static void flatten(String prefix, Object value, List<String> out) {
        if (value instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                String key = String.valueOf(e.getKey());
                flatten(prefix == null ? key : prefix + "[" + key + "]", e.getValue(), out);
            }
        } else if (value instanceof Iterable) {
            int i = 0;
            for (Object item : (Iterable<?>) value) {
                flatten(prefix + "[" + i++ + "]", item, out);
            }
        } else if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                flatten(prefix + "[" + i + "]", Array.get(value, i), out);
            }
        } else {
            out.add(escape(prefix) + "=" + escape(value == null ? "" : String.valueOf(value)));
        }
    }

    static String escape(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8)
                .replace("%5B", "[")
                .replace("%5D", "]");
    }
}
