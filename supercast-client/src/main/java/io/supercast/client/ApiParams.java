package io.supercast.client;

import io.supercast.client.resource.ApiResource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter pre-processing shared by every call.
 */
public final class ApiParams {
    private ApiParams() {}

    /**
     * Returns a copy of {@code params} in which every {@link ApiResource}, at any depth inside
     * maps and lists, is replaced by its id.
     */
    public static Map<String, Object> objectsToIds(Map<String, ?> params) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (params == null) {
            return out;
        }
        params.forEach((k, v) -> out.put(k, toId(v)));
        return out;
    }

    private static Object toId(Object value) {
        if (value instanceof ApiResource) {
            return ((ApiResource) value).id();
        }
        if (value instanceof Map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> out.put(k, toId(v)));
            return out;
        }
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object item : (List<?>) value) {
                out.add(toId(item));
            }
            return out;
        }
        return value;
    }
}
