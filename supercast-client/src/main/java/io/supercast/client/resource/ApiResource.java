package io.supercast.client.resource;

import io.supercast.client.ClientScope;
import io.supercast.client.RequestOptions;
import io.supercast.core.SupercastResponse;
import io.supercast.core.Urls;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for API objects: an id plus the decoded fields the API returned.
 *
 * <p>Calls go through {@link ClientScope#active()}, so wrapping them in
 * {@code client.request(...)} routes them through that client.
 */
public abstract class ApiResource {

    private final String id;
    private final Map<String, Object> values;

    protected ApiResource(Map<String, Object> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (values != null) {
            copy.putAll(values);
        }
        this.values = Collections.unmodifiableMap(copy);
        Object rawId = this.values.get("id");
        this.id = rawId == null ? null : String.valueOf(rawId);
    }

    public String id() {
        return id;
    }

    public Map<String, Object> values() {
        return values;
    }

    public Object get(String key) {
        return values.get(key);
    }

    protected static SupercastResponse request(String method, String path, Map<String, ?> params, RequestOptions options) {
        return ClientScope.active().executeRequest(method, path, params, options);
    }

    protected static String instancePath(String collectionPath, Object id) {
        Objects.requireNonNull(id, "id");
        String value = id instanceof ApiResource ? ((ApiResource) id).id() : String.valueOf(id);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Resource id must not be blank");
        }
        return collectionPath + "/" + Urls.encodePathSegment(value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + values;
    }
}
