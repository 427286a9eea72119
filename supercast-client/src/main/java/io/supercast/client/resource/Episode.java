package io.supercast.client.resource;

import io.supercast.client.RequestOptions;

import java.util.Map;

/**
 * A podcast episode ({@code /episodes}).
 */
public final class Episode extends ApiResource {

    public static final String RESOURCE_PATH = "/episodes";

    Episode(Map<String, Object> values) {
        super(values);
    }

    public static Episode retrieve(Object id) {
        return retrieve(id, RequestOptions.none());
    }

    public static Episode retrieve(Object id, RequestOptions options) {
        return new Episode(request("GET", instancePath(RESOURCE_PATH, id), Map.of(), options).dataAsMap());
    }

    public static Episode create(Map<String, ?> params) {
        return create(params, RequestOptions.none());
    }

    public static Episode create(Map<String, ?> params, RequestOptions options) {
        return new Episode(request("POST", RESOURCE_PATH, params, options).dataAsMap());
    }

    public static Episode update(Object id, Map<String, ?> params) {
        return update(id, params, RequestOptions.none());
    }

    public static Episode update(Object id, Map<String, ?> params, RequestOptions options) {
        return new Episode(request("PATCH", instancePath(RESOURCE_PATH, id), params, options).dataAsMap());
    }

    public static Episode delete(Object id) {
        return delete(id, RequestOptions.none());
    }

    /**
     * Deletes the episode. The API answers with the deleted object, or with no content.
     */
    public static Episode delete(Object id, RequestOptions options) {
        return new Episode(request("DELETE", instancePath(RESOURCE_PATH, id), Map.of(), options).dataAsMap());
    }

    public String title() {
        Object title = get("title");
        return title == null ? null : String.valueOf(title);
    }
}
