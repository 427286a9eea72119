package io.supercast.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call overrides. A {@code null} field falls back to the configuration in effect when the
 * call starts.
 *
 * @param apiBase base URL override
 * @param apiVersion API version override
 * @param apiKey API key override
 * @param headers extra request headers; they win over the defaults
 */
public record RequestOptions(String apiBase, String apiVersion, String apiKey, Map<String, String> headers) {

    private static final RequestOptions NONE = new RequestOptions(null, null, null, Map.of());

    public RequestOptions {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static RequestOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String apiBase;
        private String apiVersion;
        private String apiKey;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {}

        public Builder apiBase(String apiBase) {
            this.apiBase = apiBase;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(apiBase, apiVersion, apiKey, headers);
        }
    }
}
