package io.supercast.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One fully built API request as handed to an {@link HttpClientAdapter}: absolute URI with the
 * encoded query, upper-case method, final header set, form-encoded body bytes and the read
 * timeout for this exchange.
 *
 * <p>Instances are immutable. The request executor builds one per logical call and resends
 * the same instance on every retry.
 */
public final class HttpClientRequest {

    private final URI uri;
    private final String method;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;

    private HttpClientRequest(Builder builder) {
        this.uri = Objects.requireNonNull(builder.uri, "uri");
        this.method = Objects.requireNonNull(builder.method, "method").toUpperCase(Locale.ROOT);
        this.headers = Map.copyOf(builder.headers);
        this.body = builder.body;
        this.timeout = builder.timeout;
    }

    public URI uri() { return uri; }
    public String method() { return method; }
    public Map<String, String> headers() { return headers; }

    /**
     * The encoded body, or {@code null} for methods that carry their parameters in the query.
     */
    public byte[] body() { return body; }

    /**
     * Read timeout for this exchange, or {@code null} to use the adapter's own.
     */
    public Duration timeout() { return timeout; }

    public static Builder builder(URI uri, String method) {
        return new Builder(uri, method);
    }

    public static Builder get(URI uri) { return new Builder(uri, "GET"); }
    public static Builder post(URI uri) { return new Builder(uri, "POST"); }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = uri;
            this.method = method;
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(this);
        }
    }
}
