package io.supercast.http.spi;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical {status, headers, body} shape every {@link HttpClientAdapter} normalizes its
 * library's response into.
 *
 * @param statusCode the status code (e.g., 200, 404, 500)
 * @param headers all response headers
 * @param body the body bytes, never null
 */
public record HttpClientResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {
    public HttpClientResponse {
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    public Optional<String> header(String name) {
        String target = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().toLowerCase(Locale.ROOT).equals(target)
                    && e.getValue() != null && !e.getValue().isEmpty()) {
                return Optional.ofNullable(e.getValue().get(0));
            }
        }
        return Optional.empty();
    }
}
