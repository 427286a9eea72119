package io.supercast.core;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one HTTP exchange with the Supercast API.
 *
 * <p>{@code data} is the decoded JSON body: a {@code Map}, a {@code List} or a scalar.
 * It is {@code null} when the body could not be decoded.
 *
 * @param httpStatus the HTTP status code
 * @param httpHeaders the response headers
 * @param httpBody the raw response body
 * @param data the decoded body
 */
public record SupercastResponse(
        int httpStatus,
        Map<String, List<String>> httpHeaders,
        String httpBody,
        Object data
) {
    public SupercastResponse {
        httpHeaders = httpHeaders == null ? Map.of() : Map.copyOf(httpHeaders);
        if (httpBody == null) {
            httpBody = "";
        }
    }

    public static String bodyAsString(byte[] body) {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Returns the first value of the named header (case-insensitive).
     */
    public Optional<String> header(String name) {
        return Headers.firstValue(httpHeaders, name);
    }

    /**
     * Returns the decoded body as a map, or an empty map when the body is not a JSON object.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> dataAsMap() {
        if (data instanceof Map) {
            return (Map<String, Object>) data;
        }
        return Map.of();
    }
}
