package io.supercast.client;

import io.supercast.core.Headers;
import io.supercast.core.Protocol;

import java.util.Map;

/**
 * What the executor knows about one logical call, used only for logging. A new copy is
 * derived whenever a response brings more authoritative values, so a record already handed
 * to a log statement for an earlier attempt never changes.
 *
 * @param account the account the call ran against, when known
 * @param apiKey the API key used
 * @param apiVersion the API version requested, or the one the server reported
 * @param body the encoded request body, or {@code null}
 * @param method the HTTP method
 * @param path the request path without its query string
 * @param queryParams the encoded query string, or {@code null}
 * @param idempotencyKey the idempotency key sent with the call, if any
 */
public record RequestContext(
        String account,
        String apiKey,
        String apiVersion,
        String body,
        String method,
        String path,
        String queryParams,
        String idempotencyKey
) {

    /**
     * Builds the context for an outgoing request, taking account, version and idempotency key
     * from the request headers.
     */
    public static RequestContext forRequest(String method, String path, String apiKey,
                                            Map<String, String> requestHeaders, String body, String queryParams) {
        return new RequestContext(
                requestHeaders.get(Protocol.H_ACCOUNT),
                apiKey,
                requestHeaders.get(Protocol.H_VERSION),
                body,
                method,
                path,
                queryParams,
                requestHeaders.get(Protocol.H_IDEMPOTENCY_KEY));
    }

    /**
     * Returns a copy whose account, API version and idempotency key are replaced by the values
     * the response carried. Values missing from the response are kept.
     *
     * @param headers the response headers, or {@code null} when there was no response
     * @return the derived context, or this context when {@code headers} is {@code null}
     */
    public RequestContext deriveFromResponseHeaders(Map<String, ? extends Iterable<String>> headers) {
        if (headers == null) {
            return this;
        }
        return new RequestContext(
                Headers.firstValue(headers, Protocol.H_ACCOUNT).orElse(account),
                apiKey,
                Headers.firstValue(headers, Protocol.H_VERSION).orElse(apiVersion),
                body,
                method,
                path,
                queryParams,
                Headers.firstValue(headers, Protocol.H_IDEMPOTENCY_KEY).orElse(idempotencyKey));
    }
}
