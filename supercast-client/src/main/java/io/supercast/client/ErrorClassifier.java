package io.supercast.client;

import io.supercast.core.SupercastException;
import io.supercast.core.SupercastException.ApiConnection;
import io.supercast.core.SupercastException.ApiError;
import io.supercast.core.SupercastResponse;
import io.supercast.http.spi.HttpClientException;
import io.supercast.http.spi.HttpClientResponse;
import io.supercast.json.spi.JsonCodec;
import io.supercast.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns error responses and transport failures into {@link SupercastException}s.
 *
 * <p>Every error is logged before it is returned; callers throw what they get back.
 */
public final class ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);

    private final JsonCodec json;

    public ErrorClassifier(JsonCodec json) {
        this.json = Objects.requireNonNull(json, "json");
    }

    /**
     * Classifies a completed response with a non-2xx status. A body that does not decode
     * yields a generic {@link ApiError} reporting the raw status and body.
     */
    public SupercastException responseError(HttpClientResponse response, RequestContext context) {
        String body = SupercastResponse.bodyAsString(response.body());
        Object data;
        try {
            data = json.readValue(response.body(), Object.class);
        } catch (JsonException e) {
            return generalApiError(response.statusCode(), response.headers(), body, context);
        }

        SupercastResponse resp = new SupercastResponse(response.statusCode(), response.headers(), body, data);
        Map<String, Object> payload = resp.dataAsMap();
        Object message = payload.get("message");
        Object code = payload.get("code");
        String errorCode = code != null ? String.valueOf(code) : String.valueOf(resp.httpStatus());

        log.error("Supercast API error status={} error_code={} error_message={} idempotency_key={}",
                resp.httpStatus(), errorCode, message, context.idempotencyKey());

        return forStatus(resp.httpStatus(), message == null ? null : String.valueOf(message), resp, errorCode);
    }

    /**
     * Error for a response whose body could not be decoded, successful status or not.
     */
    public ApiError generalApiError(int status, Map<String, List<String>> headers, String body,
                                    RequestContext context) {
        return logged(new ApiError("Invalid response object from API: \"" + body + "\" (HTTP response code was " + status + ")",
                new SupercastResponse(status, headers, body, null), String.valueOf(status)), context.idempotencyKey());
    }

    /**
     * Logs an error raised outside the response and transport paths, such as a rejected API key
     * or an interrupted backoff, and returns it.
     *
     * @param idempotencyKey the call's key, or {@code null} when no request was built yet
     */
    public <E extends SupercastException> E logged(E error, String idempotencyKey) {
        log.error("Supercast API error status={} error_code={} error_message={} idempotency_key={}",
                error.httpStatus(), error.code(), error.getMessage(), idempotencyKey);
        return error;
    }

    public static SupercastException forStatus(int status, String message, SupercastResponse response, String code) {
        return switch (status) {
            case 400, 404, 422 -> new SupercastException.InvalidRequest(message, response, code);
            case 401 -> new SupercastException.Authentication(message, response, code);
            case 403 -> new SupercastException.Permission(message, response, code);
            case 429 -> new SupercastException.RateLimit(message, response, code);
            default -> new ApiError(message, response, code);
        };
    }

    /**
     * Classifies a failure that produced no response.
     *
     * @param numRetries retries already made; mentioned in the message when positive
     * @param apiBase the base URL the call targeted, quoted in the timeout message
     */
    public ApiConnection connectionError(HttpClientException failure, RequestContext context,
                                         int numRetries, String apiBase) {
        log.error("Supercast network error error_message={} idempotency_key={}",
                failure.getMessage(), context.idempotencyKey());

        String message = switch (failure.kind()) {
            case CONNECTION_FAILED -> "Unexpected error communicating when trying to connect to Supercast. "
                    + "You may be seeing this message because your DNS is not working.  "
                    + "To check, try running `host supercast.com` from the command line.";
            case TLS_FAILURE -> "Could not establish a secure connection to Supercast, you may need to "
                    + "upgrade your OpenSSL version. To check, try running "
                    + "`openssl s_client -connect api.supercast.com:443` from the command line.";
            case TIMEOUT -> "Could not connect to Supercast (" + apiBase + "). "
                    + "Please check your internet connection and try again. "
                    + "If this problem persists, you should check Supercast's service status at "
                    + "https://status.supercast.com, or let us know at support@supercast.com.";
            case OTHER -> "Unexpected error communicating with Supercast. "
                    + "If this problem persists, let us know at support@supercast.com.";
        };
        if (numRetries > 0) {
            message += " Request was retried " + numRetries + " times.";
        }
        return new ApiConnection(message + "\n\n(Network error: " + failure.getMessage() + ")", failure);
    }
}
