package io.supercast.core;

import java.util.List;
import java.util.Map;

/**
 * Base class for every error raised by the Supercast bindings.
 *
 * <p>Two branches exist. {@link ApiError} and its subclasses describe an HTTP exchange that
 * completed with an error status or an unusable body, or a request rejected locally before
 * it was sent. {@link ApiConnection} describes a transport failure that never produced a
 * response. Errors built from a response keep it available through {@link #response()}.
 */
public abstract class SupercastException extends RuntimeException {

    private final SupercastResponse response;
    private final String code;

    protected SupercastException(String message) {
        this(message, null, null, null);
    }

    protected SupercastException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    protected SupercastException(String message, SupercastResponse response, String code) {
        this(message, response, code, null);
    }

    private SupercastException(String message, SupercastResponse response, String code, Throwable cause) {
        super(message, cause);
        this.response = response;
        this.code = code;
    }

    /**
     * The response that triggered this error, or {@code null} for local and connection errors.
     */
    public SupercastResponse response() {
        return response;
    }

    public Integer httpStatus() {
        return response == null ? null : response.httpStatus();
    }

    public Map<String, List<String>> httpHeaders() {
        return response == null ? Map.of() : response.httpHeaders();
    }

    public String httpBody() {
        return response == null ? null : response.httpBody();
    }

    /**
     * The decoded error payload, or {@code null} when none was decoded.
     */
    public Object jsonBody() {
        return response == null ? null : response.data();
    }

    /**
     * Stable error code: the payload's {@code code} field when present, otherwise the HTTP status.
     */
    public String code() {
        return code;
    }

    @Override
    public String toString() {
        String prefix = httpStatus() == null ? "" : "(Status " + httpStatus() + ") ";
        return getClass().getName() + ": " + prefix + getMessage();
    }

    /**
     * Raised for an HTTP error status without a more specific kind, or for a body that
     * could not be decoded.
     */
    public static class ApiError extends SupercastException {
        public ApiError(String message) {
            super(message);
        }

        public ApiError(String message, SupercastResponse response, String code) {
            super(message, response, code);
        }
    }

    /**
     * Raised for HTTP 400, 404 and 422.
     */
    public static class InvalidRequest extends ApiError {
        public InvalidRequest(String message, SupercastResponse response, String code) {
            super(message, response, code);
        }
    }

    /**
     * Raised for HTTP 401, or locally when no usable API key is configured.
     */
    public static class Authentication extends ApiError {
        public Authentication(String message) {
            super(message);
        }

        public Authentication(String message, SupercastResponse response, String code) {
            super(message, response, code);
        }
    }

    /**
     * Raised for HTTP 403.
     */
    public static class Permission extends ApiError {
        public Permission(String message, SupercastResponse response, String code) {
            super(message, response, code);
        }
    }

    /**
     * Raised for HTTP 429.
     */
    public static class RateLimit extends ApiError {
        public RateLimit(String message, SupercastResponse response, String code) {
            super(message, response, code);
        }
    }

    /**
     * Raised when the transport failed (timeout, refused or reset connection, TLS failure)
     * and the retry budget, if any, was exhausted.
     */
    public static class ApiConnection extends SupercastException {
        public ApiConnection(String message) {
            super(message);
        }

        public ApiConnection(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
