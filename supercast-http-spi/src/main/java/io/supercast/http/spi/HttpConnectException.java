package io.supercast.http.spi;

/**
 * Exception thrown when an HTTP request cannot be connected (refused, reset or unresolvable host).
 * Failures of this kind are transient often enough to be retried.
 */
public class HttpConnectException extends HttpClientException {

    public HttpConnectException(String message, Throwable cause) {
        super(TransportFailure.CONNECTION_FAILED, message, cause);
    }

    public HttpConnectException(Throwable cause) {
        super(TransportFailure.CONNECTION_FAILED, String.valueOf(cause), cause);
    }
}
