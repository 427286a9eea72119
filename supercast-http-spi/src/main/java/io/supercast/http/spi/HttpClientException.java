package io.supercast.http.spi;

import java.util.Objects;

/**
 * Exception thrown when an HTTP operation fails without producing a response.
 * Wraps underlying implementation-specific exceptions.
 */
public class HttpClientException extends Exception {

    private final TransportFailure kind;

    public HttpClientException(String message, Throwable cause) {
        this(TransportFailure.OTHER, message, cause);
    }

    public HttpClientException(Throwable cause) {
        this(TransportFailure.OTHER, String.valueOf(cause), cause);
    }

    protected HttpClientException(TransportFailure kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TransportFailure kind() {
        return kind;
    }
}
