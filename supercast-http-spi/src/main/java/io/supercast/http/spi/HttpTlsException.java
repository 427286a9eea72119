package io.supercast.http.spi;

/**
 * Exception thrown when an HTTP request fails during the TLS handshake or certificate verification.
 */
public class HttpTlsException extends HttpClientException {

    public HttpTlsException(String message, Throwable cause) {
        super(TransportFailure.TLS_FAILURE, message, cause);
    }

    public HttpTlsException(Throwable cause) {
        super(TransportFailure.TLS_FAILURE, String.valueOf(cause), cause);
    }
}
