package io.supercast.http.spi;

/**
 * Closed set of reasons a request can fail without producing a response.
 */
public enum TransportFailure {
    /** Connect or read timeout. */
    TIMEOUT,
    /** Connection refused or reset, or the host could not be resolved. */
    CONNECTION_FAILED,
    /** TLS handshake or certificate verification failure. */
    TLS_FAILURE,
    /** Anything else, including interruption of the calling thread. */
    OTHER
}
