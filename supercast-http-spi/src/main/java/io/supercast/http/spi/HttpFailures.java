package io.supercast.http.spi;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

/**
 * Maps library I/O exceptions onto {@link TransportFailure} kinds so every adapter reports
 * failures the same way.
 */
public final class HttpFailures {

    private HttpFailures() {
    }

    public static HttpClientException map(IOException e) {
        if (e instanceof java.net.http.HttpTimeoutException
                || e instanceof SocketTimeoutException) {
            return new HttpTimeoutException(e);
        }
        if (e instanceof SSLException) {
            return new HttpTlsException(e);
        }
        if (e instanceof ConnectException
                || e instanceof NoRouteToHostException
                || e instanceof UnknownHostException
                || e instanceof SocketException) {
            return new HttpConnectException(e);
        }
        // OkHttp reports call timeouts as a bare InterruptedIOException
        if (e instanceof InterruptedIOException && "timeout".equals(e.getMessage())) {
            return new HttpTimeoutException(e);
        }
        Throwable cause = e.getCause();
        if (cause instanceof IOException && cause != e) {
            HttpClientException mapped = map((IOException) cause);
            if (mapped.kind() != TransportFailure.OTHER) {
                return rewrap(mapped.kind(), e);
            }
        }
        return new HttpClientException(e);
    }

    public static HttpClientException interrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        return new HttpClientException("Request interrupted", e);
    }

    private static HttpClientException rewrap(TransportFailure kind, IOException e) {
        switch (kind) {
            case TIMEOUT:
                return new HttpTimeoutException(e);
            case TLS_FAILURE:
                return new HttpTlsException(e);
            case CONNECTION_FAILED:
                return new HttpConnectException(e);
            default:
                return new HttpClientException(e);
        }
    }
}
