package io.supercast.http.spi;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThat;

class HttpFailuresTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void timeouts() {
        assertThat(HttpFailures.map(new SocketTimeoutException("read timed out")).kind())
                .isEqualTo(TransportFailure.TIMEOUT);
        assertThat(HttpFailures.map(new java.net.http.HttpTimeoutException("request timed out")).kind())
                .isEqualTo(TransportFailure.TIMEOUT);
        assertThat(HttpFailures.map(new InterruptedIOException("timeout")).kind())
                .isEqualTo(TransportFailure.TIMEOUT);
    }

    @Test
    void connectionFailures() {
        assertThat(HttpFailures.map(new ConnectException("Connection refused")))
                .isInstanceOf(HttpConnectException.class);
        assertThat(HttpFailures.map(new UnknownHostException("api.supercast.invalid")).kind())
                .isEqualTo(TransportFailure.CONNECTION_FAILED);
    }

    @Test
    void tlsFailure() {
        assertThat(HttpFailures.map(new SSLHandshakeException("PKIX path building failed")))
                .isInstanceOf(HttpTlsException.class);
    }

    @Test
    void wrappedCauseIsClassified() {
        HttpClientException e = HttpFailures.map(new IOException("wrapped", new ConnectException("refused")));

        assertThat(e.kind()).isEqualTo(TransportFailure.CONNECTION_FAILED);
        assertThat(e.getCause()).hasMessage("wrapped");
    }

    @Test
    void anythingElseIsOther() {
        assertThat(HttpFailures.map(new IOException("stream was reset")).kind())
                .isEqualTo(TransportFailure.OTHER);
    }

    @Test
    void interruptionRestoresFlag() {
        HttpClientException e = HttpFailures.interrupted(new InterruptedException());

        assertThat(e.kind()).isEqualTo(TransportFailure.OTHER);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
