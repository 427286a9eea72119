package io.supercast.client;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.supercast.core.SupercastException;
import io.supercast.core.SupercastException.ApiConnection;
import io.supercast.core.SupercastException.ApiError;
import io.supercast.http.spi.HttpClientException;
import io.supercast.http.spi.HttpClientResponse;
import io.supercast.http.spi.HttpConnectException;
import io.supercast.http.spi.HttpTimeoutException;
import io.supercast.http.spi.HttpTlsException;
import io.supercast.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier(new JacksonJsonCodec());
    private final RequestContext context = new RequestContext(null, "sk_test", "v1", null, "GET",
            "/episodes/1", null, "idem-1");

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        logger = (Logger) LoggerFactory.getLogger(ErrorClassifier.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
        appender.stop();
    }

    @Test
    void statusTableIsExhaustive() {
        Map<Integer, Class<? extends SupercastException>> table = new LinkedHashMap<>();
        table.put(400, SupercastException.InvalidRequest.class);
        table.put(404, SupercastException.InvalidRequest.class);
        table.put(422, SupercastException.InvalidRequest.class);
        table.put(401, SupercastException.Authentication.class);
        table.put(403, SupercastException.Permission.class);
        table.put(429, SupercastException.RateLimit.class);
        table.put(500, ApiError.class);
        table.put(502, ApiError.class);
        table.put(418, ApiError.class);

        table.forEach((status, kind) -> {
            SupercastException e = classifier.responseError(response(status, "{\"message\":\"m\"}"), context);

            assertThat(e).as("status %d", status).isExactlyInstanceOf(kind);
            assertThat(e).isInstanceOf(ApiError.class);
            assertThat(e.httpStatus()).isEqualTo(status);
        });
    }

    @Test
    void messageAndPayloadComeFromBody() {
        SupercastException e = classifier.responseError(
                response(422, "{\"message\":\"bad\",\"errors\":{\"title\":[\"blank\"]}}"), context);

        assertThat(e.getMessage()).isEqualTo("bad");
        assertThat(e.httpBody()).contains("\"errors\"");
        assertThat(e.jsonBody()).isInstanceOf(Map.class);
        assertThat(e.code()).isEqualTo("422");
        assertThat(e.response()).isNotNull();
    }

    @Test
    void payloadCodeWinsOverStatus() {
        SupercastException e = classifier.responseError(
                response(429, "{\"message\":\"slow down\",\"code\":\"rate_limited\"}"), context);

        assertThat(e.code()).isEqualTo("rate_limited");
    }

    @Test
    void undecodableBodyIsGenericApiError() {
        SupercastException e = classifier.responseError(response(404, "<html>not found</html>"), context);

        assertThat(e).isExactlyInstanceOf(ApiError.class);
        assertThat(e.getMessage())
                .isEqualTo("Invalid response object from API: \"<html>not found</html>\" (HTTP response code was 404)");
        assertThat(e.httpStatus()).isEqualTo(404);        assertThat(appender.list).singleElement().satisfies(event -> assertThat(event.getFormattedMessage())
                .startsWith("Supercast API error status=404 error_code=404 error_message=Invalid response object")
                .endsWith("idempotency_key=idem-1"));
    }

    @Test
    void locallyRaisedErrorsAreLoggedWithoutStatus() {
        SupercastException.Authentication e = classifier.logged(
                new SupercastException.Authentication("No API key provided."), null);

        assertThat(e.getMessage()).isEqualTo("No API key provided.");
        assertThat(appender.list).singleElement().satisfies(event -> assertThat(event.getFormattedMessage())
                .isEqualTo("Supercast API error status=null error_code=null error_message=No API key provided. idempotency_key=null"));
    }

    @Test
    void responseErrorsAreLoggedBeforeReturn() {
        classifier.responseError(response(403, "{\"message\":\"nope\"}"), context);

        assertThat(appender.list).hasSize(1);
        ILoggingEvent event = appender.list.get(0);
        assertThat(event.getLevel().toString()).isEqualTo("ERROR");
        assertThat(event.getFormattedMessage())
                .isEqualTo("Supercast API error status=403 error_code=403 error_message=nope idempotency_key=idem-1");
    }

    @Test
    void timeoutMessageNamesApiBase() {
        ApiConnection e = classifier.connectionError(
                new HttpTimeoutException("request timed out", new SocketTimeoutException()),
                context, 0, "https://supercast.com/api");

        assertThat(e.getMessage())
                .startsWith("Could not connect to Supercast (https://supercast.com/api).")
                .endsWith("\n\n(Network error: request timed out)")
                .doesNotContain("retried");
        assertThat(e.getCause()).isInstanceOf(HttpTimeoutException.class);
        assertThat(e.httpStatus()).isNull();
    }

    @Test
    void connectionFailureMentionsDnsAndRetries() {
        ApiConnection e = classifier.connectionError(
                new HttpConnectException("Connection refused", new ConnectException()),
                context, 3, "https://supercast.com/api");

        assertThat(e.getMessage())
                .startsWith("Unexpected error communicating when trying to connect to Supercast.")
                .contains("host supercast.com")
                .contains(" Request was retried 3 times.\n\n(Network error: Connection refused)");
    }

    @Test
    void tlsAndOtherFailuresHaveTheirOwnHints() {
        ApiConnection tls = classifier.connectionError(
                new HttpTlsException("PKIX", new IOException()), context, 0, "https://supercast.com/api");
        ApiConnection other = classifier.connectionError(
                new HttpClientException("stream reset", new IOException()), context, 1, "https://supercast.com/api");

        assertThat(tls.getMessage()).startsWith("Could not establish a secure connection to Supercast");
        assertThat(other.getMessage())
                .startsWith("Unexpected error communicating with Supercast.")
                .contains("Request was retried 1 times.");
    }

    private static HttpClientResponse response(int status, String body) {
        return new HttpClientResponse(status, Map.of("Content-Type", List.of("application/json")),
                body.getBytes(StandardCharsets.UTF_8));
    }
}
