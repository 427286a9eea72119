package io.supercast.http.spi;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * {@link HttpClientAdapter} implementation using the JDK 11+ HttpClient.
 * This is the default implementation when no other HTTP client library is available.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new adapter with a default HttpClient.
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newHttpClient());
    }

    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient);
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(toJdkRequest(request), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw HttpFailures.map(e);
        } catch (InterruptedException e) {
            throw HttpFailures.interrupted(e);
        } catch (IllegalArgumentException e) {
            throw new HttpClientException("Invalid request: " + e.getMessage(), e);
        }
        return new HttpClientResponse(response.statusCode(), response.headers().map(), response.body());
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());

        HttpRequest.BodyPublisher bodyPublisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        builder.method(request.method(), bodyPublisher);
        // restricted by the JDK client, which sets it itself
        request.headers().forEach((name, value) -> {
            if (!"Content-Length".equalsIgnoreCase(name)) {
                builder.header(name, value);
            }
        });

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        return builder.build();
    }
}
