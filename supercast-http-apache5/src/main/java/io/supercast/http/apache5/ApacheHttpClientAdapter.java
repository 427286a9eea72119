package io.supercast.http.apache5;

import io.supercast.http.spi.HttpClientAdapter;
import io.supercast.http.spi.HttpClientException;
import io.supercast.http.spi.HttpClientRequest;
import io.supercast.http.spi.HttpClientResponse;
import io.supercast.http.spi.HttpFailures;
import io.supercast.http.spi.HttpTimeoutException;

import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using Apache HttpClient 5.
 */
public final class ApacheHttpClientAdapter implements HttpClientAdapter {

    private final CloseableHttpClient httpClient;

    public ApacheHttpClientAdapter(CloseableHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new adapter with a default HttpClient.
     * @return a new ApacheHttpClientAdapter
     */
    public static ApacheHttpClientAdapter create() {
        return new ApacheHttpClientAdapter(HttpClients.createDefault());
    }

    public static ApacheHttpClientAdapter create(CloseableHttpClient httpClient) {
        return new ApacheHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        try {
            HttpUriRequestBase apacheRequest = toApacheRequest(request);
            return httpClient.execute(apacheRequest, response -> {
                byte[] body = response.getEntity() != null
                        ? EntityUtils.toByteArray(response.getEntity())
                        : null;
                return new HttpClientResponse(response.getCode(), toMultimap(response.getHeaders()), body);
            });
        } catch (ConnectTimeoutException e) {
            throw new HttpTimeoutException(e);
        } catch (IOException e) {
            throw HttpFailures.map(e);
        }
    }

    private static HttpUriRequestBase toApacheRequest(HttpClientRequest request) {
        HttpUriRequestBase apacheRequest = new HttpUriRequestBase(request.method(), request.uri());

        String contentType = null;
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            String name = header.getKey();
            if ("Content-Length".equalsIgnoreCase(name)) {
                continue;
            }
            if ("Content-Type".equalsIgnoreCase(name)) {
                contentType = header.getValue();
            }
            apacheRequest.setHeader(name, header.getValue());
        }

        if (request.body() != null) {
            ContentType type = contentType != null ? ContentType.parse(contentType) : ContentType.APPLICATION_OCTET_STREAM;
            apacheRequest.setEntity(new ByteArrayEntity(request.body(), type));
        }

        if (request.timeout() != null) {
            long millis = request.timeout().toMillis();
            RequestConfig config = RequestConfig.custom()
                    .setResponseTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .setConnectionRequestTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .build();
            apacheRequest.setConfig(config);
        }

        return apacheRequest;
    }

    private static Map<String, List<String>> toMultimap(Header[] headers) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (Header h : headers) {
            map.computeIfAbsent(h.getName(), k -> new ArrayList<>()).add(h.getValue());
        }
        return map;
    }
}
