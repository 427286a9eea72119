package io.supercast.http.spi;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface allows the Supercast client to work with different
 * HTTP client libraries (JDK HttpClient, Apache HttpClient, OkHttp, etc.)
 * without direct dependency on any specific implementation.
 *
 * <p>Implementations return a response for every status code, including 4xx and 5xx;
 * only failures that produced no response are thrown, classified by {@link TransportFailure}.
 * An adapter may hold pooled connections and is reused for many sequential calls.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://example.com")).build();
 * HttpClientResponse response = adapter.send(request);
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and returns the response with the body read into memory.
     *
     * @param request the HTTP request to send
     * @return the HTTP response
     * @throws HttpTimeoutException if the connection or the response timed out
     * @throws HttpConnectException if the connection was refused, reset or could not be resolved
     * @throws HttpTlsException if the TLS handshake failed
     * @throws HttpClientException for any other transport failure
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;
}
