package io.supercast.client;

import io.supercast.core.Headers;
import io.supercast.core.Protocol;
import io.supercast.core.Supercast;
import io.supercast.core.SupercastConfig;
import io.supercast.core.SupercastException;
import io.supercast.core.SupercastResponse;
import io.supercast.core.Urls;
import io.supercast.http.spi.HttpClientAdapter;
import io.supercast.http.spi.HttpClientException;
import io.supercast.http.spi.HttpClientRequest;
import io.supercast.http.spi.HttpClientResponse;
import io.supercast.json.spi.JsonCodec;
import io.supercast.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Runs one logical API call: builds the request, dispatches it through the transport,
 * retries transport failures the {@link RetryPolicy} allows, and turns the outcome into a
 * {@link SupercastResponse} or a {@link SupercastException}.
 *
 * <p>Calls are synchronous. The transport call and the backoff sleep are the only points
 * where the calling thread blocks; retries of one call never overlap.
 */
public final class RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    private static final Set<String> QUERY_METHODS = Set.of("GET", "HEAD", "DELETE");
    private static final Set<String> IDEMPOTENCY_METHODS = Set.of("POST", "DELETE");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private final HttpClientAdapter adapter;
    private final JsonCodec json;
    private final Supplier<SupercastConfig> config;
    private final Sleeper sleeper;
    private final Random random;
    private final SystemProfiler profiler;
    private final ErrorClassifier classifier;

    /**
     * @param random jitter source, or {@code null} to use the calling thread's {@code ThreadLocalRandom}
     */
    public RequestExecutor(HttpClientAdapter adapter, JsonCodec json, Supplier<SupercastConfig> config,
                           Sleeper sleeper, Random random, SystemProfiler profiler) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.json = Objects.requireNonNull(json, "json");
        this.config = Objects.requireNonNull(config, "config");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = random;
        this.profiler = Objects.requireNonNull(profiler, "profiler");
        this.classifier = new ErrorClassifier(json);
    }

    public SupercastResponse execute(String method, String path, Map<String, ?> params, RequestOptions options) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        SupercastConfig snapshot = Objects.requireNonNull(config.get(), "config");
        RequestOptions opts = options == null ? RequestOptions.none() : options;

        String verb = method.toUpperCase(Locale.ROOT);
        String apiBase = stripTrailingSlash(opts.apiBase() != null ? opts.apiBase() : snapshot.apiBase());
        String apiVersion = opts.apiVersion() != null ? opts.apiVersion() : snapshot.apiVersion();
        String apiKey = opts.apiKey() != null ? opts.apiKey() : snapshot.apiKey();
        Map<String, Object> resolved = ApiParams.objectsToIds(params);

        checkApiKey(apiKey);

        Map<String, Object> body = null;
        Map<String, Object> query = null;
        if (QUERY_METHODS.contains(verb)) {
            query = resolved;
        } else {
            body = resolved;
        }

        // parameters already on the path are kept; explicit ones win on a collision
        String rawQuery = Urls.rawQuery(path);
        if (rawQuery != null) {
            Map<String, Object> merged = new LinkedHashMap<>(Urls.parseQuery(rawQuery));
            if (query != null) {
                merged.putAll(query);
            }
            query = merged;
            path = Urls.pathOnly(path);
        }

        Map<String, String> headers = requestHeaders(apiKey, verb, apiVersion, snapshot.maxNetworkRetries(), opts.headers());

        ParameterEncoder encoder = new ParameterEncoder();
        String encodedQuery = query == null ? null : encoder.encode(query);
        String encodedBody = body == null ? null : encoder.encode(body);

        StringBuilder url = new StringBuilder(apiBase);
        if (apiVersion != null && !apiVersion.isEmpty()) {
            url.append('/').append(apiVersion);
        }
        url.append(path);
        if (encodedQuery != null && !encodedQuery.isEmpty()) {
            url.append('?').append(encodedQuery);
        }

        HttpClientRequest request = HttpClientRequest.builder(URI.create(url.toString()), verb)
                .headers(headers)
                .body(encodedBody == null ? null : encodedBody.getBytes(StandardCharsets.UTF_8))
                .timeout(snapshot.readTimeout())
                .build();

        RequestContext context = RequestContext.forRequest(verb, path, apiKey, headers,
                body == null ? null : encoder.encode(body),
                query == null ? null : encoder.encode(query));

        RetryPolicy retryPolicy = random == null
                ? RetryPolicy.from(snapshot)
                : RetryPolicy.from(snapshot, random);

        return dispatch(request, context, retryPolicy, apiBase);
    }

    private SupercastResponse dispatch(HttpClientRequest request, RequestContext context,
                                       RetryPolicy retryPolicy, String apiBase) {
        int numRetries = 0;
        while (true) {
            long start = System.nanoTime();
            logRequest(context, numRetries);

            HttpClientResponse response;
            try {
                response = adapter.send(request);
            } catch (HttpClientException e) {
                logRequestError(context, start, e);
                if (retryPolicy.shouldRetry(e, numRetries)) {
                    numRetries++;
                    sleepBeforeRetry(retryPolicy.backoffDelay(numRetries), e, context);
                    continue;
                }
                throw classifier.connectionError(e, context, numRetries, apiBase);
            }

            RequestContext responseContext = context.deriveFromResponseHeaders(response.headers());
            logResponse(responseContext, start, response);

            if (!response.isSuccess()) {
                throw classifier.responseError(response, responseContext);
            }
            return toResponse(response, responseContext);
        }
    }

    private void sleepBeforeRetry(Duration delay, HttpClientException failure, RequestContext context) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            SupercastException.ApiConnection interrupted =
                    new SupercastException.ApiConnection("Interrupted while waiting to retry request to Supercast", e);
            interrupted.addSuppressed(failure);
            throw classifier.logged(interrupted, context.idempotencyKey());
        }
    }

    private SupercastResponse toResponse(HttpClientResponse response, RequestContext context) {
        String body = SupercastResponse.bodyAsString(response.body());
        if (response.statusCode() == 204 && response.body().length == 0) {
            return new SupercastResponse(response.statusCode(), response.headers(), body, Map.of());
        }
        try {
            Object data = json.readValue(response.body(), Object.class);
            return new SupercastResponse(response.statusCode(), response.headers(), body, data);
        } catch (JsonException e) {
            throw classifier.generalApiError(response.statusCode(), response.headers(), body, context);
        }
    }

    private void checkApiKey(String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            throw classifier.logged(new SupercastException.Authentication("No API key provided. "
                    + "Set your API key using \"Supercast.configure(SupercastConfig.builder().apiKey(<API-KEY>).build())\". "
                    + "You can generate API keys from the Supercast web interface. "
                    + "See https://docs.supercast.tech/docs/access-tokens for details, or email "
                    + "support@supercast.com if you have any questions."), null);
        }
        if (WHITESPACE.matcher(apiKey).find()) {
            throw classifier.logged(new SupercastException.Authentication("Your API key is invalid, as it contains "
                    + "whitespace. (HINT: You can double-check your API key from the "
                    + "Supercast web interface. See https://docs.supercast.tech/docs/access-tokens for details, or "
                    + "email support@supercast.com if you have any questions.)"), null);
        }
    }

    private Map<String, String> requestHeaders(String apiKey, String method, String apiVersion,
                                               int maxNetworkRetries, Map<String, String> callerHeaders) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(Protocol.H_USER_AGENT, Protocol.USER_AGENT_PREFIX + Supercast.VERSION);
        headers.put(Protocol.H_AUTHORIZATION, Protocol.BEARER_PREFIX + apiKey);
        headers.put(Protocol.H_CONTENT_TYPE, Protocol.CT_FORM_URLENCODED);
        if (apiVersion != null) {
            headers.put(Protocol.H_VERSION, apiVersion);
        }

        Map<String, String> userAgent = profiler.userAgent();
        try {
            headers.put(Protocol.H_CLIENT_USER_AGENT, json.writeString(userAgent));
        } catch (JsonException e) {
            log.warn("Could not encode client user agent, sending raw form: {}", e.toString());
            headers.put(Protocol.H_CLIENT_RAW_USER_AGENT, userAgent.toString());
        }

        headers.putAll(Headers.normalize(callerHeaders));

        // retried POST and DELETE calls are only safe with a key the server can deduplicate on
        if (IDEMPOTENCY_METHODS.contains(method) && maxNetworkRetries > 0) {
            headers.putIfAbsent(Protocol.H_IDEMPOTENCY_KEY, UUID.randomUUID().toString());
        }
        return headers;
    }

    private static String stripTrailingSlash(String apiBase) {
        return apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
    }

    private static void logRequest(RequestContext context, int numRetries) {
        log.info("Request to Supercast API account={} api_version={} idempotency_key={} method={} num_retries={} path={}",
                context.account(), context.apiVersion(), context.idempotencyKey(),
                context.method(), numRetries, context.path());
        log.debug("Request details body={} idempotency_key={} query_params={}",
                context.body(), context.idempotencyKey(), context.queryParams());
    }

    private static void logResponse(RequestContext context, long start, HttpClientResponse response) {
        log.info("Response from Supercast API account={} api_version={} elapsed={} idempotency_key={} method={} path={} status={}",
                context.account(), context.apiVersion(), elapsed(start), context.idempotencyKey(),
                context.method(), context.path(), response.statusCode());
        if (log.isDebugEnabled()) {
            log.debug("Response details body={} idempotency_key={}",
                    SupercastResponse.bodyAsString(response.body()), context.idempotencyKey());
        }
    }

    private static void logRequestError(RequestContext context, long start, HttpClientException e) {
        log.error("Request error elapsed={} error_message={} idempotency_key={} method={} path={}",
                elapsed(start), e.getMessage(), context.idempotencyKey(), context.method(), context.path());
    }

    private static String elapsed(long startNanos) {
        return String.format(Locale.ROOT, "%.3fs", (System.nanoTime() - startNanos) / 1_000_000_000d);
    }
}
