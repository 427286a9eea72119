package io.supercast.client;

import io.supercast.core.Supercast;
import io.supercast.core.SupercastConfig;
import io.supercast.core.SupercastResponse;
import io.supercast.http.spi.HttpClientAdapter;
import io.supercast.json.jackson.JacksonJsonCodec;
import io.supercast.json.spi.JsonCodec;

import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Executes requests against the Supercast API over one transport.
 *
 * <p>A client is meant to be used by one thread at a time. Use {@link #request(Supplier)} to
 * make it the active client for a block of resource calls and get back both the block's
 * value and the last HTTP response:
 * <pre>{@code
 * SupercastClient client = SupercastClient.builder().build();
 * ScopedResult<Episode> result = client.request(() -> Episode.retrieve("42"));
 * int status = result.response().httpStatus();
 * }</pre>
 */
public final class SupercastClient {

    private final HttpClientAdapter adapter;
    private final RequestExecutor executor;
    private volatile SupercastResponse lastResponse;

    private SupercastClient(Builder builder) {
        this.adapter = builder.adapter != null ? builder.adapter : defaultAdapter(builder.fixedConfig);
        this.executor = new RequestExecutor(adapter, builder.json, builder.config,
                builder.sleeper, builder.random, new SystemProfiler());
    }

    // a fixed configuration owns its transport; the process-wide one shares the thread's connection
    private static HttpClientAdapter defaultAdapter(SupercastConfig fixedConfig) {
        return fixedConfig != null ? DefaultConnections.create(fixedConfig) : DefaultConnections.current();
    }

    public static Builder builder() {
        return new Builder();
    }

    public HttpClientAdapter adapter() {
        return adapter;
    }

    /**
     * Runs {@code block} with this client active on the current thread.
     *
     * @return the block's value and the last response this client recorded while it ran
     */
    public <T> ScopedResult<T> request(Supplier<T> block) {
        lastResponse = null;
        T value = ClientScope.runScoped(this, block);
        return new ScopedResult<>(value, lastResponse);
    }

    /**
     * Executes one API call and records its response as this client's last response.
     */
    public SupercastResponse executeRequest(String method, String path, Map<String, ?> params, RequestOptions options) {
        SupercastResponse response = executor.execute(method, path, params, options);
        lastResponse = response;
        return response;
    }

    public SupercastResponse executeRequest(String method, String path, Map<String, ?> params) {
        return executeRequest(method, path, params, RequestOptions.none());
    }

    public static final class Builder {
        private HttpClientAdapter adapter;
        private JsonCodec json = new JacksonJsonCodec();
        private Supplier<SupercastConfig> config = Supercast::config;
        private SupercastConfig fixedConfig;
        private Sleeper sleeper = Sleeper.THREAD_SLEEP;
        private Random random;

        private Builder() {}

        /**
         * Transport to use. Defaults to a connection built from {@link #config(SupercastConfig)}
         * when one was given, otherwise to the calling thread's shared default connection.
         */
        public Builder adapter(HttpClientAdapter adapter) {
            this.adapter = Objects.requireNonNull(adapter, "adapter");
            return this;
        }

        public Builder jsonCodec(JsonCodec json) {
            this.json = Objects.requireNonNull(json, "json");
            return this;
        }

        /**
         * Fixed configuration instead of the process-wide one read at the start of every call.
         */
        public Builder config(SupercastConfig config) {
            this.fixedConfig = Objects.requireNonNull(config, "config");
            this.config = () -> config;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder random(Random random) {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        public SupercastClient build() {
            return new SupercastClient(this);
        }
    }
}
