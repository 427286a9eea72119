package io.supercast.client;

import io.supercast.core.SupercastConfig;
import io.supercast.http.spi.HttpClientException;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides whether a failed attempt is retried and how long to wait first.
 *
 * <p>Only transport failures that never produced a response are retried, and of those only
 * timeouts and failed connections. HTTP error statuses, 5xx included, are never retried here.
 */
public final class RetryPolicy {

    private final int maxNetworkRetries;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final Random random;

    public RetryPolicy(int maxNetworkRetries, Duration initialDelay, Duration maxDelay, Random random) {
        if (maxNetworkRetries < 0) {
            throw new IllegalArgumentException("maxNetworkRetries must be >= 0");
        }
        this.maxNetworkRetries = maxNetworkRetries;
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Policy for the calling thread, jittered by {@link ThreadLocalRandom}.
     */
    public static RetryPolicy from(SupercastConfig config) {
        return from(config, ThreadLocalRandom.current());
    }

    public static RetryPolicy from(SupercastConfig config, Random random) {
        return new RetryPolicy(config.maxNetworkRetries(), config.initialNetworkRetryDelay(),
                config.maxNetworkRetryDelay(), random);
    }

    public int maxNetworkRetries() {
        return maxNetworkRetries;
    }

    /**
     * @param failure what the last attempt failed with
     * @param numRetries retries already performed for this call
     */
    public boolean shouldRetry(Exception failure, int numRetries) {
        if (numRetries >= maxNetworkRetries) {
            return false;
        }
        if (!(failure instanceof HttpClientException)) {
            return false;
        }
        return switch (((HttpClientException) failure).kind()) {
            case TIMEOUT, CONNECTION_FAILED -> true;
            case TLS_FAILURE, OTHER -> false;
        };
    }

    /**
     * Exponential backoff capped at the maximum delay, jittered down by up to half and never
     * below the initial delay.
     *
     * @param numRetries the retry about to be made, starting at 1
     */
    public Duration backoffDelay(int numRetries) {
        double initialSeconds = seconds(initialDelay);
        double sleepSeconds = Math.min(initialSeconds * Math.pow(2, numRetries - 1), seconds(maxDelay));
        sleepSeconds *= 0.5 * (1 + random.nextDouble());
        sleepSeconds = Math.max(initialSeconds, sleepSeconds);
        return Duration.ofNanos(Math.round(sleepSeconds * 1_000_000_000d));
    }

    private static double seconds(Duration d) {
        return d.toNanos() / 1_000_000_000d;
    }
}
