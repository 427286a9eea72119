package io.supercast.client;

import java.time.Duration;

/**
 * Blocks the calling thread between retries. Replaceable so tests can record delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis(), (int) (delay.toNanos() % 1_000_000));

    void sleep(Duration delay) throws InterruptedException;
}
