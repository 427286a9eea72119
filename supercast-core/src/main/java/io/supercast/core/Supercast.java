package io.supercast.core;

import java.util.Objects;

/**
 * Process-wide configuration holder.
 *
 * <p>Set once at startup; the request executor takes a snapshot at the start of every call.
 * Replacing the configuration while requests are in flight only affects later calls.
 */
public final class Supercast {
    private Supercast() {}

    public static final String VERSION = "1.0.0";

    private static volatile SupercastConfig config = SupercastConfig.defaults();

    public static SupercastConfig config() {
        return config;
    }

    public static void configure(SupercastConfig newConfig) {
        config = Objects.requireNonNull(newConfig, "config");
    }
}
