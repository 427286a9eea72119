package io.supercast.client;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Per-thread binding of the client that resource calls go through.
 *
 * <p>Each thread sees only its own binding and its own lazily created default client.
 */
public final class ClientScope {

    private static final ThreadLocal<SupercastClient> ACTIVE = new ThreadLocal<>();
    private static final ThreadLocal<SupercastClient> DEFAULT =
            ThreadLocal.withInitial(() -> SupercastClient.builder().adapter(DefaultConnections.current()).build());

    private ClientScope() {}

    /**
     * The client bound to this thread, or the thread's default client when none is bound.
     */
    public static SupercastClient active() {
        SupercastClient client = ACTIVE.get();
        return client != null ? client : DEFAULT.get();
    }

    public static SupercastClient defaultClient() {
        return DEFAULT.get();
    }

    /**
     * Binds {@code client} for the duration of {@code block}, then restores whatever was
     * bound before, whether the block returns or throws.
     */
    public static <T> T runScoped(SupercastClient client, Supplier<T> block) {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(block, "block");
        SupercastClient previous = ACTIVE.get();
        ACTIVE.set(client);
        try {
            return block.get();
        } finally {
            if (previous == null) {
                ACTIVE.remove();
            } else {
                ACTIVE.set(previous);
            }
        }
    }
}
