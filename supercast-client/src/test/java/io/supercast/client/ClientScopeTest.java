package io.supercast.client;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientScopeTest {

    private final SupercastClient outer = SupercastClient.builder().adapter(new RecordingAdapter()).build();
    private final SupercastClient inner = SupercastClient.builder().adapter(new RecordingAdapter()).build();

    @Test
    void bindsClientForTheBlock() {
        SupercastClient seen = ClientScope.runScoped(outer, ClientScope::active);

        assertThat(seen).isSameAs(outer);
    }

    @Test
    void nestedScopeRestoresOuterClient() {
        ClientScope.runScoped(outer, () -> {
            SupercastClient nested = ClientScope.runScoped(inner, ClientScope::active);
            assertThat(nested).isSameAs(inner);
            assertThat(ClientScope.active()).isSameAs(outer);
            return null;
        });

        assertThat(ClientScope.active()).isSameAs(ClientScope.defaultClient());
    }

    @Test
    void nestedScopeRestoresOuterClientWhenBlockThrows() {
        ClientScope.runScoped(outer, () -> {
            assertThatThrownBy(() -> ClientScope.runScoped(inner, () -> {
                throw new IllegalStateException("boom");
            })).hasMessage("boom");
            assertThat(ClientScope.active()).isSameAs(outer);
            return null;
        });

        assertThat(ClientScope.active()).isSameAs(ClientScope.defaultClient());
    }

    @Test
    void defaultClientIsPerThread() throws Exception {
        SupercastClient mine = ClientScope.defaultClient();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SupercastClient> other = executor.submit(ClientScope::defaultClient);

            assertThat(other.get()).isNotSameAs(mine);
            assertThat(ClientScope.defaultClient()).isSameAs(mine);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void bindingIsInvisibleToOtherThreads() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            SupercastClient seenElsewhere = ClientScope.runScoped(outer, () -> {
                try {
                    return executor.submit(ClientScope::active).get();
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });

            assertThat(seenElsewhere).isNotSameAs(outer);
        } finally {
            executor.shutdownNow();
        }
    }
}
