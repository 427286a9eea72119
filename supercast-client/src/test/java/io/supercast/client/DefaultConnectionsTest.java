package io.supercast.client;

import io.supercast.core.SupercastConfig;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLContext;
import java.net.InetSocketAddress;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultConnectionsTest {

    @Test
    void proxyPortDefaultsByScheme() {
        InetSocketAddress http = DefaultConnections.proxyAddress(URI.create("http://proxy.local"));
        InetSocketAddress https = DefaultConnections.proxyAddress(URI.create("https://proxy.local"));
        InetSocketAddress explicit = DefaultConnections.proxyAddress(URI.create("http://proxy.local:3128"));

        assertThat(http.getPort()).isEqualTo(80);
        assertThat(https.getPort()).isEqualTo(443);
        assertThat(explicit.getHostString()).isEqualTo("proxy.local");
        assertThat(explicit.getPort()).isEqualTo(3128);
    }

    @Test
    void proxyWithoutHostIsRejected() {
        assertThatThrownBy(() -> DefaultConnections.proxyAddress(URI.create("proxy")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void proxyIsInstalledOnClient() {
        SupercastConfig config = SupercastConfig.builder().proxy(URI.create("http://proxy.local:3128")).build();

        assertThat(DefaultConnections.create(config).httpClient().proxy()).isPresent();
    }

    @Test
    void verificationDisabledUsesDedicatedContext() throws Exception {
        SSLContext insecure = DefaultConnections.sslContext(SupercastConfig.builder().verifySslCerts(false).build());

        assertThat(insecure).isNotSameAs(SSLContext.getDefault());
        assertThat(insecure.getProtocol()).isEqualTo("TLS");
    }

    @Test
    void verificationWithoutCustomStoreUsesDefaultContext() throws Exception {
        assertThat(DefaultConnections.sslContext(SupercastConfig.defaults())).isSameAs(SSLContext.getDefault());
    }

    @Test
    void currentIsStablePerThread() {
        assertThat(DefaultConnections.current()).isSameAs(DefaultConnections.current());
    }
}
