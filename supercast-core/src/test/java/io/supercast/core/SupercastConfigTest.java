package io.supercast.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SupercastConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        SupercastConfig config = SupercastConfig.defaults();

        assertThat(config.apiBase()).isEqualTo("https://supercast.com/api");
        assertThat(config.apiVersion()).isEqualTo("v1");
        assertThat(config.apiKey()).isNull();
        assertThat(config.proxy()).isNull();
        assertThat(config.verifySslCerts()).isTrue();
        assertThat(config.caStore()).isNull();
        assertThat(config.openTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.readTimeout()).isEqualTo(Duration.ofSeconds(80));
        assertThat(config.maxNetworkRetries()).isZero();
        assertThat(config.initialNetworkRetryDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.maxNetworkRetryDelay()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void builderStripsTrailingSlashFromApiBase() {
        SupercastConfig config = SupercastConfig.builder().apiBase("http://localhost:8080/api/").build();
        assertThat(config.apiBase()).isEqualTo("http://localhost:8080/api");
    }

    @Test
    void toBuilderKeepsEverySetting() {
        SupercastConfig original = SupercastConfig.builder()
                .apiKey("key")
                .apiVersion("v2")
                .proxy(URI.create("http://proxy:3128"))
                .maxNetworkRetries(3)
                .build();

        SupercastConfig copy = original.toBuilder().readTimeout(Duration.ofSeconds(5)).build();

        assertThat(copy.apiKey()).isEqualTo("key");
        assertThat(copy.apiVersion()).isEqualTo("v2");
        assertThat(copy.proxy()).isEqualTo(URI.create("http://proxy:3128"));
        assertThat(copy.maxNetworkRetries()).isEqualTo(3);
        assertThat(copy.readTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(original.readTimeout()).isEqualTo(Duration.ofSeconds(80));
    }

    @Test
    void fromPropertiesReadsSupercastKeys() {
        Properties props = new Properties();
        props.setProperty("supercast.api-base", "http://localhost:9999");
        props.setProperty("supercast.api-key", "sk_test");
        props.setProperty("supercast.verify-ssl-certs", "false");
        props.setProperty("supercast.open-timeout-ms", "1500");
        props.setProperty("supercast.max-network-retries", "2");
        props.setProperty("supercast.initial-network-retry-delay-ms", "100");
        props.setProperty("supercast.max-network-retry-delay-ms", "400");

        SupercastConfig config = SupercastConfig.fromProperties(props);

        assertThat(config.apiBase()).isEqualTo("http://localhost:9999");
        assertThat(config.apiKey()).isEqualTo("sk_test");
        assertThat(config.verifySslCerts()).isFalse();
        assertThat(config.openTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(config.maxNetworkRetries()).isEqualTo(2);
        assertThat(config.initialNetworkRetryDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.maxNetworkRetryDelay()).isEqualTo(Duration.ofMillis(400));
        assertThat(config.apiVersion()).isEqualTo("v1");
    }

    @Test
    void fromPropertiesRejectsMalformedNumbers() {
        Properties props = new Properties();
        props.setProperty("supercast.max-network-retries", "two");

        assertThatThrownBy(() -> SupercastConfig.fromProperties(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("supercast.max-network-retries");
    }

    @Test
    void buildRejectsInconsistentRetrySettings() {
        assertThatThrownBy(() -> SupercastConfig.builder().maxNetworkRetries(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SupercastConfig.builder()
                .initialNetworkRetryDelay(Duration.ofSeconds(3))
                .maxNetworkRetryDelay(Duration.ofSeconds(1))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void caBundleWithoutCertificatesIsRejected(@TempDir Path dir) throws Exception {
        Path bundle = Files.writeString(dir.resolve("bundle.pem"), "not a certificate");

        assertThatThrownBy(() -> SupercastConfig.builder().caBundlePath(bundle))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bundle.pem");
    }
}
