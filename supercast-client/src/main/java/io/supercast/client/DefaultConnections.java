package io.supercast.client;

import io.supercast.core.Supercast;
import io.supercast.core.SupercastConfig;
import io.supercast.http.spi.HttpClientAdapter;
import io.supercast.http.spi.JdkHttpClientAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One JDK {@link HttpClient}-backed transport per thread, built from the configuration in
 * effect when the thread first needs it. Connections are reused by every call that thread
 * makes through its default client and never shared with another thread.
 */
public final class DefaultConnections {

    private static final Logger log = LoggerFactory.getLogger(DefaultConnections.class);

    private static final ThreadLocal<HttpClientAdapter> CURRENT =
            ThreadLocal.withInitial(() -> create(Supercast.config()));

    private static final AtomicBoolean VERIFY_SSL_WARNED = new AtomicBoolean();

    private DefaultConnections() {}

    public static HttpClientAdapter current() {
        return CURRENT.get();
    }

    public static JdkHttpClientAdapter create(SupercastConfig config) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(config.openTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .sslContext(sslContext(config));
        if (config.proxy() != null) {
            builder.proxy(ProxySelector.of(proxyAddress(config.proxy())));
        }
        return JdkHttpClientAdapter.create(builder.build());
    }

    static InetSocketAddress proxyAddress(URI proxy) {
        if (proxy.getHost() == null) {
            throw new IllegalArgumentException("Proxy URI has no host: " + proxy);
        }
        int port = proxy.getPort();
        if (port < 0) {
            port = "https".equalsIgnoreCase(proxy.getScheme()) ? 443 : 80;
        }
        return InetSocketAddress.createUnresolved(proxy.getHost(), port);
    }

    static SSLContext sslContext(SupercastConfig config) {
        try {
            if (!config.verifySslCerts()) {
                if (VERIFY_SSL_WARNED.compareAndSet(false, true)) {
                    log.warn("WARNING: Running without SSL cert verification. "
                            + "You should never do this in production. "
                            + "Set verifySslCerts(true) on the Supercast configuration to enable verification.");
                }
                SSLContext context = SSLContext.getInstance("TLS");
                context.init(null, new TrustManager[] {new TrustAllManager()}, new SecureRandom());
                return context;
            }
            if (config.caStore() == null) {
                return SSLContext.getDefault();
            }
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(config.caStore());
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, tmf.getTrustManagers(), null);
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize TLS for the Supercast connection", e);
        }
    }

    // Extended variant so the JDK client also skips host name checks.
    private static final class TrustAllManager extends X509ExtendedTrustManager {
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {}
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
        @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
    }
}
