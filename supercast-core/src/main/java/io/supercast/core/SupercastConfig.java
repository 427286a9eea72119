package io.supercast.core;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable snapshot of the settings the request executor reads on every call.
 *
 * <p>Configure via properties:
 * <pre>
 * supercast.api-key=sk_live_...
 * supercast.max-network-retries=2
 * supercast.read-timeout-ms=30000
 * </pre>
 */
public final class SupercastConfig {

    public static final String DEFAULT_API_BASE = "https://supercast.com/api";
    public static final String DEFAULT_API_VERSION = "v1";

    private final String apiBase;
    private final String apiVersion;
    private final String apiKey;
    private final URI proxy;
    private final boolean verifySslCerts;
    private final KeyStore caStore;
    private final Duration openTimeout;
    private final Duration readTimeout;
    private final int maxNetworkRetries;
    private final Duration initialNetworkRetryDelay;
    private final Duration maxNetworkRetryDelay;

    private SupercastConfig(Builder b) {
        this.apiBase = b.apiBase;
        this.apiVersion = b.apiVersion;
        this.apiKey = b.apiKey;
        this.proxy = b.proxy;
        this.verifySslCerts = b.verifySslCerts;
        this.caStore = b.caStore;
        this.openTimeout = b.openTimeout;
        this.readTimeout = b.readTimeout;
        this.maxNetworkRetries = b.maxNetworkRetries;
        this.initialNetworkRetryDelay = b.initialNetworkRetryDelay;
        this.maxNetworkRetryDelay = b.maxNetworkRetryDelay;
    }

    public static SupercastConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.apiBase = apiBase;
        b.apiVersion = apiVersion;
        b.apiKey = apiKey;
        b.proxy = proxy;
        b.verifySslCerts = verifySslCerts;
        b.caStore = caStore;
        b.openTimeout = openTimeout;
        b.readTimeout = readTimeout;
        b.maxNetworkRetries = maxNetworkRetries;
        b.initialNetworkRetryDelay = initialNetworkRetryDelay;
        b.maxNetworkRetryDelay = maxNetworkRetryDelay;
        return b;
    }

    /**
     * Reads a configuration from {@code supercast.*} properties. Missing keys keep their defaults.
     *
     * @param props the properties to read
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static SupercastConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();
        String v;
        if ((v = props.getProperty("supercast.api-base")) != null) b.apiBase(v);
        if ((v = props.getProperty("supercast.api-version")) != null) b.apiVersion(v);
        if ((v = props.getProperty("supercast.api-key")) != null) b.apiKey(v);
        if ((v = props.getProperty("supercast.proxy")) != null) b.proxy(URI.create(v.trim()));
        if ((v = props.getProperty("supercast.verify-ssl-certs")) != null) b.verifySslCerts(Boolean.parseBoolean(v.trim()));
        if ((v = props.getProperty("supercast.ca-bundle-path")) != null) b.caBundlePath(Path.of(v.trim()));
        if ((v = props.getProperty("supercast.open-timeout-ms")) != null) b.openTimeout(millis("supercast.open-timeout-ms", v));
        if ((v = props.getProperty("supercast.read-timeout-ms")) != null) b.readTimeout(millis("supercast.read-timeout-ms", v));
        if ((v = props.getProperty("supercast.max-network-retries")) != null) b.maxNetworkRetries(integer("supercast.max-network-retries", v));
        if ((v = props.getProperty("supercast.initial-network-retry-delay-ms")) != null) {
            b.initialNetworkRetryDelay(millis("supercast.initial-network-retry-delay-ms", v));
        }
        if ((v = props.getProperty("supercast.max-network-retry-delay-ms")) != null) {
            b.maxNetworkRetryDelay(millis("supercast.max-network-retry-delay-ms", v));
        }
        return b.build();
    }

    private static Duration millis(String key, String value) {
        return Duration.ofMillis(integer(key, value));
    }

    private static int integer(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    /** Base URL of the API, without a trailing slash. */
    public String apiBase() { return apiBase; }

    /** API version path segment and {@code Supercast-Version} header value; may be null. */
    public String apiVersion() { return apiVersion; }

    public String apiKey() { return apiKey; }

    /** Proxy as {@code http://host:port}; may be null. */
    public URI proxy() { return proxy; }

    public boolean verifySslCerts() { return verifySslCerts; }

    /** Trust store used when verifying certificates; null means the JDK default trust store. */
    public KeyStore caStore() { return caStore; }

    public Duration openTimeout() { return openTimeout; }

    public Duration readTimeout() { return readTimeout; }

    public int maxNetworkRetries() { return maxNetworkRetries; }

    public Duration initialNetworkRetryDelay() { return initialNetworkRetryDelay; }

    public Duration maxNetworkRetryDelay() { return maxNetworkRetryDelay; }

    public static final class Builder {
        private String apiBase = DEFAULT_API_BASE;
        private String apiVersion = DEFAULT_API_VERSION;
        private String apiKey;
        private URI proxy;
        private boolean verifySslCerts = true;
        private KeyStore caStore;
        private Duration openTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(80);
        private int maxNetworkRetries = 0;
        private Duration initialNetworkRetryDelay = Duration.ofMillis(500);
        private Duration maxNetworkRetryDelay = Duration.ofSeconds(2);

        private Builder() {}

        public Builder apiBase(String apiBase) {
            Objects.requireNonNull(apiBase, "apiBase");
            this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder proxy(URI proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder verifySslCerts(boolean verifySslCerts) {
            this.verifySslCerts = verifySslCerts;
            return this;
        }

        public Builder caStore(KeyStore caStore) {
            this.caStore = caStore;
            return this;
        }

        /**
         * Loads every PEM certificate in {@code path} into a fresh trust store.
         *
         * @throws IllegalArgumentException if the bundle cannot be read or holds no certificate
         */
        public Builder caBundlePath(Path path) {
            Objects.requireNonNull(path, "path");
            try (InputStream in = Files.newInputStream(path)) {
                Collection<? extends Certificate> certs = CertificateFactory.getInstance("X.509").generateCertificates(in);
                if (certs.isEmpty()) {
                    throw new IllegalArgumentException("No certificates found in CA bundle " + path);
                }
                KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
                store.load(null, null);
                int i = 0;
                for (Certificate cert : certs) {
                    store.setCertificateEntry("supercast-ca-" + i++, cert);
                }
                this.caStore = store;
                return this;
            } catch (IOException | GeneralSecurityException e) {
                throw new IllegalArgumentException("Unable to load CA bundle " + path, e);
            }
        }

        public Builder openTimeout(Duration openTimeout) {
            this.openTimeout = Objects.requireNonNull(openTimeout, "openTimeout");
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
            return this;
        }

        public Builder maxNetworkRetries(int maxNetworkRetries) {
            this.maxNetworkRetries = maxNetworkRetries;
            return this;
        }

        public Builder initialNetworkRetryDelay(Duration initialNetworkRetryDelay) {
            this.initialNetworkRetryDelay = Objects.requireNonNull(initialNetworkRetryDelay, "initialNetworkRetryDelay");
            return this;
        }

        public Builder maxNetworkRetryDelay(Duration maxNetworkRetryDelay) {
            this.maxNetworkRetryDelay = Objects.requireNonNull(maxNetworkRetryDelay, "maxNetworkRetryDelay");
            return this;
        }

        public SupercastConfig build() {
            if (maxNetworkRetries < 0) {
                throw new IllegalArgumentException("maxNetworkRetries must be >= 0");
            }
            if (openTimeout.isNegative() || openTimeout.isZero()) {
                throw new IllegalArgumentException("openTimeout must be positive");
            }
            if (readTimeout.isNegative() || readTimeout.isZero()) {
                throw new IllegalArgumentException("readTimeout must be positive");
            }
            if (initialNetworkRetryDelay.isNegative()) {
                throw new IllegalArgumentException("initialNetworkRetryDelay must be >= 0");
            }
            if (maxNetworkRetryDelay.compareTo(initialNetworkRetryDelay) < 0) {
                throw new IllegalArgumentException("maxNetworkRetryDelay must be >= initialNetworkRetryDelay");
            }
            return new SupercastConfig(this);
        }
    }
}
