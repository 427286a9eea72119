package io.supercast.core;

/**
 * Supercast API wire constants (header names, content types and well-known values).
 *
 * <p>This module intentionally contains no HTTP client bindings. It only models
 * protocol-level concerns shared by the request executor and the transports.
 */
public final class Protocol {
    private Protocol() {}

    // Supercast headers
    public static final String H_ACCOUNT = "Supercast-Account";
    public static final String H_VERSION = "Supercast-Version";
    public static final String H_IDEMPOTENCY_KEY = "Idempotency-Key";
    public static final String H_CLIENT_USER_AGENT = "X-Supercast-Client-User-Agent";
    public static final String H_CLIENT_RAW_USER_AGENT = "X-Supercast-Client-Raw-User-Agent";

    // HTTP headers
    public static final String H_AUTHORIZATION = "Authorization";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_USER_AGENT = "User-Agent";

    // Content types
    public static final String CT_FORM_URLENCODED = "application/x-www-form-urlencoded";

    /** Prefix of the {@code User-Agent} header; the bindings version is appended. */
    public static final String USER_AGENT_PREFIX = "Supercast JavaBindings/";

    /** Prefix of the {@code Authorization} header value. */
    public static final String BEARER_PREFIX = "Bearer ";
}
