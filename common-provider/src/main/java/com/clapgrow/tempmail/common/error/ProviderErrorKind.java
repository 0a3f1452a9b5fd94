package com.clapgrow.tempmail.common.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a provider failure.
 *
 * Drives caller-side retry decisions:
 * - AUTHENTICATION, CONFIGURATION: never retry, fix credentials or settings first
 * - everything else: retryable by convention (the caller backs off and retries)
 *
 * The gateway itself never retries across adapter-level failures; only the
 * HTTP invoker retries raw transport failures inside a single logical call.
 *
 * Example usage:
 * <pre>
 * if (error.kind().isRetryable()) {
 *     // back off and try again later
 * } else {
 *     // surface to the operator
 * }
 * </pre>
 */
public enum ProviderErrorKind {
    /**
     * Connection refused, DNS failure, reset sockets and similar transport problems.
     */
    NETWORK("network_error"),

    /**
     * Non-2xx vendor response, malformed payload or a missing required field.
     */
    API("api_error"),

    /**
     * Vendor signalled throttling (HTTP 429).
     * Retryable, but the caller is expected to back off first.
     */
    RATE_LIMIT("rate_limit_error"),

    /**
     * Missing or rejected credentials (vendor token, unknown address session).
     */
    AUTHENTICATION("authentication_error"),

    /**
     * Provider is misconfigured (missing API key, no usable domain).
     */
    CONFIGURATION("configuration_error"),

    /**
     * An attempt exceeded its per-call timeout and was abandoned.
     */
    TIMEOUT("timeout_error"),

    /**
     * Anything that could not be classified more precisely.
     */
    UNKNOWN("unknown_error");

    private final String wireValue;

    ProviderErrorKind(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Whether a failure of this kind may succeed when repeated later.
     *
     * @return false only for AUTHENTICATION and CONFIGURATION
     */
    public boolean isRetryable() {
        return this != AUTHENTICATION && this != CONFIGURATION;
    }

    /**
     * Value used in JSON payloads (e.g., "rate_limit_error").
     *
     * @return Wire representation
     */
    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
