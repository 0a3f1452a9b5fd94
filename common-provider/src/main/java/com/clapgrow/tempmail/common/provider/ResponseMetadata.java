package com.clapgrow.tempmail.common.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Metadata attached to every {@link OperationEnvelope}.
 *
 * @param provider Name of the provider that served the call
 * @param responseTime Elapsed time in milliseconds
 * @param requestId Generated id, {@code <epochMillis>-<6 random chars>}
 * @param cached Whether the result came from a cache (optional)
 * @param retryCount Transport retries spent on the call (optional)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseMetadata(
    String provider,
    long responseTime,
    String requestId,
    Boolean cached,
    Integer retryCount
) {

    public static ResponseMetadata of(String provider, long responseTime, String requestId) {
        return new ResponseMetadata(provider, responseTime, requestId, null, null);
    }

    public ResponseMetadata withCached(boolean cached) {
        return new ResponseMetadata(provider, responseTime, requestId, cached, retryCount);
    }
}
