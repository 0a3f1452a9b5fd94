package com.clapgrow.tempmail.api.dto;

import com.clapgrow.tempmail.common.error.ProviderError;
import com.clapgrow.tempmail.common.provider.OperationEnvelope;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Standardized API response wrapper.
 *
 * Provides consistent response structure across all API endpoints,
 * improving OpenAPI documentation accuracy and client contract safety.
 *
 * Example usage:
 * <pre>
 * {@code
 * return provider.listMessages(query).map(ApiResponse::fromEnvelope);
 * return ResponseEntity.badRequest().body(ApiResponse.error("No available email provider found"));
 * }
 * </pre>
 *
 * @param success Whether the operation succeeded
 * @param data Payload on success
 * @param error Error message on failure
 * @param errorType Wire name of the error kind, e.g. {@code rate_limit_error}
 * @param retryable Whether retrying later may succeed
 * @param provider Provider that served the call
 * @param timestamp Response time
 * @param <T> Type of the data payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    boolean success,
    T data,
    String error,
    String errorType,
    Boolean retryable,
    String provider,
    Instant timestamp
) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null, null, null, null, Instant.now());
    }

    public static <T> ApiResponse<T> success(T data, String provider) {
        return new ApiResponse<>(true, data, null, null, null, provider, Instant.now());
    }

    /**
     * Create an error response not tied to any provider.
     *
     * @param error Error message
     * @param <T> Data type
     * @return Error response
     */
    public static <T> ApiResponse<T> error(String error) {
        return new ApiResponse<>(false, null, error, null, null, null, Instant.now());
    }

    /**
     * Convert a provider envelope, keeping the typed error details.
     *
     * @param envelope Provider result
     * @param <T> Data type
     * @return Equivalent API response
     */
    public static <T> ApiResponse<T> fromEnvelope(OperationEnvelope<T> envelope) {
        String provider = envelope.metadata().provider();
        if (envelope.success()) {
            return success(envelope.data(), provider);
        }
        ProviderError error = envelope.error();
        return new ApiResponse<>(false, null, error.message(), error.kind().getWireValue(),
            error.retryable(), provider, Instant.now());
    }
}
