package com.clapgrow.tempmail.common.provider;

import com.clapgrow.tempmail.common.error.ProviderError;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Uniform result of every provider operation.
 *
 * Never partially filled: a successful envelope carries data and no error,
 * a failed envelope carries an error and no data. Metadata is always present.
 *
 * Example usage:
 * <pre>
 * OperationEnvelope&lt;CreatedEmail&gt; result = provider.createEmailAddress(request).block();
 * if (!result.success()) {
 *     log.warn("Create failed: {}", result.error().message());
 *     if (result.error().retryable()) {
 *         // back off and retry later
 *     }
 * }
 * </pre>
 *
 * @param <T> Payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationEnvelope<T>(
    boolean success,
    T data,
    ProviderError error,
    ResponseMetadata metadata
) {

    public OperationEnvelope {
        Objects.requireNonNull(metadata, "metadata");
        if (success && (data == null || error != null)) {
            throw new IllegalArgumentException("Successful envelope must carry data and no error");
        }
        if (!success && (error == null || data != null)) {
            throw new IllegalArgumentException("Failed envelope must carry an error and no data");
        }
    }

    /**
     * Create a successful envelope.
     *
     * @param data Payload
     * @param metadata Call metadata
     * @param <T> Payload type
     * @return Success envelope
     */
    public static <T> OperationEnvelope<T> success(T data, ResponseMetadata metadata) {
        return new OperationEnvelope<>(true, data, null, metadata);
    }

    /**
     * Create a failed envelope.
     *
     * @param error Typed error
     * @param metadata Call metadata
     * @param <T> Payload type
     * @return Failure envelope
     */
    public static <T> OperationEnvelope<T> failure(ProviderError error, ResponseMetadata metadata) {
        return new OperationEnvelope<>(false, null, error, metadata);
    }

    /**
     * Re-type a failed envelope, e.g. when one operation is built on another.
     *
     * @param <R> New payload type
     * @return Same error and metadata with another payload type
     */
    public <R> OperationEnvelope<R> asFailure() {
        if (success) {
            throw new IllegalStateException("Envelope is not a failure");
        }
        return failure(error, metadata);
    }
}
