package com.clapgrow.tempmail.common.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Typed provider failure.
 *
 * Immutable: created once by {@link ProviderErrorClassifier} at the point of failure
 * and handed back to the caller unchanged inside a failed envelope.
 *
 * JSON shape:
 * <pre>
 * { "type": "api_error", "channelName": "mailtm", "message": "...",
 *   "statusCode": 502, "retryable": true, "timestamp": "...", "context": {...} }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderError(
    @JsonProperty("type") ProviderErrorKind kind,
    @JsonProperty("channelName") String providerName,
    String message,
    Integer statusCode,
    boolean retryable,
    Instant timestamp,
    Map<String, Object> context
) {

    public ProviderError {
        context = context == null ? null : Collections.unmodifiableMap(new HashMap<>(context));
    }

    /**
     * Copy of this error with additional context entries.
     *
     * @param extra Context to merge (existing keys are overwritten)
     * @return New error instance
     */
    public ProviderError withContext(Map<String, Object> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new HashMap<>();
        if (context != null) {
            merged.putAll(context);
        }
        merged.putAll(extra);
        return new ProviderError(kind, providerName, message, statusCode, retryable, timestamp, merged);
    }
}
