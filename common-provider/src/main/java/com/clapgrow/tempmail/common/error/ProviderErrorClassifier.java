package com.clapgrow.tempmail.common.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Builds {@link ProviderError}s for every adapter failure path.
 *
 * Classification rules:
 * - retryable = kind is neither AUTHENTICATION nor CONFIGURATION
 * - HTTP 401/403: AUTHENTICATION
 * - HTTP 429: RATE_LIMIT
 * - other non-2xx: API
 * - timeouts anywhere in the cause chain: TIMEOUT
 * - malformed JSON: API
 * - connection and IO failures: NETWORK
 * - everything else: UNKNOWN
 *
 * A {@link ProviderException} already carries a classified error and passes through unchanged.
 */
@Slf4j
public class ProviderErrorClassifier {

    private final Clock clock;

    public ProviderErrorClassifier() {
        this(Clock.systemUTC());
    }

    public ProviderErrorClassifier(Clock clock) {
        this.clock = clock;
    }

    /**
     * Create a typed error.
     *
     * @param kind Error kind
     * @param message Human readable message
     * @param providerName Owning provider
     * @param statusCode Upstream HTTP status (may be null)
     * @return Immutable error
     */
    public ProviderError classify(ProviderErrorKind kind, String message, String providerName, Integer statusCode) {
        return classify(kind, message, providerName, statusCode, null);
    }

    /**
     * Create a typed error with free-form context.
     *
     * @param kind Error kind
     * @param message Human readable message
     * @param providerName Owning provider
     * @param statusCode Upstream HTTP status (may be null)
     * @param context Extra diagnostic values (may be null)
     * @return Immutable error
     */
    public ProviderError classify(ProviderErrorKind kind, String message, String providerName,
                                  Integer statusCode, Map<String, Object> context) {
        return new ProviderError(kind, providerName, message, statusCode,
            kind.isRetryable(), clock.instant(), context);
    }

    /**
     * Shortcut for {@link #classify(ProviderErrorKind, String, String, Integer)} without status code.
     */
    public ProviderError classify(ProviderErrorKind kind, String message, String providerName) {
        return classify(kind, message, providerName, null);
    }

    /**
     * Classify a non-2xx vendor response.
     *
     * @param statusCode HTTP status code
     * @param message Error message
     * @param providerName Owning provider
     * @return Typed error
     */
    public ProviderError fromStatus(int statusCode, String message, String providerName) {
        ProviderErrorKind kind;
        if (statusCode == 429) {
            kind = ProviderErrorKind.RATE_LIMIT;
        } else if (statusCode == 401 || statusCode == 403) {
            kind = ProviderErrorKind.AUTHENTICATION;
        } else {
            kind = ProviderErrorKind.API;
        }
        return classify(kind, message, providerName, statusCode);
    }

    /**
     * Classify anything thrown while talking to a vendor.
     *
     * @param throwable Failure (never null)
     * @param providerName Owning provider
     * @return Typed error
     */
    public ProviderError fromThrowable(Throwable throwable, String providerName) {
        if (throwable instanceof ProviderException providerException) {
            return providerException.getError();
        }

        String message = describe(throwable);

        if (throwable instanceof WebClientResponseException responseException) {
            return fromStatus(responseException.getStatusCode().value(), message, providerName);
        }
        if (hasTimeoutCause(throwable)) {
            return classify(ProviderErrorKind.TIMEOUT, message, providerName);
        }
        if (throwable instanceof JsonProcessingException) {
            return classify(ProviderErrorKind.API, "Malformed vendor response: " + message, providerName);
        }
        if (throwable instanceof WebClientRequestException || throwable instanceof IOException) {
            return classify(ProviderErrorKind.NETWORK, message, providerName);
        }

        log.debug("Unclassified failure from provider {}: {}", providerName, throwable.getClass().getName());
        return classify(ProviderErrorKind.UNKNOWN, message, providerName);
    }

    private boolean hasTimeoutCause(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof TimeoutException
                || current instanceof SocketTimeoutException
                || current instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null && !message.isBlank() ? message : throwable.getClass().getSimpleName();
    }
}
