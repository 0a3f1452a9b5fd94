package com.clapgrow.tempmail.common.error;

/**
 * Unchecked carrier for a {@link ProviderError} inside an adapter's reactive chain.
 *
 * Adapters raise it where a vendor response is unusable; the adapter base catches it
 * and turns it into a failed envelope, so it never reaches the caller.
 */
public class ProviderException extends RuntimeException {

    private final transient ProviderError error;

    public ProviderException(ProviderError error) {
        super(error.message());
        this.error = error;
    }

    public ProviderException(ProviderError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public ProviderError getError() {
        return error;
    }

    public String getProviderName() {
        return error.providerName();
    }

    public boolean isRetryable() {
        return error.retryable();
    }
}
