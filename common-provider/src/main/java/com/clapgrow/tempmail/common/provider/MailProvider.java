package com.clapgrow.tempmail.common.provider;

import com.clapgrow.tempmail.common.model.CreateEmailRequest;
import com.clapgrow.tempmail.common.model.CreatedEmail;
import com.clapgrow.tempmail.common.model.EmailListQuery;
import com.clapgrow.tempmail.common.model.EmailMessage;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Disposable mailbox provider.
 *
 * Abstraction over third-party temp-mail vendors (MinMail, Mail.tm, etc.).
 * Enables vendor-agnostic address creation and mailbox reads, and lets the
 * registry route by capability, priority and health.
 *
 * Implementation guidelines:
 * - Never perform network I/O in {@link #initialize(ProviderConfiguration)}
 * - Complete every operation with an envelope; never signal an error
 * - Classify failures so callers can tell retryable from fatal ones
 * - Never log API keys or access tokens
 *
 * Example usage:
 * <pre>
 * MailProvider provider = providerRegistry.getProvider("mailtm").orElseThrow();
 * OperationEnvelope&lt;List&lt;EmailMessage&gt;&gt; inbox = provider.listMessages(query).block();
 * if (!inbox.success()) {
 *     handleError(inbox.error());
 * }
 * </pre>
 */
public interface MailProvider {

    /**
     * Unique provider name, e.g. {@code "mailtm"}.
     */
    String getName();

    /**
     * Static feature flags, fixed at construction.
     */
    ProviderCapabilities getCapabilities();

    /**
     * Current configuration.
     */
    ProviderConfiguration getConfiguration();

    /**
     * Store configuration. Idempotent, performs no network I/O.
     *
     * @param configuration Provider settings
     */
    void initialize(ProviderConfiguration configuration);

    /**
     * Create a disposable address.
     *
     * @param request Optional domain, prefix and expiration hints
     * @return Envelope carrying the created address
     */
    Mono<OperationEnvelope<CreatedEmail>> createEmailAddress(CreateEmailRequest request);

    /**
     * List messages of an address, filtered then paginated.
     *
     * @param query Address and listing options
     * @return Envelope carrying the matching messages
     */
    Mono<OperationEnvelope<List<EmailMessage>>> listMessages(EmailListQuery query);

    /**
     * Fetch full content of a single message.
     *
     * @param address Mailbox address
     * @param messageId Vendor message id
     * @param accessToken Token issued at creation (only some vendors)
     * @return Envelope carrying the message
     */
    Mono<OperationEnvelope<EmailMessage>> fetchMessage(String address, String messageId, String accessToken);

    /**
     * Current health snapshot. The first call runs the deferred connectivity probe.
     */
    Mono<ProviderHealth> getHealth();

    /**
     * Discard the cached probe, probe again and return the fresh snapshot.
     */
    Mono<ProviderHealth> refreshHealth();

    /**
     * Read-only copy of the request counters.
     */
    ProviderStatistics getStatistics();

    /**
     * Issue one lightweight vendor request. Never touches cached health.
     *
     * @return Envelope carrying {@code true} when the vendor answered
     */
    Mono<OperationEnvelope<Boolean>> testConnectivity();

    /**
     * Whether the provider takes part in routing.
     */
    default boolean isEnabled() {
        ProviderConfiguration configuration = getConfiguration();
        return configuration != null && configuration.isEnabled();
    }
}
