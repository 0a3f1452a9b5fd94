package com.clapgrow.tempmail.provider.adapter;

import com.clapgrow.tempmail.common.error.ProviderErrorClassifier;
import com.clapgrow.tempmail.common.error.ProviderErrorKind;
import com.clapgrow.tempmail.common.http.HttpInvocation;
import com.clapgrow.tempmail.common.http.HttpResult;
import com.clapgrow.tempmail.common.http.ResilientHttpInvoker;
import com.clapgrow.tempmail.common.model.CreateEmailRequest;
import com.clapgrow.tempmail.common.model.CreatedEmail;
import com.clapgrow.tempmail.common.model.EmailContact;
import com.clapgrow.tempmail.common.model.EmailListQuery;
import com.clapgrow.tempmail.common.model.EmailMessage;
import com.clapgrow.tempmail.common.provider.ProviderCapabilities;
import com.clapgrow.tempmail.common.provider.ProviderConfiguration;
import com.clapgrow.tempmail.provider.support.AbstractMailProvider;
import com.clapgrow.tempmail.provider.support.MailContentSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ChatTempMail (chat-tempmail.com).
 *
 * Requires an API key sent as {@code X-API-Key}; without one every operation
 * fails with a configuration error. Messages are addressed by the vendor's
 * mailbox id, which is remembered per address after creation.
 */
@Slf4j
public class ChatTempMailProvider extends AbstractMailProvider {

    public static final String NAME = "chattempmail";

    static final String DEFAULT_BASE_URL = "https://chat-tempmail.com/api";
    static final String FALLBACK_DOMAIN = "chat-tempmail.com";

    private static final long DEFAULT_EXPIRY_MILLIS = Duration.ofHours(1).toMillis();
    private static final String API_KEY_HEADER = "X-API-Key";

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.builder()
        .createEmail(true)
        .listEmails(true)
        .getEmailContent(true)
        .customDomains(true)
        .customPrefix(true)
        .emailExpiration(true)
        .realTimeUpdates(true)
        .build();

    private final Cache<String, String> mailboxIds = Caffeine.newBuilder()
        .maximumSize(10_000)
        .expireAfterWrite(Duration.ofDays(7))
        .build();

    private volatile List<String> availableDomains = List.of();

    public ChatTempMailProvider(ResilientHttpInvoker httpInvoker, ProviderErrorClassifier errorClassifier, Clock clock) {
        super(NAME, CAPABILITIES, httpInvoker, errorClassifier, clock);
    }

    @Override
    protected void onInitialize(ProviderConfiguration configuration) {
        if (!configuration.hasApiKey()) {
            log.warn("ChatTempMail has no API key configured; its operations will fail until one is set");
        }
        if (!configuration.getDomains().isEmpty()) {
            availableDomains = List.copyOf(configuration.getDomains());
        }
    }

    @Override
    protected Mono<Void> warmUp() {
        if (!getConfiguration().hasApiKey()) {
            return Mono.empty();
        }
        return send(keyed(domainsUrl()).build())
            .doOnNext(result -> {
                List<String> domains = new ArrayList<>();
                for (JsonNode domain : requireSuccess(result, "ChatTempMail").json().path("domains")) {
                    domains.add(domain.asText());
                }
                if (!domains.isEmpty()) {
                    availableDomains = List.copyOf(domains);
                }
                log.info("ChatTempMail domains loaded: {}", availableDomains);
            })
            .then();
    }

    List<String> getAvailableDomains() {
        return availableDomains;
    }

    @Override
    protected Mono<CreatedEmail> doCreateEmailAddress(CreateEmailRequest request) {
        requireApiKey();
        String prefix = request.hasPrefix() ? request.prefix().trim() : MailContentSupport.randomString(10);
        String domain = request.hasDomain() ? request.domain().trim() : randomDomain();
        long expiryMillis = request.hasExpiration()
            ? Duration.ofMinutes(request.expirationMinutes()).toMillis()
            : DEFAULT_EXPIRY_MILLIS;

        HttpInvocation invocation = keyed(baseUrl(DEFAULT_BASE_URL) + "/emails/generate")
            .method(HttpMethod.POST)
            .body(Map.of("name", prefix, "expiryTime", expiryMillis, "domain", domain))
            .build();

        return send(invocation).map(result -> {
            JsonNode body = requireSuccess(result, "ChatTempMail").json();
            String mailboxId = body.path("id").asText(null);
            String address = body.path("email").asText(null);
            if (mailboxId == null || address == null) {
                throw apiError("Invalid response from ChatTempMail API: missing id or email");
            }
            mailboxIds.put(address, mailboxId);
            return CreatedEmail.builder()
                .address(address)
                .domain(domain)
                .username(prefix)
                .provider(NAME)
                .expiresAt(clock.instant().plusMillis(expiryMillis))
                .build();
        });
    }

    @Override
    protected Mono<List<EmailMessage>> doListMessages(EmailListQuery query) {
        requireApiKey();
        String mailboxId = requireMailboxId(query.address());
        return send(keyed(baseUrl(DEFAULT_BASE_URL) + "/emails/" + mailboxId).build())
            .map(result -> {
                JsonNode body = requireSuccess(result, "ChatTempMail").json();
                List<EmailMessage> messages = new ArrayList<>();
                for (JsonNode message : body.path("messages")) {
                    messages.add(toMessage(message, query.address(), false));
                }
                return messages;
            });
    }

    @Override
    protected Mono<EmailMessage> doFetchMessage(String address, String messageId, String accessToken) {
        requireApiKey();
        String mailboxId = requireMailboxId(address);
        return send(keyed(baseUrl(DEFAULT_BASE_URL) + "/emails/" + mailboxId + "/" + messageId).build())
            .map(result -> {
                JsonNode message = requireSuccess(result, "ChatTempMail").json().path("message");
                if (message.isMissingNode() || message.isNull()) {
                    throw apiError("Email with ID " + messageId + " not found");
                }
                return toMessage(message, address, true);
            });
    }

    @Override
    protected Mono<HttpResult> doTestConnectivity() {
        return Mono.defer(() -> {
            requireApiKey();
            return send(keyed(domainsUrl()).build());
        });
    }

    private void requireApiKey() {
        if (!getConfiguration().hasApiKey()) {
            throw error(ProviderErrorKind.CONFIGURATION, "ChatTempMail API key is required");
        }
    }

    private String requireMailboxId(String address) {
        String mailboxId = mailboxIds.getIfPresent(address);
        if (mailboxId == null) {
            throw error(ProviderErrorKind.AUTHENTICATION,
                "Email address not found. Please ensure email was created through this service.");
        }
        return mailboxId;
    }

    private String randomDomain() {
        List<String> domains = availableDomains;
        return domains.isEmpty() ? FALLBACK_DOMAIN : MailContentSupport.randomElement(domains);
    }

    private String domainsUrl() {
        return baseUrl(DEFAULT_BASE_URL) + "/email/domains";
    }

    private HttpInvocation.HttpInvocationBuilder keyed(String url) {
        return request(url).header(API_KEY_HEADER, getConfiguration().getApiKey());
    }

    private EmailMessage toMessage(JsonNode message, String address, boolean full) {
        EmailMessage.EmailMessageBuilder builder = EmailMessage.builder()
            .id(message.path("id").asText())
            .from(EmailContact.of(message.path("from_address").asText("")))
            .to(List.of(EmailContact.of(address)))
            .subject(message.path("subject").asText(""))
            .receivedAt(message.hasNonNull("received_at")
                ? Instant.ofEpochMilli(message.path("received_at").asLong())
                : clock.instant())
            .read(false)
            .provider(NAME)
            .headers(Map.of("X-Content-Type", full ? "full" : "preview", "X-Has-Full-Content", "true"));
        if (full) {
            String html = message.path("html").asText("");
            builder.textContent(message.path("content").asText(null))
                .htmlContent(html.isEmpty() ? null : html);
        }
        return builder.build();
    }
}
