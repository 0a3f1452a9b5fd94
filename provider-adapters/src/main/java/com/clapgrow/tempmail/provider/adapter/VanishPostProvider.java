package com.clapgrow.tempmail.provider.adapter;

import com.clapgrow.tempmail.common.error.ProviderErrorClassifier;
import com.clapgrow.tempmail.common.error.ProviderErrorKind;
import com.clapgrow.tempmail.common.error.ProviderException;
import com.clapgrow.tempmail.common.http.HttpInvocation;
import com.clapgrow.tempmail.common.http.HttpResult;
import com.clapgrow.tempmail.common.http.ResilientHttpInvoker;
import com.clapgrow.tempmail.common.model.CreateEmailRequest;
import com.clapgrow.tempmail.common.model.CreatedEmail;
import com.clapgrow.tempmail.common.model.EmailAttachment;
import com.clapgrow.tempmail.common.model.EmailContact;
import com.clapgrow.tempmail.common.model.EmailListQuery;
import com.clapgrow.tempmail.common.model.EmailMessage;
import com.clapgrow.tempmail.common.provider.ProviderCapabilities;
import com.clapgrow.tempmail.provider.support.AbstractMailProvider;
import com.clapgrow.tempmail.provider.support.MailContentSupport;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * VanishPost (vanishpost.com).
 *
 * Addresses are issued against a random session id sent as {@code session-id}
 * and {@code x-session-id}. The vendor allows one new address per IP every
 * 15 minutes and answers 429 beyond that. Listings already carry full content.
 */
@Slf4j
public class VanishPostProvider extends AbstractMailProvider {

    public static final String NAME = "vanishpost";

    static final String DEFAULT_BASE_URL = "https://vanishpost.com";

    private static final String HEX = "0123456789abcdef";
    private static final String RATE_LIMIT_MESSAGE = "VanishPost rate limit: one address per IP every 15 minutes. "
        + "Retry later or use another provider";

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.builder()
        .createEmail(true)
        .listEmails(true)
        .getEmailContent(true)
        .emailExpiration(true)
        .attachmentSupport(true)
        .build();

    private final AtomicReference<String> sessionId = new AtomicReference<>();

    public VanishPostProvider(ResilientHttpInvoker httpInvoker, ProviderErrorClassifier errorClassifier, Clock clock) {
        super(NAME, CAPABILITIES, httpInvoker, errorClassifier, clock);
    }

    @Override
    protected Mono<Void> warmUp() {
        return Mono.fromRunnable(() -> {
            if (sessionId.compareAndSet(null, MailContentSupport.randomString(32, HEX))) {
                log.debug("VanishPost session id generated");
            }
        });
    }

    String sessionId() {
        return sessionId.get();
    }

    @Override
    protected Mono<CreatedEmail> doCreateEmailAddress(CreateEmailRequest request) {
        String base = baseUrl(DEFAULT_BASE_URL);
        HttpInvocation invocation = browserRequest(base + "/api/generate")
            .method(HttpMethod.POST)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .header("origin", base)
            .header("session-id", sessionId())
            .header("x-session-id", sessionId())
            .build();

        return send(invocation).map(result -> {
            if (result.status() == 429) {
                throw new ProviderException(errorClassifier.classify(ProviderErrorKind.RATE_LIMIT,
                    RATE_LIMIT_MESSAGE, NAME, 429));
            }
            JsonNode body = requireSuccess(result, "VanishPost").json();
            String address = body.path("emailAddress").asText(null);
            if (!body.path("success").asBoolean(false) || address == null || address.isBlank()) {
                throw apiError("Failed to generate email address");
            }
            return CreatedEmail.builder()
                .address(address)
                .domain(MailContentSupport.domain(address))
                .username(MailContentSupport.username(address))
                .expiresAt(body.hasNonNull("expirationDate")
                    ? MailContentSupport.parseDate(body.path("expirationDate").asText(), clock)
                    : null)
                .provider(NAME)
                .build();
        });
    }

    @Override
    protected Mono<List<EmailMessage>> doListMessages(EmailListQuery query) {
        return inbox(query.address());
    }

    @Override
    protected Mono<EmailMessage> doFetchMessage(String address, String messageId, String accessToken) {
        return inbox(address).flatMap(messages -> findById(messages, messageId));
    }

    @Override
    protected Mono<HttpResult> doTestConnectivity() {
        return send(request(baseUrl(DEFAULT_BASE_URL) + "/").build());
    }

    private Mono<List<EmailMessage>> inbox(String address) {
        String url = UriComponentsBuilder.fromUriString(baseUrl(DEFAULT_BASE_URL) + "/api/emails/{address}")
            .encode()
            .buildAndExpand(address)
            .toUriString();

        return send(browserRequest(url).build()).map(result -> {
            JsonNode body = requireSuccess(result, "VanishPost").json();
            if (!body.path("success").asBoolean(false)) {
                throw apiError("Failed to get emails");
            }
            List<EmailMessage> messages = new ArrayList<>();
            for (JsonNode message : body.path("emails")) {
                messages.add(toMessage(message, address));
            }
            return messages;
        });
    }

    private HttpInvocation.HttpInvocationBuilder browserRequest(String url) {
        return request(url)
            .header("accept", "*/*")
            .header("referer", baseUrl(DEFAULT_BASE_URL) + "/");
    }

    private EmailMessage toMessage(JsonNode message, String address) {
        String fromName = message.path("fromName").asText("");
        String html = message.path("html").asText(null);
        List<EmailAttachment> attachments = new ArrayList<>();
        int index = 0;
        for (JsonNode attachment : message.path("attachments")) {
            attachments.add(EmailAttachment.builder()
                .id(String.valueOf(index))
                .filename(attachment.path("filename").asText("attachment_" + index))
                .contentType(attachment.path("contentType").asText("application/octet-stream"))
                .size(attachment.path("size").asLong(0))
                .inline(attachment.path("inline").asBoolean(false))
                .build());
            index++;
        }
        return EmailMessage.builder()
            .id(message.path("mail_id").asText())
            .from(new EmailContact(message.path("fromEmail").asText(""), fromName.isEmpty() ? null : fromName))
            .to(List.of(EmailContact.of(address)))
            .subject(message.path("subject").asText(""))
            .textContent(message.path("text").asText(null))
            .htmlContent(html)
            .receivedAt(MailContentSupport.parseDate(message.path("date").asText(null), clock))
            .read(false)
            .provider(NAME)
            .attachments(attachments.isEmpty() ? null : attachments)
            .build();
    }
}
