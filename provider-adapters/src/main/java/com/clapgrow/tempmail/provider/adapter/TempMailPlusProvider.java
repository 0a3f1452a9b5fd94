package com.clapgrow.tempmail.provider.adapter;

import com.clapgrow.tempmail.common.error.ProviderErrorClassifier;
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
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * TempMail Plus (tempmail.plus).
 *
 * The vendor has no create endpoint: any local part on its domains is a live
 * mailbox, so addresses are generated locally.
 */
public class TempMailPlusProvider extends AbstractMailProvider {

    public static final String NAME = "tempmailplus";

    public static final List<String> DOMAINS = List.of(
        "mailto.plus", "fexpost.com", "fexbox.org", "mailbox.in.ua", "rover.info",
        "chitthi.in", "fextemp.com", "any.pink", "merepost.com");

    static final String DEFAULT_BASE_URL = "https://tempmail.plus/api";

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.builder()
        .createEmail(true)
        .listEmails(true)
        .getEmailContent(true)
        .customDomains(true)
        .customPrefix(true)
        .attachmentSupport(true)
        .build();

    public TempMailPlusProvider(ResilientHttpInvoker httpInvoker, ProviderErrorClassifier errorClassifier, Clock clock) {
        super(NAME, CAPABILITIES, httpInvoker, errorClassifier, clock);
    }

    @Override
    protected Mono<CreatedEmail> doCreateEmailAddress(CreateEmailRequest request) {
        String prefix = request.hasPrefix() ? request.prefix().trim() : MailContentSupport.randomString(8);
        String domain = request.hasDomain() && DOMAINS.contains(request.domain().trim().toLowerCase(Locale.ROOT))
            ? request.domain().trim().toLowerCase(Locale.ROOT)
            : MailContentSupport.randomElement(DOMAINS);
        return Mono.just(CreatedEmail.builder()
            .address(prefix + "@" + domain)
            .domain(domain)
            .username(prefix)
            .provider(NAME)
            .build());
    }

    @Override
    protected Mono<List<EmailMessage>> doListMessages(EmailListQuery query) {
        int limit = query.effectiveOffset() + query.effectiveLimit();
        return send(vendorRequest(listUrl(query.address(), limit)))
            .map(result -> {
                JsonNode body = requireSuccess(result, "TempMail Plus").json();
                if (!body.path("result").asBoolean(false)) {
                    throw apiError("TempMail Plus API returned unsuccessful result");
                }
                List<EmailMessage> messages = new ArrayList<>();
                for (JsonNode message : body.path("mail_list")) {
                    messages.add(toSummary(message, query.address()));
                }
                return messages;
            });
    }

    @Override
    protected Mono<EmailMessage> doFetchMessage(String address, String messageId, String accessToken) {
        String url = UriComponentsBuilder.fromUriString(baseUrl(DEFAULT_BASE_URL) + "/mails/{id}")
            .queryParam("email", "{email}")
            .queryParam("epin", "")
            .encode()
            .buildAndExpand(messageId, address)
            .toUriString();
        return send(vendorRequest(url))
            .map(result -> {
                JsonNode body = requireSuccess(result, "TempMail Plus").json();
                if (!body.path("result").asBoolean(false)) {
                    throw apiError("Email not found or API error");
                }
                return toDetail(body, address);
            });
    }

    @Override
    protected Mono<HttpResult> doTestConnectivity() {
        return send(vendorRequest(listUrl("test123@" + DOMAINS.get(0), 1)));
    }

    private String listUrl(String address, int limit) {
        return UriComponentsBuilder.fromUriString(baseUrl(DEFAULT_BASE_URL) + "/mails")
            .queryParam("email", "{email}")
            .queryParam("limit", limit)
            .queryParam("epin", "")
            .encode()
            .buildAndExpand(address)
            .toUriString();
    }

    private HttpInvocation vendorRequest(String url) {
        return request(url)
            .header("accept", "application/json, text/javascript, */*; q=0.01")
            .header("referer", "https://tempmail.plus/")
            .header("x-requested-with", "XMLHttpRequest")
            .build();
    }

    private EmailMessage toSummary(JsonNode message, String address) {
        return EmailMessage.builder()
            .id(message.path("mail_id").asText())
            .from(contact(message))
            .to(List.of(EmailContact.of(address)))
            .subject(message.path("subject").asText(""))
            .receivedAt(MailContentSupport.parseDate(message.path("time").asText(null), clock))
            .read(!message.path("is_new").asBoolean(false))
            .provider(NAME)
            .attachments(message.path("attachment_count").asInt(0) > 0 ? List.of() : null)
            .build();
    }

    private EmailMessage toDetail(JsonNode detail, String address) {
        String messageId = detail.path("message_id").asText(null);
        Map<String, String> headers = new LinkedHashMap<>();
        putIfPresent(headers, "Message-ID", messageId);
        putIfPresent(headers, "From", detail.path("from").asText(null));
        putIfPresent(headers, "To", detail.path("to").asText(null));
        putIfPresent(headers, "Date", detail.path("date").asText(null));

        List<EmailAttachment> attachments = new ArrayList<>();
        for (JsonNode attachment : detail.path("attachments")) {
            attachments.add(EmailAttachment.builder()
                .id(attachment.path("attachment_id").asText(attachment.path("id").asText(null)))
                .filename(attachment.path("name").asText(null))
                .contentType(attachment.path("content_type").asText(null))
                .size(attachment.path("size").asLong(0))
                .build());
        }

        return EmailMessage.builder()
            .id(detail.path("mail_id").asText())
            .from(contact(detail))
            .to(List.of(EmailContact.of(address)))
            .subject(detail.path("subject").asText(""))
            .textContent(detail.path("text").asText(null))
            .htmlContent(detail.path("html").asText(null))
            .receivedAt(MailContentSupport.parseDate(detail.path("date").asText(null), clock))
            .read(true)
            .provider(NAME)
            .messageId(messageId)
            .attachments(attachments)
            .headers(headers)
            .build();
    }

    private static EmailContact contact(JsonNode node) {
        String name = node.path("from_name").asText("");
        return new EmailContact(node.path("from_mail").asText(""), name.isBlank() ? null : name);
    }

    private static void putIfPresent(Map<String, String> headers, String key, String value) {
        if (value != null && !value.isBlank()) {
            headers.put(key, value);
        }
    }
}
