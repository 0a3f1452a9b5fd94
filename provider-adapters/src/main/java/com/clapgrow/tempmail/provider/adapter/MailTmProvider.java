package com.clapgrow.tempmail.provider.adapter;

import com.clapgrow.tempmail.common.error.ProviderErrorClassifier;
import com.clapgrow.tempmail.common.error.ProviderErrorKind;
import com.clapgrow.tempmail.common.error.ProviderException;
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
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mail.tm (api.mail.tm).
 *
 * Every address is a vendor account with a random password; the bearer token
 * issued for it is returned to the caller as {@code accessToken} and also kept
 * in a bounded per-address cache for callers that do not send it back.
 */
@Slf4j
public class MailTmProvider extends AbstractMailProvider {

    public static final String NAME = "mailtm";

    static final String DEFAULT_BASE_URL = "https://api.mail.tm";
    static final String FALLBACK_DOMAIN = "somoj.com";

    private static final Duration ACCOUNT_LIFETIME = Duration.ofDays(7);
    private static final String PASSWORD_CHARS =
        "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789!@#$%^&*";
    private static final String MISSING_TOKEN_MESSAGE = "No authentication token provided. "
        + "Please provide accessToken parameter or ensure email was created through this service.";

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.builder()
        .createEmail(true)
        .listEmails(true)
        .getEmailContent(true)
        .customPrefix(true)
        .emailExpiration(true)
        .attachmentSupport(true)
        .build();

    private final Cache<String, String> tokens = Caffeine.newBuilder()
        .maximumSize(10_000)
        .expireAfterWrite(ACCOUNT_LIFETIME)
        .build();

    private volatile List<String> availableDomains = List.of(FALLBACK_DOMAIN);

    public MailTmProvider(ResilientHttpInvoker httpInvoker, ProviderErrorClassifier errorClassifier, Clock clock) {
        super(NAME, CAPABILITIES, httpInvoker, errorClassifier, clock);
    }

    @Override
    protected void onInitialize(ProviderConfiguration configuration) {
        if (!configuration.getDomains().isEmpty()) {
            availableDomains = List.copyOf(configuration.getDomains());
        }
    }

    @Override
    protected Mono<Void> warmUp() {
        return send(jsonRequest(baseUrl(DEFAULT_BASE_URL) + "/domains").build())
            .doOnNext(result -> {
                List<String> domains = new ArrayList<>();
                for (JsonNode domain : requireSuccess(result, "Mail.tm").json().path("hydra:member")) {
                    if (domain.path("isActive").asBoolean(false) && !domain.path("isPrivate").asBoolean(false)) {
                        domains.add(domain.path("domain").asText());
                    }
                }
                if (!domains.isEmpty()) {
                    availableDomains = List.copyOf(domains);
                }
                log.info("Mail.tm domains loaded: {}", availableDomains);
            })
            .then();
    }

    List<String> getAvailableDomains() {
        return availableDomains;
    }

    @Override
    protected Mono<CreatedEmail> doCreateEmailAddress(CreateEmailRequest request) {
        String prefix = request.hasPrefix() ? request.prefix().trim() : MailContentSupport.randomString(10);
        String domain = availableDomains.get(0);
        String address = prefix + "@" + domain;
        Map<String, String> credentials = Map.of(
            "address", address,
            "password", MailContentSupport.randomString(12, PASSWORD_CHARS));

        return send(jsonRequest(baseUrl(DEFAULT_BASE_URL) + "/accounts").method(HttpMethod.POST).body(credentials).build())
            .map(result -> requireStep(result, "Failed to create account"))
            .then(Mono.defer(() -> send(jsonRequest(baseUrl(DEFAULT_BASE_URL) + "/token")
                .method(HttpMethod.POST)
                .body(credentials)
                .build())))
            .map(result -> {
                String token = requireStep(result, "Failed to get token").json().path("token").asText(null);
                if (token == null || token.isBlank()) {
                    throw apiError("Mail.tm token response did not contain a token");
                }
                tokens.put(address, token);
                return CreatedEmail.builder()
                    .address(address)
                    .domain(domain)
                    .username(prefix)
                    .provider(NAME)
                    .accessToken(token)
                    .expiresAt(clock.instant().plus(ACCOUNT_LIFETIME))
                    .build();
            });
    }

    @Override
    protected Mono<List<EmailMessage>> doListMessages(EmailListQuery query) {
        String token = resolveToken(query.address(), query.accessToken());
        return send(authorized(baseUrl(DEFAULT_BASE_URL) + "/messages", token))
            .map(result -> {
                JsonNode body = requireSuccess(result, "Mail.tm").json();
                JsonNode items = body.isArray() ? body : body.path("hydra:member");
                List<EmailMessage> messages = new ArrayList<>();
                for (JsonNode item : items) {
                    messages.add(toSummary(item));
                }
                return messages;
            });
    }

    @Override
    protected Mono<EmailMessage> doFetchMessage(String address, String messageId, String accessToken) {
        String token = resolveToken(address, accessToken);
        return send(authorized(baseUrl(DEFAULT_BASE_URL) + "/messages/" + messageId, token))
            .map(result -> toDetail(requireSuccess(result, "Mail.tm").json()));
    }

    @Override
    protected Mono<HttpResult> doTestConnectivity() {
        return send(jsonRequest(baseUrl(DEFAULT_BASE_URL) + "/domains").build());
    }

    private String resolveToken(String address, String accessToken) {
        if (accessToken != null && !accessToken.isBlank()) {
            return accessToken;
        }
        String cached = tokens.getIfPresent(address);
        if (cached == null) {
            throw error(ProviderErrorKind.AUTHENTICATION, MISSING_TOKEN_MESSAGE);
        }
        return cached;
    }

    private HttpResult requireStep(HttpResult result, String step) {
        if (!result.ok()) {
            throw new ProviderException(
                errorClassifier.fromStatus(result.status(), step + ": " + result.status(), NAME));
        }
        return result;
    }

    private HttpInvocation.HttpInvocationBuilder jsonRequest(String url) {
        return request(url).header(HttpHeaders.ACCEPT, "application/json");
    }

    private HttpInvocation authorized(String url, String token) {
        return jsonRequest(url).header(HttpHeaders.AUTHORIZATION, "Bearer " + token).build();
    }

    private EmailMessage toSummary(JsonNode message) {
        return EmailMessage.builder()
            .id(message.path("id").asText())
            .from(contact(message.path("from")))
            .to(contacts(message.path("to")))
            .subject(message.path("subject").asText(""))
            .textContent(message.path("intro").asText(null))
            .receivedAt(MailContentSupport.parseDate(message.path("createdAt").asText(null), clock))
            .read(message.path("seen").asBoolean(false))
            .provider(NAME)
            .messageId(message.path("msgid").asText(null))
            .size(message.hasNonNull("size") ? message.path("size").asLong() : null)
            .attachments(message.path("hasAttachments").asBoolean(false) ? List.of() : null)
            .headers(Map.of("X-Content-Type", "preview", "X-Has-Full-Content", "true"))
            .build();
    }

    private EmailMessage toDetail(JsonNode detail) {
        JsonNode html = detail.path("html");
        String htmlContent;
        if (html.isArray()) {
            StringBuilder joined = new StringBuilder();
            html.forEach(part -> joined.append(part.asText()));
            htmlContent = joined.toString();
        } else {
            htmlContent = html.asText(null);
        }
        return toSummary(detail).toBuilder()
            .cc(detail.has("cc") ? contacts(detail.path("cc")) : null)
            .bcc(detail.has("bcc") ? contacts(detail.path("bcc")) : null)
            .textContent(detail.path("text").asText(null))
            .htmlContent(htmlContent)
            .headers(Map.of("X-Content-Type", "full", "X-Has-Full-Content", "true"))
            .build();
    }

    private static EmailContact contact(JsonNode node) {
        String name = node.path("name").asText("");
        return new EmailContact(node.path("address").asText(""), name.isBlank() ? null : name);
    }

    private static List<EmailContact> contacts(JsonNode nodes) {
        List<EmailContact> contacts = new ArrayList<>();
        for (JsonNode node : nodes) {
            contacts.add(contact(node));
        }
        return contacts;
    }
}
