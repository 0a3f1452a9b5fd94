package com.clapgrow.tempmail.provider.adapter;

import com.clapgrow.tempmail.common.error.ProviderErrorClassifier;
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
import com.clapgrow.tempmail.provider.support.RequestIds;
import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MinMail (minmail.app).
 *
 * Mailboxes are bound to a {@code visitor-id} header generated once per adapter.
 * The list endpoint already carries full message content, so fetching a single
 * message is a list followed by a lookup.
 */
public class MinMailProvider extends AbstractMailProvider {

    public static final String NAME = "minmail";

    static final String DEFAULT_BASE_URL = "https://minmail.app/api";

    private static final int DEFAULT_EXPIRATION_MINUTES = 1440;
    private static final Pattern FROM_PATTERN = Pattern.compile("^\"?([^\"]*)\"?\\s*<(.+)>$");

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.builder()
        .createEmail(true)
        .listEmails(true)
        .getEmailContent(true)
        .emailExpiration(true)
        .build();

    private final AtomicReference<String> visitorId = new AtomicReference<>();

    public MinMailProvider(ResilientHttpInvoker httpInvoker, ProviderErrorClassifier errorClassifier, Clock clock) {
        super(NAME, CAPABILITIES, httpInvoker, errorClassifier, clock);
    }

    @Override
    protected void onInitialize(ProviderConfiguration configuration) {
        visitorId();
    }

    String visitorId() {
        return visitorId.updateAndGet(current -> current != null ? current : RequestIds.next(clock));
    }

    @Override
    protected Mono<CreatedEmail> doCreateEmailAddress(CreateEmailRequest request) {
        int expire = request.hasExpiration() ? request.expirationMinutes() : DEFAULT_EXPIRATION_MINUTES;
        return send(mailboxRequest(addressUrl(expire)))
            .map(result -> {
                JsonNode body = requireSuccess(result, "MinMail").json();
                String address = body.path("address").asText(null);
                if (address == null || address.isBlank()) {
                    throw apiError("Invalid response from MinMail API: missing address");
                }
                Instant expiresAt = body.hasNonNull("remainingTime")
                    ? clock.instant().plusSeconds(body.path("remainingTime").asLong())
                    : null;
                return CreatedEmail.builder()
                    .address(address)
                    .domain(MailContentSupport.domain(address))
                    .username(MailContentSupport.username(address))
                    .expiresAt(expiresAt)
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
        return send(mailboxRequest(addressUrl(1)));
    }

    private Mono<List<EmailMessage>> inbox(String address) {
        return send(mailboxRequest(baseUrl(DEFAULT_BASE_URL) + "/mail/list?part=main"))
            .map(result -> {
                JsonNode body = requireSuccess(result, "MinMail").json();
                List<EmailMessage> messages = new ArrayList<>();
                for (JsonNode message : body.path("message")) {
                    messages.add(toMessage(message, address));
                }
                return messages;
            });
    }

    private String addressUrl(int expireMinutes) {
        return baseUrl(DEFAULT_BASE_URL) + "/mail/address?refresh=true&expire=" + expireMinutes + "&part=main";
    }

    private HttpInvocation mailboxRequest(String url) {
        return request(url)
            .header("accept", "*/*")
            .header("referer", "https://minmail.app/")
            .header("visitor-id", visitorId())
            .build();
    }

    private EmailMessage toMessage(JsonNode message, String address) {
        String content = message.path("content").asText("");
        return EmailMessage.builder()
            .id(message.path("id").asText())
            .from(parseFrom(message.path("from").asText("")))
            .to(List.of(EmailContact.of(address)))
            .subject(message.path("subject").asText(""))
            .textContent(MailContentSupport.stripHtml(content))
            .htmlContent(content)
            .receivedAt(MailContentSupport.parseDate(message.path("date").asText(null), clock))
            .read(message.path("isRead").asBoolean(false))
            .provider(NAME)
            .size((long) content.length())
            .build();
    }

    static EmailContact parseFrom(String from) {
        Matcher matcher = FROM_PATTERN.matcher(from.trim());
        if (matcher.matches()) {
            String name = matcher.group(1).trim();
            return new EmailContact(matcher.group(2).trim(), name.isEmpty() ? null : name);
        }
        return EmailContact.of(from.trim());
    }
}
