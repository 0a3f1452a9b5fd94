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
import com.clapgrow.tempmail.provider.support.AbstractMailProvider;
import com.clapgrow.tempmail.provider.support.MailContentSupport;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * EtempMail (etempmail.com).
 *
 * The vendor keys the mailbox on a {@code ci_session} cookie, obtained lazily and
 * shared by every address this adapter creates. Domains are switched by numeric id
 * before an address is issued. Messages carry no id, so the inbox position is used.
 */
@Slf4j
public class EtempMailProvider extends AbstractMailProvider {

    public static final String NAME = "etempmail";

    static final String DEFAULT_BASE_URL = "https://etempmail.com";
    static final String SESSION_COOKIE = "ci_session";

    private static final Duration ADDRESS_LIFETIME = Duration.ofMinutes(15);

    private static final Map<String, String> DOMAIN_IDS;

    static {
        Map<String, String> ids = new LinkedHashMap<>();
        ids.put("ohm.edu.pl", "21");
        ids.put("cross.edu.pl", "20");
        ids.put("usa.edu.pl", "19");
        ids.put("beta.edu.pl", "18");
        DOMAIN_IDS = Map.copyOf(ids);
    }

    private static final ProviderCapabilities CAPABILITIES = ProviderCapabilities.builder()
        .createEmail(true)
        .listEmails(true)
        .getEmailContent(true)
        .customDomains(true)
        .emailExpiration(true)
        .build();

    private final AtomicReference<String> sessionId = new AtomicReference<>();

    public EtempMailProvider(ResilientHttpInvoker httpInvoker, ProviderErrorClassifier errorClassifier, Clock clock) {
        super(NAME, CAPABILITIES, httpInvoker, errorClassifier, clock);
    }

    @Override
    protected Mono<CreatedEmail> doCreateEmailAddress(CreateEmailRequest request) {
        return session()
            .flatMap(session -> changeDomain(session, request).thenReturn(session))
            .flatMap(session -> send(sessionRequest(baseUrl(DEFAULT_BASE_URL) + "/getEmailAddress", session)))
            .map(result -> {
                JsonNode body = requireSuccess(result, "EtempMail").json();
                String address = body.path("address").asText(null);
                if (address == null || address.isBlank()) {
                    throw apiError("Invalid response from EtempMail API: missing address");
                }
                Instant createdAt = body.hasNonNull("creation_time")
                    ? MailContentSupport.parseDate(body.path("creation_time").asText(), clock)
                    : clock.instant();
                return CreatedEmail.builder()
                    .address(address)
                    .domain(MailContentSupport.domain(address))
                    .username(MailContentSupport.username(address))
                    .expiresAt(createdAt.plus(ADDRESS_LIFETIME))
                    .provider(NAME)
                    .recoveryKey(body.path("recover_key").asText(null))
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
        return send(ajaxRequest(baseUrl(DEFAULT_BASE_URL) + "/getServerTime").build());
    }

    private Mono<List<EmailMessage>> inbox(String address) {
        return session()
            .flatMap(session -> send(sessionRequest(baseUrl(DEFAULT_BASE_URL) + "/getInbox", session)))
            .map(result -> {
                JsonNode body = requireSuccess(result, "EtempMail").json();
                List<EmailMessage> messages = new ArrayList<>();
                if (body.isArray()) {
                    int index = 0;
                    for (JsonNode message : body) {
                        messages.add(toMessage(message, address, index++));
                    }
                }
                return messages;
            });
    }

    /**
     * Current session id, requesting one from the vendor when none is held yet.
     */
    Mono<String> session() {
        return Mono.defer(() -> {
            String current = sessionId.get();
            if (current != null) {
                return Mono.just(current);
            }
            return send(ajaxRequest(baseUrl(DEFAULT_BASE_URL) + "/getServerTime").build())
                .map(result -> {
                    String issued = requireSuccess(result, "EtempMail").cookie(SESSION_COOKIE)
                        .orElseThrow(() -> apiError("EtempMail did not issue a session cookie"));
                    sessionId.compareAndSet(null, issued);
                    log.debug("EtempMail session established");
                    return sessionId.get();
                });
        });
    }

    /**
     * Point the session at the requested domain, or a random one when none was requested.
     * Unknown domains keep the vendor's current domain. Failures are logged and ignored.
     */
    private Mono<Void> changeDomain(String session, CreateEmailRequest request) {
        String domainId;
        if (request.hasDomain()) {
            domainId = DOMAIN_IDS.get(request.domain().trim().toLowerCase(Locale.ROOT));
            if (domainId == null) {
                log.info("EtempMail does not serve {}, keeping current domain", request.domain());
                return Mono.empty();
            }
        } else {
            domainId = MailContentSupport.randomElement(List.copyOf(DOMAIN_IDS.values()));
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("id", domainId);
        HttpInvocation invocation = request(baseUrl(DEFAULT_BASE_URL) + "/changeEmailAddress")
            .method(HttpMethod.POST)
            .header(HttpHeaders.COOKIE, SESSION_COOKIE + "=" + session)
            .header("origin", baseUrl(DEFAULT_BASE_URL))
            .header("referer", baseUrl(DEFAULT_BASE_URL) + "/")
            .formData(form)
            .build();

        return send(invocation)
            .doOnNext(result -> {
                if (result.status() == 307 || result.ok()) {
                    log.info("EtempMail domain changed to id {}", domainId);
                } else {
                    log.warn("EtempMail domain change to id {} returned {}", domainId, result.status());
                }
            })
            .onErrorResume(e -> {
                log.warn("Failed to change EtempMail domain: {}", e.toString());
                return Mono.empty();
            })
            .then();
    }

    private HttpInvocation.HttpInvocationBuilder ajaxRequest(String url) {
        return request(url)
            .method(HttpMethod.POST)
            .header("accept", "*/*")
            .header("origin", baseUrl(DEFAULT_BASE_URL))
            .header("referer", baseUrl(DEFAULT_BASE_URL) + "/")
            .header("x-requested-with", "XMLHttpRequest");
    }

    private HttpInvocation sessionRequest(String url, String session) {
        return ajaxRequest(url).header(HttpHeaders.COOKIE, SESSION_COOKIE + "=" + session).build();
    }

    private EmailMessage toMessage(JsonNode message, String address, int index) {
        String body = message.path("body").asText("");
        return EmailMessage.builder()
            .id(String.valueOf(index))
            .from(EmailContact.of(message.path("from").asText("")))
            .to(List.of(EmailContact.of(address)))
            .subject(message.path("subject").asText(""))
            .textContent(MailContentSupport.stripHtml(body))
            .htmlContent(body)
            .receivedAt(MailContentSupport.parseDate(message.path("date").asText(null), clock))
            .read(false)
            .provider(NAME)
            .size((long) body.length())
            .build();
    }
}
