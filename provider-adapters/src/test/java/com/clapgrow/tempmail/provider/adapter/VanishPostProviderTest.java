package com.clapgrow.tempmail.provider.adapter;

import com.clapgrow.tempmail.common.error.ProviderErrorClassifier;
import com.clapgrow.tempmail.common.error.ProviderErrorKind;
import com.clapgrow.tempmail.common.model.CreatedEmail;
import com.clapgrow.tempmail.common.model.EmailContact;
import com.clapgrow.tempmail.common.model.EmailListQuery;
import com.clapgrow.tempmail.common.model.EmailMessage;
import com.clapgrow.tempmail.common.provider.OperationEnvelope;
import com.clapgrow.tempmail.common.provider.ProviderConfiguration;
import com.clapgrow.tempmail.common.provider.ProviderStatus;
import com.clapgrow.tempmail.provider.support.StubVendor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.ClientRequest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VanishPostProviderTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String ADDRESS = "neo@genmacos.com";
    private static final String INBOX = "{\"success\":true,\"totalCount\":2,\"emails\":["
        + "{\"mail_id\":\"v1\",\"fromName\":\"Alice\",\"fromEmail\":\"alice@example.com\",\"subject\":\"Hi\","
        + "\"text\":\"Hello\",\"html\":\"<p>Hello</p>\",\"date\":\"2024-04-30T08:00:00Z\","
        + "\"attachments\":[{\"filename\":\"a.pdf\",\"contentType\":\"application/pdf\",\"size\":12}]},"
        + "{\"mail_id\":\"v2\",\"fromEmail\":\"bob@example.com\",\"subject\":\"Re\",\"text\":\"plain\","
        + "\"attachments\":[]}]}";

    private StubVendor vendor;
    private VanishPostProvider provider;

    @BeforeEach
    void setUp() {
        vendor = new StubVendor();
        provider = new VanishPostProvider(vendor.invoker(), new ProviderErrorClassifier(),
            Clock.fixed(NOW, ZoneOffset.UTC));
        provider.initialize(ProviderConfiguration.builder().name(VanishPostProvider.NAME).retries(0).build());
    }

    @Test
    void testCreateSendsSessionHeaders() {
        vendor.json(HttpMethod.POST, "/api/generate", 200,
            "{\"success\":true,\"emailAddress\":\"neo@genmacos.com\",\"expirationDate\":\"2024-05-01T10:15:00Z\"}");

        OperationEnvelope<CreatedEmail> result = provider.createEmailAddress(null).block();

        assertTrue(result.success());
        CreatedEmail created = result.data();
        assertEquals(ADDRESS, created.address());
        assertEquals("genmacos.com", created.domain());
        assertEquals("neo", created.username());
        assertEquals(Instant.parse("2024-05-01T10:15:00Z"), created.expiresAt());
        assertEquals(VanishPostProvider.NAME, created.provider());

        ClientRequest request = vendor.last("/api/generate");
        String session = provider.sessionId();
        assertNotNull(session);
        assertEquals(32, session.length());
        assertEquals(session, request.headers().getFirst("session-id"));
        assertEquals(session, request.headers().getFirst("x-session-id"));
    }

    @Test
    void testSessionIdSurvivesSecondCreate() {
        vendor.json(HttpMethod.POST, "/api/generate", 200,
            "{\"success\":true,\"emailAddress\":\"neo@genmacos.com\",\"expirationDate\":\"2024-05-01T10:15:00Z\"}");

        provider.createEmailAddress(null).block();
        String first = provider.sessionId();
        provider.createEmailAddress(null).block();

        assertEquals(first, provider.sessionId());
        assertEquals(first, vendor.last("/api/generate").headers().getFirst("session-id"));
    }

    @Test
    void testRateLimitedCreate() {
        vendor.json(HttpMethod.POST, "/api/generate", 429, "{\"success\":false}");

        OperationEnvelope<CreatedEmail> result = provider.createEmailAddress(null).block();

        assertFalse(result.success());
        assertEquals(ProviderErrorKind.RATE_LIMIT, result.error().kind());
        assertTrue(result.error().retryable());
        assertTrue(result.error().message().contains("15 minutes"));
        assertEquals(429, result.error().statusCode());
        assertEquals(ProviderStatus.RATE_LIMITED, provider.getHealth().block().status());
    }

    @Test
    void testUnsuccessfulGenerateFails() {
        vendor.json(HttpMethod.POST, "/api/generate", 200, "{\"success\":false}");

        OperationEnvelope<CreatedEmail> result = provider.createEmailAddress(null).block();

        assertFalse(result.success());
        assertEquals(ProviderErrorKind.API, result.error().kind());
        assertEquals("Failed to generate email address", result.error().message());
    }

    @Test
    void testListMapsMessages() {
        vendor.json(HttpMethod.GET, "/api/emails/" + ADDRESS, 200, INBOX);

        List<EmailMessage> messages = provider.listMessages(
            EmailListQuery.builder().address(ADDRESS).build()).block().data();

        assertEquals(2, messages.size());
        EmailMessage first = messages.get(0);
        assertEquals("v1", first.getId());
        assertEquals(new EmailContact("alice@example.com", "Alice"), first.getFrom());
        assertEquals(List.of(EmailContact.of(ADDRESS)), first.getTo());
        assertEquals("Hello", first.getTextContent());
        assertEquals("<p>Hello</p>", first.getHtmlContent());
        assertEquals(Instant.parse("2024-04-30T08:00:00Z"), first.getReceivedAt());
        assertFalse(first.isRead());
        assertEquals(1, first.getAttachments().size());
        assertEquals("a.pdf", first.getAttachments().get(0).filename());
        assertEquals(12, first.getAttachments().get(0).size());

        EmailMessage second = messages.get(1);
        assertNull(second.getFrom().name());
        assertNull(second.getAttachments());
        assertEquals(NOW, second.getReceivedAt());
    }

    @Test
    void testListFailureFlag() {
        vendor.json(HttpMethod.GET, "/api/emails/" + ADDRESS, 200, "{\"success\":false}");

        OperationEnvelope<List<EmailMessage>> result = provider.listMessages(
            EmailListQuery.builder().address(ADDRESS).build()).block();

        assertFalse(result.success());
        assertEquals("Failed to get emails", result.error().message());
    }

    @Test
    void testFetchMessageByMailId() {
        vendor.json(HttpMethod.GET, "/api/emails/" + ADDRESS, 200, INBOX);

        assertEquals("Re", provider.fetchMessage(ADDRESS, "v2", null).block().data().getSubject());

        OperationEnvelope<EmailMessage> missing = provider.fetchMessage(ADDRESS, "v9", null).block();
        assertFalse(missing.success());
        assertEquals("Email with ID v9 not found", missing.error().message());
    }

    @Test
    void testConnectivityHitsHomePage() {
        vendor.json(HttpMethod.GET, "/", 200, "{}");

        assertTrue(provider.testConnectivity().block().success());
        assertEquals(1, vendor.count("/"));
    }
}
