package com.clapgrow.tempmail.provider.support;

import com.clapgrow.tempmail.common.error.ProviderErrorClassifier;
import com.clapgrow.tempmail.common.error.ProviderErrorKind;
import com.clapgrow.tempmail.common.model.CreateEmailRequest;
import com.clapgrow.tempmail.common.model.CreatedEmail;
import com.clapgrow.tempmail.common.model.EmailListQuery;
import com.clapgrow.tempmail.common.model.EmailMessage;
import com.clapgrow.tempmail.common.provider.OperationEnvelope;
import com.clapgrow.tempmail.common.provider.ProviderConfiguration;
import com.clapgrow.tempmail.common.provider.ProviderHealth;
import com.clapgrow.tempmail.common.provider.ProviderStatistics;
import com.clapgrow.tempmail.common.provider.ProviderStatus;
import com.clapgrow.tempmail.provider.adapter.TempMailPlusProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class AbstractMailProviderTest {

    private static final String MAILS = "/api/mails";
    private static final String EMPTY_INBOX = "{\"result\":true,\"mail_list\":[]}";

    private StubVendor vendor;
    private TempMailPlusProvider provider;

    @BeforeEach
    void setUp() {
        vendor = new StubVendor();
        provider = new TempMailPlusProvider(vendor.invoker(), new ProviderErrorClassifier(), Clock.systemUTC());
        provider.initialize(ProviderConfiguration.builder()
            .name(TempMailPlusProvider.NAME)
            .timeout(Duration.ofSeconds(2))
            .retries(0)
            .build());
    }

    private OperationEnvelope<List<EmailMessage>> list(String address) {
        return provider.listMessages(EmailListQuery.builder().address(address).build()).block();
    }

    @Test
    void testTotalRequestsNeverDecreaseUnderConcurrentCalls() {
        int calls = 32;
        vendor.on(HttpMethod.GET, MAILS, request -> Mono.delay(Duration.ofMillis(5))
            .map(tick -> StubVendor.jsonResponse(200, EMPTY_INBOX)));

        CompletableFuture<List<OperationEnvelope<List<EmailMessage>>>> done = Flux.range(0, calls)
            .flatMap(i -> provider.listMessages(EmailListQuery.builder().address("abc@mailto.plus").build())
                .subscribeOn(Schedulers.parallel()))
            .collectList()
            .toFuture();

        long previous = 0;
        while (!done.isDone()) {
            long current = provider.getStatistics().totalRequests();
            assertTrue(current >= previous, "total requests went from " + previous + " to " + current);
            previous = current;
        }
        long total = provider.getStatistics().totalRequests();
        assertTrue(total >= previous);
        assertTrue(total <= calls);
        assertEquals(calls, total);
        assertTrue(done.join().stream().allMatch(OperationEnvelope::success));
        assertEquals(calls, provider.getStatistics().successfulRequests());
    }

    @Test
    void testInitializePerformsNoNetworkCalls() {
        assertTrue(vendor.requests().isEmpty());
        assertEquals(0, provider.getStatistics().totalRequests());
    }

    @Test
    void testStatisticsCountSuccessesAndFailures() {
        vendor.json(HttpMethod.GET, MAILS, 500, "{\"error\":\"boom\"}");

        for (int i = 0; i < 3; i++) {
            assertTrue(provider.createEmailAddress(CreateEmailRequest.empty()).block().success());
        }
        OperationEnvelope<List<EmailMessage>> failed = list("abc@mailto.plus");
        list("abc@mailto.plus");

        assertFalse(failed.success());
        assertEquals(ProviderErrorKind.API, failed.error().kind());
        assertEquals(500, failed.error().statusCode());
        assertTrue(failed.error().retryable());
        assertEquals(TempMailPlusProvider.NAME, failed.metadata().provider());

        ProviderStatistics statistics = provider.getStatistics();
        assertEquals(5, statistics.totalRequests());
        assertEquals(3, statistics.successfulRequests());
        assertEquals(2, statistics.failedRequests());
        assertEquals(2, statistics.errorsToday());
        assertNotNull(statistics.lastRequestTime());
    }

    @Test
    void testHealthIsProbedOnceAndCached() {
        vendor.json(HttpMethod.GET, MAILS, 200, EMPTY_INBOX);

        ProviderHealth first = provider.getHealth().block();
        ProviderHealth second = provider.getHealth().block();

        assertEquals(ProviderStatus.ACTIVE, first.status());
        assertEquals(first.lastChecked(), second.lastChecked());
        assertEquals(1, vendor.count(MAILS));
        assertEquals(0, provider.getStatistics().totalRequests());

        provider.refreshHealth().block();
        assertEquals(2, vendor.count(MAILS));
    }

    @Test
    void testFailedProbeReportsError() {
        vendor.json(HttpMethod.GET, MAILS, 503, "{}");

        ProviderHealth health = provider.getHealth().block();

        assertEquals(ProviderStatus.ERROR, health.status());
        assertTrue(health.lastError().contains("503"));
    }

    @Test
    void testRateLimitSetsStatusUntilNextSuccess() {
        vendor.json(HttpMethod.GET, MAILS, 429, "{\"error\":\"slow down\"}");

        OperationEnvelope<List<EmailMessage>> limited = list("abc@mailto.plus");
        assertEquals(ProviderErrorKind.RATE_LIMIT, limited.error().kind());
        assertEquals(ProviderStatus.RATE_LIMITED, provider.getHealth().block().status());

        vendor.json(HttpMethod.GET, MAILS, 200, EMPTY_INBOX);
        assertTrue(list("abc@mailto.plus").success());
        assertEquals(ProviderStatus.ACTIVE, provider.refreshHealth().block().status());
    }

    @Test
    void testTimeoutBecomesFailedEnvelopeAfterRetries() {
        provider.initialize(provider.getConfiguration().toBuilder()
            .timeout(Duration.ofMillis(50))
            .retries(2)
            .build());
        vendor.on(HttpMethod.GET, MAILS, request -> Mono.never());

        OperationEnvelope<List<EmailMessage>> result = list("abc@mailto.plus");

        assertFalse(result.success());
        assertEquals(ProviderErrorKind.TIMEOUT, result.error().kind());
        assertTrue(result.error().retryable());
        assertEquals(3, vendor.count(MAILS));
        assertEquals(1, provider.getStatistics().failedRequests());
    }

    @Test
    void testMissingAddressFailsWithoutVendorCall() {
        OperationEnvelope<List<EmailMessage>> result = list(" ");

        assertFalse(result.success());
        assertEquals("Email address is required", result.error().message());
        assertTrue(vendor.requests().isEmpty());
        assertEquals(1, provider.getStatistics().failedRequests());
    }

    @Test
    void testConnectivityTestDoesNotTouchStatisticsOrHealth() {
        vendor.json(HttpMethod.GET, MAILS, 200, EMPTY_INBOX);

        OperationEnvelope<Boolean> result = provider.testConnectivity().block();

        assertTrue(result.success());
        assertEquals(Boolean.TRUE, result.data());
        assertEquals(0, provider.getStatistics().totalRequests());

        provider.getHealth().block();
        assertEquals(2, vendor.count(MAILS));
    }

    @Test
    void testConnectivityNon2xxIsFailure() {
        vendor.json(HttpMethod.GET, MAILS, 401, "{}");

        OperationEnvelope<Boolean> result = provider.testConnectivity().block();

        assertFalse(result.success());
        assertEquals(ProviderErrorKind.AUTHENTICATION, result.error().kind());
        assertFalse(result.error().retryable());
    }

    @Test
    void testCreateHonoursKnownDomainAndPrefix() {
        CreatedEmail created = provider.createEmailAddress(CreateEmailRequest.builder()
            .domain("FEXBOX.org")
            .prefix("alice")
            .build()).block().data();

        assertEquals("alice@fexbox.org", created.address());
        assertEquals("fexbox.org", created.domain());
        assertEquals("alice", created.username());
        assertEquals(TempMailPlusProvider.NAME, created.provider());
    }

    @Test
    void testCreateIgnoresUnknownDomain() {
        CreatedEmail created = provider.createEmailAddress(CreateEmailRequest.builder()
            .domain("example.com")
            .build()).block().data();

        assertTrue(TempMailPlusProvider.DOMAINS.contains(created.domain()));
        assertEquals(8, created.username().length());
    }
}
