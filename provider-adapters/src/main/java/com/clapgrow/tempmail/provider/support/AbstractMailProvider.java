package com.clapgrow.tempmail.provider.support;

import com.clapgrow.tempmail.common.error.ProviderError;
import com.clapgrow.tempmail.common.error.ProviderErrorClassifier;
import com.clapgrow.tempmail.common.error.ProviderErrorKind;
import com.clapgrow.tempmail.common.error.ProviderException;
import com.clapgrow.tempmail.common.health.ConnectivityProbe;
import com.clapgrow.tempmail.common.health.ProbeResult;
import com.clapgrow.tempmail.common.health.ProviderStatisticsTracker;
import com.clapgrow.tempmail.common.http.HttpInvocation;
import com.clapgrow.tempmail.common.http.HttpResult;
import com.clapgrow.tempmail.common.http.ResilientHttpInvoker;
import com.clapgrow.tempmail.common.model.CreateEmailRequest;
import com.clapgrow.tempmail.common.model.CreatedEmail;
import com.clapgrow.tempmail.common.model.EmailListQuery;
import com.clapgrow.tempmail.common.model.EmailMessage;
import com.clapgrow.tempmail.common.model.MessageQueryFilter;
import com.clapgrow.tempmail.common.provider.MailProvider;
import com.clapgrow.tempmail.common.provider.OperationEnvelope;
import com.clapgrow.tempmail.common.provider.ProviderCapabilities;
import com.clapgrow.tempmail.common.provider.ProviderConfiguration;
import com.clapgrow.tempmail.common.provider.ProviderHealth;
import com.clapgrow.tempmail.common.provider.ProviderStatistics;
import com.clapgrow.tempmail.common.provider.ProviderStatus;
import com.clapgrow.tempmail.common.provider.ResponseMetadata;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Base class for vendor adapters.
 *
 * Owns everything that is not vendor specific:
 * - timing, request ids and envelope construction for every operation
 * - classification of every failure through {@link ProviderErrorClassifier}
 * - statistics and the lazily probed, cached health
 * - list filtering and pagination
 * - an optional one-time warm-up (e.g. loading the vendor's domain list)
 *
 * Subclasses implement the {@code do*} methods and signal failures by erroring
 * their {@link Mono}, usually with a {@link ProviderException}.
 */
@Slf4j
public abstract class AbstractMailProvider implements MailProvider {

    private final String name;
    private final ProviderCapabilities capabilities;
    private final ProviderStatisticsTracker statistics;
    private final ConnectivityProbe connectivityProbe;
    private final AtomicReference<Mono<Void>> warmUp = new AtomicReference<>();

    protected final ResilientHttpInvoker httpInvoker;
    protected final ProviderErrorClassifier errorClassifier;
    protected final Clock clock;

    private volatile ProviderConfiguration configuration;

    protected AbstractMailProvider(String name,
                                   ProviderCapabilities capabilities,
                                   ResilientHttpInvoker httpInvoker,
                                   ProviderErrorClassifier errorClassifier,
                                   Clock clock) {
        this.name = name;
        this.capabilities = capabilities;
        this.httpInvoker = httpInvoker;
        this.errorClassifier = errorClassifier;
        this.clock = clock;
        this.statistics = new ProviderStatisticsTracker(clock);
        this.connectivityProbe = new ConnectivityProbe(this::probe, clock);
        this.configuration = ProviderConfiguration.builder().name(name).build();
    }

    @Override
    public final String getName() {
        return name;
    }

    @Override
    public final ProviderCapabilities getCapabilities() {
        return capabilities;
    }

    @Override
    public final ProviderConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public final void initialize(ProviderConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        if (configuration.getName() != null && !name.equals(configuration.getName())) {
            log.warn("Configuration named {} applied to provider {}", configuration.getName(), name);
        }
        this.configuration = configuration;
        onInitialize(configuration);
        log.info("{} provider initialized (enabled={}, priority={}); connectivity is probed on first use",
            name, configuration.isEnabled(), configuration.getPriority());
    }

    /**
     * Hook for vendor state that needs no network, e.g. generating a visitor id.
     */
    protected void onInitialize(ProviderConfiguration configuration) {
    }

    @Override
    public final Mono<OperationEnvelope<CreatedEmail>> createEmailAddress(CreateEmailRequest request) {
        CreateEmailRequest effective = request != null ? request : CreateEmailRequest.empty();
        return execute("createEmailAddress",
            () -> warmedUp().then(Mono.defer(() -> doCreateEmailAddress(effective))));
    }

    @Override
    public final Mono<OperationEnvelope<List<EmailMessage>>> listMessages(EmailListQuery query) {
        return execute("listMessages", () -> {
            requireAddress(query != null ? query.address() : null);
            return warmedUp().then(Mono.defer(() -> doListMessages(query)))
                .map(messages -> MessageQueryFilter.apply(messages, query));
        });
    }

    @Override
    public final Mono<OperationEnvelope<EmailMessage>> fetchMessage(String address, String messageId, String accessToken) {
        return execute("fetchMessage", () -> {
            requireAddress(address);
            if (messageId == null || messageId.isBlank()) {
                throw apiError("Message id is required");
            }
            return warmedUp().then(Mono.defer(() -> doFetchMessage(address, messageId, accessToken)));
        });
    }

    protected abstract Mono<CreatedEmail> doCreateEmailAddress(CreateEmailRequest request);

    /**
     * Full vendor message list; filtering and pagination are applied by the caller.
     */
    protected abstract Mono<List<EmailMessage>> doListMessages(EmailListQuery query);

    protected abstract Mono<EmailMessage> doFetchMessage(String address, String messageId, String accessToken);

    /**
     * One lightweight vendor request. Any HTTP status counts as an answer;
     * non-2xx is reported as a failed test.
     */
    protected abstract Mono<HttpResult> doTestConnectivity();

    /**
     * One-time preparation run before the first operation. Must not fail;
     * fall back to defaults instead.
     */
    protected Mono<Void> warmUp() {
        return Mono.empty();
    }

    private Mono<Void> warmedUp() {
        while (true) {
            Mono<Void> current = warmUp.get();
            if (current != null) {
                return current;
            }
            Mono<Void> created = Mono.defer(this::warmUp)
                .onErrorResume(e -> {
                    log.warn("{} warm-up failed, continuing with defaults: {}", name, e.toString());
                    return Mono.empty();
                })
                .cache();
            if (warmUp.compareAndSet(null, created)) {
                return created;
            }
        }
    }

    @Override
    public final Mono<OperationEnvelope<Boolean>> testConnectivity() {
        return Mono.defer(() -> {
            long start = clock.millis();
            String requestId = RequestIds.next(clock);
            return Mono.defer(this::doTestConnectivity)
                .map(result -> {
                    ResponseMetadata metadata = ResponseMetadata.of(name, clock.millis() - start, requestId);
                    if (result.ok()) {
                        return OperationEnvelope.success(Boolean.TRUE, metadata);
                    }
                    return OperationEnvelope.<Boolean>failure(errorClassifier.fromStatus(result.status(),
                        name + " connectivity test returned " + result.status() + ": " + result.statusText(), name),
                        metadata);
                })
                .onErrorResume(e -> Mono.just(OperationEnvelope.<Boolean>failure(
                    errorClassifier.fromThrowable(e, name),
                    ResponseMetadata.of(name, clock.millis() - start, requestId))));
        });
    }

    private Mono<ProbeResult> probe() {
        log.info("Testing {} connectivity", name);
        return testConnectivity().map(envelope -> {
            long responseTime = envelope.metadata().responseTime();
            if (envelope.success()) {
                log.info("{} connectivity test passed in {} ms", name, responseTime);
                return ProbeResult.succeeded(clock.instant(), responseTime);
            }
            log.warn("{} connectivity test failed: {}", name, envelope.error().message());
            return ProbeResult.failed(clock.instant(), responseTime, envelope.error().message());
        });
    }

    @Override
    public final Mono<ProviderHealth> getHealth() {
        return connectivityProbe.result().map(statistics::toHealth);
    }

    @Override
    public final Mono<ProviderHealth> refreshHealth() {
        return Mono.defer(() -> {
            connectivityProbe.invalidate();
            warmUp.set(null);
            return getHealth();
        });
    }

    @Override
    public final ProviderStatistics getStatistics() {
        return statistics.snapshot();
    }

    /**
     * Report a vendor-signalled status (e.g. MAINTENANCE) instead of the probe-derived one.
     *
     * @param status Status to report, null to go back to the probe
     */
    protected void overrideStatus(ProviderStatus status) {
        statistics.overrideStatus(status);
    }

    /**
     * Run one operation: time it, count it, and turn any failure into a failed envelope.
     */
    protected <T> Mono<OperationEnvelope<T>> execute(String operation, Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            long start = clock.millis();
            String requestId = RequestIds.next(clock);
            return Mono.defer(call)
                .switchIfEmpty(Mono.error(() -> apiError("Empty response from " + name)))
                .map(data -> {
                    long elapsed = clock.millis() - start;
                    statistics.recordSuccess(elapsed > 0 ? elapsed : null);
                    return OperationEnvelope.success(data, ResponseMetadata.of(name, elapsed, requestId));
                })
                .onErrorResume(e -> {
                    long elapsed = clock.millis() - start;
                    ProviderError error = errorClassifier.fromThrowable(e, name);
                    statistics.recordFailure(error.message());
                    if (error.kind() == ProviderErrorKind.RATE_LIMIT) {
                        statistics.overrideStatus(ProviderStatus.RATE_LIMITED);
                    }
                    log.warn("{} {} failed [{}]: {}", name, operation, error.kind().getWireValue(), error.message());
                    return Mono.just(OperationEnvelope.<T>failure(error, ResponseMetadata.of(name, elapsed, requestId)));
                });
        });
    }

    /**
     * Request builder preloaded with this provider's timeout, retries and extra headers.
     */
    protected HttpInvocation.HttpInvocationBuilder request(String url) {
        ProviderConfiguration current = configuration;
        return HttpInvocation.builder()
            .url(url)
            .timeout(current.getTimeout())
            .maxRetries(current.getRetries())
            .headers(current.getHeaders());
    }

    protected Mono<HttpResult> send(HttpInvocation invocation) {
        return httpInvoker.invoke(invocation);
    }

    /**
     * Fail unless the vendor answered 2xx.
     *
     * @param result Vendor response
     * @param vendor Vendor label used in the error message
     * @return The same result
     */
    protected HttpResult requireSuccess(HttpResult result, String vendor) {
        if (!result.ok()) {
            throw new ProviderException(errorClassifier.fromStatus(result.status(),
                vendor + " API returned " + result.status() + ": " + result.statusText(), name));
        }
        return result;
    }

    /**
     * Configured base URL, or the vendor default when none is configured.
     */
    protected String baseUrl(String defaultUrl) {
        String configured = configuration.getBaseUrl();
        String url = configured != null && !configured.isBlank() ? configured : defaultUrl;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    protected ProviderException apiError(String message) {
        return error(ProviderErrorKind.API, message);
    }

    protected ProviderException error(ProviderErrorKind kind, String message) {
        return new ProviderException(errorClassifier.classify(kind, message, name));
    }

    /**
     * Pick one message out of a full listing, for vendors whose list already carries content.
     */
    protected Mono<EmailMessage> findById(List<EmailMessage> messages, String messageId) {
        return messages.stream()
            .filter(message -> messageId.equals(message.getId()))
            .findFirst()
            .map(Mono::just)
            .orElseGet(() -> Mono.error(apiError("Email with ID " + messageId + " not found")));
    }

    private void requireAddress(String address) {
        if (address == null || address.isBlank()) {
            throw apiError("Email address is required");
        }
    }
}
