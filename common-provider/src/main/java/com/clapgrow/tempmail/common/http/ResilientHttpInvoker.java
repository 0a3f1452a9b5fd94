package com.clapgrow.tempmail.common.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Outbound HTTP for all provider adapters.
 *
 * Each attempt gets a hard timeout. Transport failures (connection errors, timeouts,
 * undecodable bodies) are retried up to {@code maxRetries} times, waiting
 * {@code baseDelay * (n + 1)} before retry {@code n}. Any HTTP status, 4xx and 5xx
 * included, is a completed exchange and is returned as-is. When retries run out the
 * last error is re-thrown unclassified; adapters classify it.
 */
@Slf4j
public class ResilientHttpInvoker {

    public static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (compatible; TempMailGateway/1.0; +https://github.com/clapgrow)";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration baseDelay;

    public ResilientHttpInvoker(WebClient webClient, ObjectMapper objectMapper, Duration baseDelay) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.baseDelay = baseDelay;
    }

    /**
     * Execute an invocation.
     *
     * @param invocation Request description
     * @return Result for any HTTP status, or the last transport error
     */
    public Mono<HttpResult> invoke(HttpInvocation invocation) {
        AtomicInteger attempts = new AtomicInteger();
        return Mono.defer(() -> {
                attempts.incrementAndGet();
                return exchange(invocation, attempts);
            })
            .timeout(invocation.getTimeout())
            .retryWhen(linearBackoff(invocation));
    }

    private Retry linearBackoff(HttpInvocation invocation) {
        int maxRetries = Math.max(0, invocation.getMaxRetries());
        return Retry.from(signals -> signals.concatMap(signal -> {
            long retry = signal.totalRetries();
            Throwable failure = signal.failure();
            if (retry >= maxRetries) {
                return Mono.error(failure);
            }
            Duration delay = baseDelay.multipliedBy(retry + 1);
            log.debug("Retrying {} {} in {} ms (retry {}/{}): {}", invocation.getMethod(),
                invocation.getUrl(), delay.toMillis(), retry + 1, maxRetries, failure.toString());
            return Mono.delay(delay).thenReturn(retry);
        }));
    }

    private Mono<HttpResult> exchange(HttpInvocation invocation, AtomicInteger attempts) {
        WebClient.RequestBodySpec spec = webClient.method(invocation.getMethod())
            .uri(URI.create(invocation.getUrl()))
            .headers(headers -> {
                headers.set(HttpHeaders.USER_AGENT, DEFAULT_USER_AGENT);
                invocation.getHeaders().forEach(headers::set);
            });

        WebClient.RequestHeadersSpec<?> request = spec;
        if (invocation.getFormData() != null) {
            request = spec.body(BodyInserters.fromFormData(invocation.getFormData()));
        } else if (invocation.getBody() != null) {
            request = spec.contentType(MediaType.APPLICATION_JSON).bodyValue(invocation.getBody());
        }

        return request.exchangeToMono(response -> response.bodyToMono(byte[].class)
            .defaultIfEmpty(new byte[0])
            .flatMap(bytes -> Mono.fromCallable(() -> toResult(response, bytes, attempts.get()))));
    }

    private HttpResult toResult(ClientResponse response, byte[] bytes, int attempts) throws IOException {
        int status = response.statusCode().value();
        HttpStatus resolved = HttpStatus.resolve(status);
        String statusText = resolved != null ? resolved.getReasonPhrase() : "";
        MediaType contentType = response.headers().contentType().orElse(null);

        Object body;
        if (contentType != null && isJson(contentType)) {
            body = objectMapper.readTree(bytes);
        } else if (contentType != null && "text".equalsIgnoreCase(contentType.getType())) {
            body = new String(bytes, contentType.getCharset() != null
                ? contentType.getCharset() : StandardCharsets.UTF_8);
        } else {
            body = bytes;
        }

        if (attempts > 1) {
            log.debug("HTTP {} after {} attempts", status, attempts);
        }
        return new HttpResult(status, statusText, response.headers().asHttpHeaders(), body, attempts);
    }

    private boolean isJson(MediaType contentType) {
        return MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
            || contentType.getSubtype().endsWith("+json");
    }
}
