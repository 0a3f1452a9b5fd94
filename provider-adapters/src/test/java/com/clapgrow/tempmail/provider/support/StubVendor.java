package com.clapgrow.tempmail.provider.support;

import com.clapgrow.tempmail.common.http.ResilientHttpInvoker;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory vendor: routes requests by method and path, records them, and answers 404 otherwise.
 */
public class StubVendor {

    private final Map<String, Function<ClientRequest, Mono<ClientResponse>>> routes = new ConcurrentHashMap<>();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    public StubVendor on(HttpMethod method, String path, Function<ClientRequest, Mono<ClientResponse>> handler) {
        routes.put(method.name() + " " + path, handler);
        return this;
    }

    public StubVendor json(HttpMethod method, String path, int status, String body) {
        return on(method, path, request -> Mono.just(jsonResponse(status, body)));
    }

    public ResilientHttpInvoker invoker() {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                requests.add(request);
                Function<ClientRequest, Mono<ClientResponse>> handler =
                    routes.get(request.method().name() + " " + request.url().getPath());
                if (handler == null) {
                    return Mono.just(jsonResponse(404, "{\"error\":\"not found\"}"));
                }
                return handler.apply(request);
            })
            .build();
        return new ResilientHttpInvoker(webClient, new ObjectMapper(), Duration.ofMillis(1));
    }

    public List<ClientRequest> requests() {
        return requests;
    }

    public long count(String path) {
        return requests.stream().filter(request -> request.url().getPath().equals(path)).count();
    }

    public ClientRequest last(String path) {
        return requests.stream()
            .filter(request -> request.url().getPath().equals(path))
            .reduce((first, second) -> second)
            .orElseThrow();
    }

    public static ClientResponse jsonResponse(int status, String body) {
        return ClientResponse.create(HttpStatus.valueOf(status))
            .header(HttpHeaders.CONTENT_TYPE, "application/json")
            .body(body)
            .build();
    }
}
