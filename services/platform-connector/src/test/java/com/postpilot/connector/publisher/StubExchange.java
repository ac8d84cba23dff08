package com.postpilot.connector.publisher;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Answers WebClient calls from a queue of canned responses and records every request.
 */
class StubExchange implements ExchangeFunction {

    private final Deque<Supplier<Mono<ClientResponse>>> responses = new ArrayDeque<>();
    private final List<ClientRequest> requests = new ArrayList<>();

    StubExchange respond(HttpStatus status, String json) {
        responses.add(() -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build()));
        return this;
    }

    StubExchange respondWithHeader(HttpStatus status, String header, String value) {
        responses.add(() -> Mono.just(ClientResponse.create(status)
                .header(header, value)
                .build()));
        return this;
    }

    StubExchange hang() {
        responses.add(Mono::never);
        return this;
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request);
        Supplier<Mono<ClientResponse>> next = responses.poll();
        if (next == null) {
            return Mono.error(new IllegalStateException("Unexpected request " + request.method() + " " + request.url()));
        }
        return next.get();
    }

    WebClient.Builder builder() {
        return WebClient.builder().exchangeFunction(this);
    }

    List<ClientRequest> requests() {
        return requests;
    }
}
