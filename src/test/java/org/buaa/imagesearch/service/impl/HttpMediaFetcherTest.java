package org.buaa.imagesearch.service.impl;

import org.buaa.imagesearch.common.convention.exception.FetchException;
import org.buaa.imagesearch.common.convention.exception.TransientRemoteException;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.dto.SourceItem;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class HttpMediaFetcherTest {

    private static final byte[] IMAGE = {1, 2, 3, 4, 5, 6, 7, 8};

    private static HttpMediaFetcher fetcher(ExchangeFunction exchange, long maxFileSize) {
        WebClient client = WebClient.builder().exchangeFunction(exchange).build();
        return new HttpMediaFetcher(client, maxFileSize, Duration.ofMillis(200));
    }

    private static ClientResponse response(HttpStatus status, String contentType, byte[] body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, contentType)
            .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body)))
            .build();
    }

    @Test
    void testFetchReturnsImageBytes() {
        HttpMediaFetcher fetcher = fetcher(request -> Mono.just(response(HttpStatus.OK, "image/png", IMAGE)), 1024);

        StepVerifier.create(fetcher.fetch(SourceItem.of("https://images.example.com/a.png")))
            .assertNext(bytes -> assertArrayEquals(IMAGE, bytes))
            .verifyComplete();
    }

    @Test
    void testClientErrorIsPermanent() {
        HttpMediaFetcher fetcher = fetcher(request -> Mono.just(response(HttpStatus.NOT_FOUND, "text/plain", new byte[0])), 1024);

        StepVerifier.create(fetcher.fetch(SourceItem.of("https://images.example.com/missing.png")))
            .expectError(FetchException.class)
            .verify();
    }

    @Test
    void testServerErrorIsTransient() {
        HttpMediaFetcher fetcher = fetcher(request -> Mono.just(response(HttpStatus.BAD_GATEWAY, "text/plain", new byte[0])), 1024);

        StepVerifier.create(fetcher.fetch(SourceItem.of("https://images.example.com/a.png")))
            .expectError(TransientRemoteException.class)
            .verify();
    }

    @Test
    void testNonImageContentTypeIsRejected() {
        HttpMediaFetcher fetcher = fetcher(request -> Mono.just(response(HttpStatus.OK, "text/html", IMAGE)), 1024);

        StepVerifier.create(fetcher.fetch(SourceItem.of("https://images.example.com/page")))
            .expectError(FetchException.class)
            .verify();
    }

    @Test
    void testOversizedBodyIsRejected() {
        HttpMediaFetcher fetcher = fetcher(request -> Mono.just(response(HttpStatus.OK, "image/jpeg", IMAGE)), 4);

        StepVerifier.create(fetcher.fetch(SourceItem.of("https://images.example.com/big.jpg")))
            .expectError(FetchException.class)
            .verify();
    }

    @Test
    void testTimeoutIsTransient() {
        HttpMediaFetcher fetcher = fetcher(request -> Mono.never(), 1024);

        StepVerifier.create(fetcher.fetch(SourceItem.of("https://images.example.com/slow.jpg")))
            .expectError(TransientRemoteException.class)
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void testMalformedUrlFailsWithoutNetworkCall() {
        AtomicInteger calls = new AtomicInteger();
        HttpMediaFetcher fetcher = fetcher(request -> {
            calls.incrementAndGet();
            return Mono.just(response(HttpStatus.OK, "image/png", IMAGE));
        }, 1024);

        StepVerifier.create(fetcher.fetch(SourceItem.of("   ")))
            .expectError(ValidationException.class)
            .verify();
        StepVerifier.create(fetcher.fetch(SourceItem.of("not a url")))
            .expectError(ValidationException.class)
            .verify();
        StepVerifier.create(fetcher.fetch(SourceItem.of("ftp://images.example.com/a.png")))
            .expectError(ValidationException.class)
            .verify();
        assertEquals(0, calls.get());
    }
}
