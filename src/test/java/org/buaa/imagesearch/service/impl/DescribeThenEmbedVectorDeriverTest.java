package org.buaa.imagesearch.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.buaa.imagesearch.common.consts.SystemConstants;
import org.buaa.imagesearch.common.convention.exception.DimensionMismatchException;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.config.VisionModelProperties;
import org.buaa.imagesearch.tool.RetryableCaller;
import org.buaa.imagesearch.tool.VisionModelTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DescribeThenEmbedVectorDeriverTest {

    private static final byte[] IMAGE = {(byte) 0xFF, (byte) 0xD8, 0x01, 0x02};

    private IngestionProperties properties;
    private AtomicInteger chatCalls;
    private AtomicInteger embeddingCalls;
    private volatile HttpStatus chatStatus;
    private volatile String chatContent;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        properties.setVectorDimension(3);
        properties.getRetry().setInitialBackoff(Duration.ofMillis(1));
        properties.getRetry().setMaxBackoff(Duration.ofMillis(5));
        chatCalls = new AtomicInteger();
        embeddingCalls = new AtomicInteger();
        chatStatus = HttpStatus.OK;
        chatContent = "A red apple on a wooden table";
    }

    private DescribeThenEmbedVectorDeriver deriver() {
        WebClient client = WebClient.builder()
            .baseUrl("http://vision.test/v1")
            .exchangeFunction(this::exchange)
            .build();
        VisionModelTool tool = new VisionModelTool(client, new VisionModelProperties(), properties, new ObjectMapper());
        return new DescribeThenEmbedVectorDeriver(tool, new RetryableCaller(properties), properties);
    }

    private Mono<ClientResponse> exchange(ClientRequest request) {
        String path = request.url().getPath();
        if (path.endsWith("/chat/completions")) {
            chatCalls.incrementAndGet();
            if (chatStatus != HttpStatus.OK) {
                return Mono.just(ClientResponse.create(chatStatus).build());
            }
            return Mono.just(json("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + chatContent + "\"}}]}"));
        }
        if (path.endsWith("/embeddings")) {
            embeddingCalls.incrementAndGet();
            return Mono.just(json("{\"data\":[{\"index\":0,\"embedding\":[0.1,0.2,0.3]}]}"));
        }
        return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }

    @Test
    void testDeriveDescribesThenEmbeds() {
        StepVerifier.create(deriver().derive(IMAGE))
            .assertNext(vector -> {
                assertEquals(3, vector.dimension());
                assertEquals(0.2f, vector.get(1), 1e-6);
            })
            .verifyComplete();
        assertEquals(1, chatCalls.get());
        assertEquals(1, embeddingCalls.get());
    }

    @Test
    void testWrongDimensionIsRejected() {
        properties.setVectorDimension(1536);

        StepVerifier.create(deriver().deriveFromText("apple"))
            .expectError(DimensionMismatchException.class)
            .verify();
        assertEquals(1, embeddingCalls.get());
    }

    @Test
    void testBlankTextIsRejectedWithoutRemoteCall() {
        StepVerifier.create(deriver().deriveFromText("  "))
            .expectError(ValidationException.class)
            .verify();
        StepVerifier.create(deriver().derive(new byte[0]))
            .expectError(ValidationException.class)
            .verify();
        assertEquals(0, embeddingCalls.get());
        assertEquals(0, chatCalls.get());
    }

    @Test
    void testExplainReturnsModelSentence() {
        chatContent = "Both show red fruit.";

        StepVerifier.create(deriver().explain(IMAGE, IMAGE))
            .expectNext("Both show red fruit.")
            .verifyComplete();
    }

    @Test
    void testExplainFallsBackAfterRetriesAreExhausted() {
        chatStatus = HttpStatus.SERVICE_UNAVAILABLE;

        StepVerifier.create(deriver().explain(IMAGE, IMAGE))
            .expectNext(SystemConstants.FALLBACK_EXPLANATION)
            .verifyComplete();
        assertEquals(3, chatCalls.get());
    }

    @Test
    void testExplainFallsBackOnEmptyAnswer() {
        chatContent = "   ";

        StepVerifier.create(deriver().explain(IMAGE, IMAGE))
            .expectNext(SystemConstants.FALLBACK_EXPLANATION)
            .verifyComplete();
    }
}
