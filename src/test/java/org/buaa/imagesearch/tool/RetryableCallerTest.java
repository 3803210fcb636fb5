package org.buaa.imagesearch.tool;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.buaa.imagesearch.common.convention.exception.PermanentRemoteException;
import org.buaa.imagesearch.common.convention.exception.RetryExhaustedException;
import org.buaa.imagesearch.common.convention.exception.TransientRemoteException;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryableCallerTest {

    private RetryableCaller retryableCaller;
    private Logger callerLogger;
    private ListAppender<ILoggingEvent> logEvents;

    @BeforeEach
    void setUp() {
        callerLogger = (Logger) LoggerFactory.getLogger(RetryableCaller.class);
        logEvents = new ListAppender<>();
        logEvents.start();
        callerLogger.addAppender(logEvents);

        IngestionProperties properties = new IngestionProperties();
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setInitialBackoff(Duration.ofMillis(20));
        properties.getRetry().setMaxBackoff(Duration.ofMillis(50));
        retryableCaller = new RetryableCaller(properties);
    }

    @AfterEach
    void tearDown() {
        callerLogger.detachAppender(logEvents);
    }

    @Test
    void testSucceedsOnThirdAttempt() {
        AtomicInteger attempts = new AtomicInteger();

        Mono<String> call = retryableCaller.call("describe", () -> {
            if (attempts.incrementAndGet() < 3) {
                return Mono.error(new TimeoutException("slow"));
            }
            return Mono.just("ok");
        });

        StepVerifier.create(call).expectNext("ok").verifyComplete();
        assertEquals(3, attempts.get());
        List<ILoggingEvent> succeeded = logEvents.list.stream()
            .filter(event -> event.getMessage().startsWith("远程调用重试后成功"))
            .collect(Collectors.toList());
        assertEquals(1, succeeded.size());
        assertArrayEquals(new Object[]{"describe", 3}, succeeded.get(0).getArgumentArray());
    }

    @Test
    void testFirstAttemptSuccessLogsNoRetry() {
        StepVerifier.create(retryableCaller.call("embed", () -> Mono.just("ok")))
            .expectNext("ok")
            .verifyComplete();

        assertTrue(logEvents.list.stream().noneMatch(event -> event.getMessage().startsWith("远程调用")));
    }

    @Test
    void testExhaustionCarriesAttemptCountAndLastCause() {
        AtomicInteger attempts = new AtomicInteger();
        long start = System.nanoTime();

        Mono<String> call = retryableCaller.call("embed", () -> {
            attempts.incrementAndGet();
            return Mono.error(new TransientRemoteException("HTTP 503", null));
        });

        StepVerifier.create(call)
            .expectErrorSatisfies(error -> {
                RetryExhaustedException exhausted = assertInstanceOf(RetryExhaustedException.class, error);
                assertEquals(3, exhausted.getAttempts());
                assertEquals("embed", exhausted.getOperation());
                assertInstanceOf(TransientRemoteException.class, exhausted.getCause());
            })
            .verify(Duration.ofSeconds(5));

        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();
        assertEquals(3, attempts.get());
        // 20ms + 40ms
        assertTrue(elapsedMillis >= 60, "elapsed " + elapsedMillis + "ms");
    }

    @Test
    void testPermanentErrorIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        Mono<String> call = retryableCaller.call("fetch", () -> {
            attempts.incrementAndGet();
            return Mono.error(WebClientResponseException.create(
                HttpStatus.NOT_FOUND.value(), "Not Found", HttpHeaders.EMPTY, new byte[0], null));
        });

        StepVerifier.create(call)
            .expectError(PermanentRemoteException.class)
            .verify(Duration.ofSeconds(5));
        assertEquals(1, attempts.get());
    }

    @Test
    void testServerErrorIsRetried() {
        AtomicInteger attempts = new AtomicInteger();

        Mono<String> call = retryableCaller.call("store", () -> {
            if (attempts.incrementAndGet() == 1) {
                return Mono.error(WebClientResponseException.create(
                    HttpStatus.SERVICE_UNAVAILABLE.value(), "Unavailable", HttpHeaders.EMPTY, new byte[0], null));
            }
            return Mono.just("stored");
        });

        StepVerifier.create(call).expectNext("stored").verifyComplete();
        assertEquals(2, attempts.get());
    }

    @Test
    void testValidationErrorPassesThroughUnchanged() {
        AtomicInteger attempts = new AtomicInteger();

        Mono<String> call = retryableCaller.call("embed", () -> {
            attempts.incrementAndGet();
            return Mono.error(new ValidationException("empty"));
        });

        StepVerifier.create(call)
            .expectError(ValidationException.class)
            .verify(Duration.ofSeconds(5));
        assertEquals(1, attempts.get());
    }

    @Test
    void testSingleAttemptPolicyReportsOneAttempt() {
        IngestionProperties properties = new IngestionProperties();
        properties.getRetry().setMaxAttempts(1);
        RetryableCaller singleShot = new RetryableCaller(properties);

        Mono<String> call = singleShot.call("publish", () -> Mono.error(new TimeoutException("slow")));

        StepVerifier.create(call)
            .expectErrorSatisfies(error ->
                assertEquals(1, assertInstanceOf(RetryExhaustedException.class, error).getAttempts()))
            .verify(Duration.ofSeconds(5));
    }
}
