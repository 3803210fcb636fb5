package org.buaa.imagesearch.tool;

import org.buaa.imagesearch.common.convention.exception.RetryExhaustedException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 远程调用重试器
 * 对单次远程调用施加有上限的指数退避重试，仅重试可重试异常
 */
@Component
public class RetryableCaller {

    private static final Logger log = LoggerFactory.getLogger(RetryableCaller.class);

    private final IngestionProperties.Retry policy;

    public RetryableCaller(IngestionProperties properties) {
        this.policy = properties.getRetry();
    }

    /**
     * 执行带重试的远程调用
     *
     * @param operation 操作名，用于日志与异常信息
     * @param attempt 每次订阅即一次尝试
     * @return 首次成功的结果，经过重试才成功时记录尝试次数；重试耗尽时以 {@link RetryExhaustedException} 结束
     */
    public <T> Mono<T> call(String operation, Supplier<Mono<T>> attempt) {
        AtomicInteger attempts = new AtomicInteger();
        return Mono.defer(() -> {
                attempts.incrementAndGet();
                return attempt.get();
            })
            .onErrorMap(RemoteErrors::classify)
            .retryWhen(createRetryPolicy(operation, attempts))
            .doOnSuccess(result -> {
                if (attempts.get() > 1) {
                    log.info("远程调用重试后成功 - 操作: {}, 尝试次数: {}", operation, attempts.get());
                }
            });
    }

    /**
     * 创建重试策略
     */
    private Retry createRetryPolicy(String operation, AtomicInteger attempts) {
        return Retry.backoff(Math.max(0, policy.getMaxAttempts() - 1), policy.getInitialBackoff())
            .maxBackoff(policy.getMaxBackoff())
            .jitter(0d)
            .filter(RemoteErrors::isTransient)
            .doBeforeRetry(signal -> log.warn("远程调用失败，准备重试 - 操作: {}, 已尝试: {}, 原因: {}",
                operation, attempts.get(), signal.failure().getMessage()))
            .onRetryExhaustedThrow((retrySpec, signal) -> {
                log.error("远程调用重试耗尽 - 操作: {}, 尝试次数: {}", operation, attempts.get());
                return new RetryExhaustedException(operation, attempts.get(), signal.failure());
            });
    }
}
