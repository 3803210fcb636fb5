package org.buaa.imagesearch.common.convention.exception;

import lombok.Getter;
import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;

/**
 * 重试耗尽异常，携带实际尝试次数，原因为最后一次失败
 */
@Getter
public class RetryExhaustedException extends ServiceException {

    private final String operation;

    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
        super(String.format("%s 在 %d 次尝试后仍失败: %s", operation, attempts,
                lastError == null ? "unknown" : lastError.getMessage()),
            lastError, ImageSearchErrorCode.RETRY_EXHAUSTED);
        this.operation = operation;
        this.attempts = attempts;
    }
}
