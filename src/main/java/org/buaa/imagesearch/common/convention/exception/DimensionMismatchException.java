package org.buaa.imagesearch.common.convention.exception;

import lombok.Getter;
import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;

/**
 * 向量维度不一致异常
 */
@Getter
public class DimensionMismatchException extends ClientException {

    private final int expected;

    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(String.format("向量维度不一致: 期望 %d, 实际 %d", expected, actual),
            ImageSearchErrorCode.DIMENSION_MISMATCH);
        this.expected = expected;
        this.actual = actual;
    }
}
