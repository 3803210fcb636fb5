package org.buaa.imagesearch.common.convention.exception;

import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;

/**
 * 输入校验异常，在任何网络调用之前抛出，不参与重试
 */
public class ValidationException extends ClientException {

    public ValidationException(String message) {
        super(message, ImageSearchErrorCode.PARAM_INVALID);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause, ImageSearchErrorCode.PARAM_INVALID);
    }
}
