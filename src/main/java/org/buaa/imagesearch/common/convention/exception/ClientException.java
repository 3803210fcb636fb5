package org.buaa.imagesearch.common.convention.exception;

import org.buaa.imagesearch.common.convention.errorcode.IErrorCode;
import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;

import java.util.Optional;

/**
 * 客户端异常
 * 用于表示由客户端请求引起的错误（如参数校验失败、资源不存在等）
 * HTTP状态码通常为 4xx
 */
public class ClientException extends AbstractException {

    public ClientException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ClientException(String message) {
        this(message, null, ImageSearchErrorCode.CLIENT_ERROR);
    }

    public ClientException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    /**
     * 完整构造器
     *
     * @param message 自定义错误消息
     * @param throwable 原始异常
     * @param errorCode 错误码
     */
    public ClientException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
