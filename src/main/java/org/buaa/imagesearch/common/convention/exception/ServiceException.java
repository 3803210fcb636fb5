package org.buaa.imagesearch.common.convention.exception;

import org.buaa.imagesearch.common.convention.errorcode.IErrorCode;
import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;

import java.util.Optional;

/**
 * 服务端异常
 * 用于表示由服务端内部错误引起的问题（如外部服务调用失败、初始化失败等）
 * HTTP状态码通常为 5xx
 */
public class ServiceException extends AbstractException {

    public ServiceException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ServiceException(String message) {
        this(message, null, ImageSearchErrorCode.SERVICE_ERROR);
    }

    public ServiceException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    /**
     * 完整构造器
     *
     * @param message 自定义错误消息
     * @param throwable 原始异常
     * @param errorCode 错误码
     */
    public ServiceException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
