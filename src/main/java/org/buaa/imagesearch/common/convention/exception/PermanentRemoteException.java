package org.buaa.imagesearch.common.convention.exception;

import org.buaa.imagesearch.common.convention.errorcode.IErrorCode;
import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;

/**
 * 不可重试的远程调用异常（除限流外的 4xx、请求格式错误）
 */
public class PermanentRemoteException extends ServiceException {

    public PermanentRemoteException(String message, Throwable cause) {
        this(message, cause, ImageSearchErrorCode.PERMANENT_REMOTE_ERROR);
    }

    protected PermanentRemoteException(String message, Throwable cause, IErrorCode errorCode) {
        super(message, cause, errorCode);
    }
}
