package org.buaa.imagesearch.common.convention.exception;

import org.buaa.imagesearch.common.convention.errorcode.IErrorCode;
import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;

/**
 * 可重试的远程调用异常（超时、5xx、连接重置、限流）
 */
public class TransientRemoteException extends ServiceException {

    public TransientRemoteException(String message, Throwable cause) {
        this(message, cause, ImageSearchErrorCode.TRANSIENT_REMOTE_ERROR);
    }

    protected TransientRemoteException(String message, Throwable cause, IErrorCode errorCode) {
        super(message, cause, errorCode);
    }
}
