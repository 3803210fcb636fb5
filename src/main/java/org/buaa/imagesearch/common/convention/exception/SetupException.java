package org.buaa.imagesearch.common.convention.exception;

import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;

/**
 * 任务初始化异常，唯一会终止整个摄取任务的异常类型
 */
public class SetupException extends ServiceException {

    public SetupException(String message, Throwable cause) {
        super(message, cause, ImageSearchErrorCode.SETUP_FAILED);
    }
}
