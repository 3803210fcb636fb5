package org.buaa.imagesearch.common.convention.exception;

import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;

/**
 * 资源不存在异常（任务ID、存储对象、索引记录）
 */
public class NotFoundException extends ClientException {

    public NotFoundException(String message) {
        super(message, ImageSearchErrorCode.RESOURCE_NOT_FOUND);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause, ImageSearchErrorCode.RESOURCE_NOT_FOUND);
    }
}
