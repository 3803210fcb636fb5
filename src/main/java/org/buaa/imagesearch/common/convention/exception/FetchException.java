package org.buaa.imagesearch.common.convention.exception;

import lombok.Getter;
import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;

/**
 * 图片下载失败（非 2xx 的客户端错误、非图片类型、超出大小限制），不参与重试。
 * 5xx 与超时由下载器直接抛出 {@link TransientRemoteException}。
 */
@Getter
public class FetchException extends PermanentRemoteException {

    private final String sourceUrl;

    public FetchException(String sourceUrl, String message) {
        this(sourceUrl, message, null);
    }

    public FetchException(String sourceUrl, String message, Throwable cause) {
        super(message, cause, ImageSearchErrorCode.MEDIA_FETCH_ERROR);
        this.sourceUrl = sourceUrl;
    }
}
