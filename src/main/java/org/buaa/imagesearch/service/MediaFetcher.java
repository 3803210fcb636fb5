package org.buaa.imagesearch.service;

import org.buaa.imagesearch.dto.SourceItem;
import reactor.core.publisher.Mono;

/**
 * 图片下载
 */
public interface MediaFetcher {

    /**
     * 下载图片原始字节
     *
     * <p>地址为空或格式非法抛出 ValidationException；4xx、非图片类型或超过大小限制抛出 FetchException；
     * 5xx、限流、超时与连接失败抛出 TransientRemoteException。</p>
     */
    Mono<byte[]> fetch(SourceItem source);
}
