package org.buaa.imagesearch.service;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * 对象存储
 */
public interface Persister {

    /**
     * 确保存储桶存在，不存在时创建，可重复调用
     */
    Mono<Void> ensureNamespace();

    /**
     * 写入对象，同一键重复写入为覆盖
     *
     * @return 对象的公开访问地址
     */
    Mono<String> store(String key, byte[] content, Map<String, String> metadata);

    /**
     * 读取对象，不存在时抛出 NotFoundException
     */
    Mono<byte[]> retrieve(String key);

    /**
     * 删除对象，对象不存在时返回 false
     */
    Mono<Boolean> delete(String key);
}
