package org.buaa.imagesearch.service;

import org.buaa.imagesearch.dto.Vector;
import reactor.core.publisher.Mono;

/**
 * 向量生成
 */
public interface VectorDeriver {

    /**
     * 由图片生成定长向量，先生成描述再对描述编码
     */
    Mono<Vector> derive(byte[] media);

    /**
     * 由文本直接生成向量，用于文本检索
     */
    Mono<Vector> deriveFromText(String text);

    /**
     * 生成两张图片相似原因的说明，失败时返回固定兜底文本，不会以错误结束
     */
    Mono<String> explain(byte[] queryMedia, byte[] similarMedia);
}
