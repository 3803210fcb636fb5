package org.buaa.imagesearch.service.impl;

import cn.hutool.core.util.StrUtil;
import org.buaa.imagesearch.common.consts.SystemConstants;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.dto.Vector;
import org.buaa.imagesearch.service.VectorDeriver;
import org.buaa.imagesearch.tool.RetryableCaller;
import org.buaa.imagesearch.tool.VisionModelTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * 先描述后编码的向量生成
 * 图片经视觉模型生成文字描述，再由向量模型对描述编码；描述与编码各自独立重试
 */
@Service
public class DescribeThenEmbedVectorDeriver implements VectorDeriver {

    private static final Logger log = LoggerFactory.getLogger(DescribeThenEmbedVectorDeriver.class);

    private final VisionModelTool visionModelTool;
    private final RetryableCaller retryableCaller;
    private final int dimension;

    public DescribeThenEmbedVectorDeriver(VisionModelTool visionModelTool,
                                          RetryableCaller retryableCaller,
                                          IngestionProperties properties) {
        this.visionModelTool = visionModelTool;
        this.retryableCaller = retryableCaller;
        this.dimension = properties.getVectorDimension();
    }

    @Override
    public Mono<Vector> derive(byte[] media) {
        if (media == null || media.length == 0) {
            return Mono.error(new ValidationException("图片内容为空，无法生成向量"));
        }
        return retryableCaller.call("describe", () -> visionModelTool.describe(media))
            .doOnNext(description -> log.debug("图片描述生成完成，长度: {}", description.length()))
            .flatMap(this::deriveFromText);
    }

    @Override
    public Mono<Vector> deriveFromText(String text) {
        if (StrUtil.isBlank(text)) {
            return Mono.error(new ValidationException("向量化文本不能为空"));
        }
        return retryableCaller.call("embed", () -> visionModelTool.embed(text))
            .map(values -> Vector.of(values).requireDimension(dimension));
    }

    @Override
    public Mono<String> explain(byte[] queryMedia, byte[] similarMedia) {
        if (queryMedia == null || queryMedia.length == 0 || similarMedia == null || similarMedia.length == 0) {
            return Mono.just(SystemConstants.FALLBACK_EXPLANATION);
        }
        return retryableCaller.call("explain", () -> visionModelTool.compare(queryMedia, similarMedia))
            .map(String::trim)
            .filter(StrUtil::isNotEmpty)
            .defaultIfEmpty(SystemConstants.FALLBACK_EXPLANATION)
            .onErrorResume(error -> {
                log.warn("相似原因生成失败，使用默认说明: {}", error.getMessage());
                return Mono.just(SystemConstants.FALLBACK_EXPLANATION);
            });
    }
}
