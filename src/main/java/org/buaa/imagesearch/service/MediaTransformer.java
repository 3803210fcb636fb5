package org.buaa.imagesearch.service;

import org.buaa.imagesearch.dto.ProcessedMedia;

import java.util.Map;

/**
 * 图片归一化：限制最长边并统一编码为 JPEG
 */
public interface MediaTransformer {

    /**
     * @param raw 原始图片字节
     * @param metadata 需要附加到结果上的元数据
     * @return 归一化后的图片，输入无法解码时抛出 ValidationException
     */
    ProcessedMedia transform(byte[] raw, Map<String, String> metadata);
}
