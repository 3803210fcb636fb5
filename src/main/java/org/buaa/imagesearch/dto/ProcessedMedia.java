package org.buaa.imagesearch.dto;

import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 归一化后的图片（限定最长边、统一 JPEG 编码）及其元数据，创建后不再修改
 */
@Getter
public final class ProcessedMedia {

    private final byte[] content;

    private final String contentType;

    private final int width;

    private final int height;

    private final Map<String, String> metadata;

    public ProcessedMedia(byte[] content, String contentType, int width, int height, Map<String, String> metadata) {
        this.content = Arrays.copyOf(content, content.length);
        this.contentType = contentType;
        this.width = width;
        this.height = height;
        this.metadata = metadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public byte[] getContent() {
        return Arrays.copyOf(content, content.length);
    }
}
