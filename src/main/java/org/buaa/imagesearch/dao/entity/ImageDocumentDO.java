package org.buaa.imagesearch.dao.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 图片索引文档
 * 用于Elasticsearch存储的文档结构
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageDocumentDO {

    private String imageId;

    private String imageUrl;

    private String blobName;

    private float[] embedding;

    private Map<String, String> metadata;

    private String createdAt;
}
