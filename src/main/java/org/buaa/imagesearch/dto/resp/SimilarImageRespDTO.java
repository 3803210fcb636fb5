package org.buaa.imagesearch.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 相似图片
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarImageRespDTO {
    private String imageId;
    private String imageUrl;
    private double similarityScore;
    /** 相似原因，文本检索时为空 */
    private String explanation;
    private Map<String, String> metadata;
}
