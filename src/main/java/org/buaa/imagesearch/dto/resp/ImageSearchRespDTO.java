package org.buaa.imagesearch.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 以图搜图响应
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageSearchRespDTO {
    private String queryFilename;
    private List<SimilarImageRespDTO> similarImages;
    private int totalResults;
    /** 处理耗时（秒） */
    private double processingTime;
}
