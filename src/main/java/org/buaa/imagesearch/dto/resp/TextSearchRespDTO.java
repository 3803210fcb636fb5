package org.buaa.imagesearch.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 文本检索响应
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TextSearchRespDTO {
    private String query;
    private List<SimilarImageRespDTO> similarImages;
    private int totalResults;
    private double searchTime;
}
