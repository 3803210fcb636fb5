package org.buaa.imagesearch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 相似检索命中结果（不含向量）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoredRecord {

    private String id;

    private String primaryAddress;

    private String secondaryAddress;

    private Map<String, String> metadata;

    /** 相似度得分，越大越相似 */
    private double score;
}
