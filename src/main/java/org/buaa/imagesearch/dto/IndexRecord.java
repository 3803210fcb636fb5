package org.buaa.imagesearch.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Map;

/**
 * 索引记录：向量、访问地址、存储键与元数据。相同 id 重复发布为覆盖写。
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "vector")
public class IndexRecord {

    private final String id;

    private final Vector vector;

    /** 对外访问地址 */
    private final String primaryAddress;

    /** 对象存储键 */
    private final String secondaryAddress;

    @Singular("metadataEntry")
    private final Map<String, String> metadata;
}
