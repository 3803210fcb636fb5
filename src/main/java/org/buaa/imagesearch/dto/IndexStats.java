package org.buaa.imagesearch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 索引统计
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexStats {

    /** 已索引记录数 */
    private long count;

    /** 存储占用字节数 */
    private long sizeInBytes;
}
