package org.buaa.imagesearch.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 索引统计响应
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatsRespDTO {
    private long indexedImages;
    private long storageSizeBytes;
    private long trackedJobs;
    private String status;
}
