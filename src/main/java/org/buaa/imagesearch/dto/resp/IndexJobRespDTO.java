package org.buaa.imagesearch.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.buaa.imagesearch.ingest.JobStatus;

/**
 * 索引任务提交响应
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexJobRespDTO {
    private String jobId;
    private int totalCount;
    private int batchSize;
    private JobStatus status;
    private String message;
}
