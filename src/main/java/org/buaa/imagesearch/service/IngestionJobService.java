package org.buaa.imagesearch.service;

import org.buaa.imagesearch.common.convention.result.Result;
import org.buaa.imagesearch.dto.req.IndexImagesReqDTO;
import org.buaa.imagesearch.dto.resp.IndexJobRespDTO;
import org.buaa.imagesearch.ingest.ProgressRecord;
import org.springframework.web.multipart.MultipartFile;

/**
 * 批量索引任务服务
 */
public interface IngestionJobService {

    /**
     * 提交批量索引任务，立即返回任务ID
     */
    Result<IndexJobRespDTO> submit(IndexImagesReqDTO request);

    /**
     * 从 CSV 文件读取图片地址并提交任务
     * 优先读取 photo_image_url 列，不存在时读取第一列
     */
    Result<IndexJobRespDTO> submitCsv(MultipartFile file, Integer batchSize);

    Result<ProgressRecord> getProgress(String jobId);

    /**
     * 请求取消任务，当前批次结束后停止
     */
    Result<ProgressRecord> cancel(String jobId);

    /**
     * 删除任务进度，未结束的任务同时被取消
     */
    Result<Void> delete(String jobId);
}
