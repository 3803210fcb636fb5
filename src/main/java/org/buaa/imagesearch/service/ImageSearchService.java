package org.buaa.imagesearch.service;

import org.buaa.imagesearch.common.convention.result.Result;
import org.buaa.imagesearch.dto.req.TextSearchReqDTO;
import org.buaa.imagesearch.dto.resp.ImageSearchRespDTO;
import org.buaa.imagesearch.dto.resp.StatsRespDTO;
import org.buaa.imagesearch.dto.resp.TextSearchRespDTO;
import org.buaa.imagesearch.dto.resp.UploadSearchRespDTO;
import org.springframework.web.multipart.MultipartFile;

/**
 * 相似图片检索服务
 */
public interface ImageSearchService {

    Result<ImageSearchRespDTO> searchByImage(MultipartFile file, int topK, boolean explain);

    Result<TextSearchRespDTO> searchByText(TextSearchReqDTO request);

    /**
     * 保存上传图片并返回相似图片，上传图片本身不进入索引
     */
    Result<UploadSearchRespDTO> uploadAndSearch(MultipartFile file, int topK);

    /**
     * 删除索引记录及其存储对象
     */
    Result<Void> deleteImage(String imageId);

    Result<StatsRespDTO> stats();
}
