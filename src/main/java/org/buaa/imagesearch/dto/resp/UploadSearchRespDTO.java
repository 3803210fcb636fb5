package org.buaa.imagesearch.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 上传并检索响应
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadSearchRespDTO {
    private String fileUrl;
    private String fileName;
    private List<SimilarImageRespDTO> similarImages;
}
