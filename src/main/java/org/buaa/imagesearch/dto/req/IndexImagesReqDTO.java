package org.buaa.imagesearch.dto.req;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * 批量索引请求参数
 */
@Data
public class IndexImagesReqDTO {

    /**
     * 图片地址列表
     */
    @NotEmpty(message = "图片地址列表不能为空")
    private List<String> imageUrls;

    /**
     * 批大小，为空时使用默认值
     */
    @Min(value = 1, message = "批大小必须大于等于 1")
    @Max(value = 100, message = "批大小不能超过 100")
    private Integer batchSize;
}
