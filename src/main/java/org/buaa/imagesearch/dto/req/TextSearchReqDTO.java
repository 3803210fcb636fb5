package org.buaa.imagesearch.dto.req;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 文本检索请求参数
 */
@Data
public class TextSearchReqDTO {

    @NotBlank(message = "查询文本不能为空")
    @Size(max = 500, message = "查询文本不能超过 500 个字符")
    private String query;

    @Min(value = 1, message = "返回数量必须大于等于 1")
    @Max(value = 20, message = "返回数量不能超过 20")
    private Integer topK = 5;
}
