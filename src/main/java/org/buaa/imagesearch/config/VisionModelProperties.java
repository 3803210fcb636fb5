package org.buaa.imagesearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 视觉与向量模型配置属性类
 * 统一管理模型名称与生成参数
 */
@Component
@ConfigurationProperties(prefix = "vision")
@Data
public class VisionModelProperties {

    /** 兼容 OpenAI 协议的接口地址 */
    private String url;

    private String apiKey;

    /** 多模态对话模型，用于图片描述与相似原因 */
    private String chatModel = "gpt-4o";

    /** 文本向量模型 */
    private String embeddingModel = "text-embedding-ada-002";

    private GenerationParams describe = new GenerationParams(300, 0.1);

    private GenerationParams compare = new GenerationParams(50, 0.3);

    /**
     * 生成参数配置
     */
    @Data
    public static class GenerationParams {
        /** 最大生成token数 */
        private Integer maxTokens;
        /** 温度参数（控制随机性） */
        private Double temperature;

        public GenerationParams() {
        }

        public GenerationParams(Integer maxTokens, Double temperature) {
            this.maxTokens = maxTokens;
            this.temperature = temperature;
        }
    }
}
