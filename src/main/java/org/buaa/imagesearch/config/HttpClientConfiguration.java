package org.buaa.imagesearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP客户端配置, 用于视觉模型与向量编码API调用
 */
@Configuration
public class HttpClientConfiguration {

    /**
     * 创建用于视觉模型的WebClient
     * 图片以 base64 内联在请求体中，需要较大的内存缓冲区
     *
     * @return WebClient实例
     */
    @Bean
    public WebClient visionWebClient(VisionModelProperties properties) {
        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(codecConfigurer -> codecConfigurer
                .defaultCodecs()
                .maxInMemorySize(calculateMaxBufferSize()))
            .build();

        WebClient.Builder builder = WebClient.builder()
            .baseUrl(properties.getUrl())
            .exchangeStrategies(exchangeStrategies)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);

        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        }
        return builder.build();
    }

    /**
     * 计算最大缓冲区大小（16MB）
     */
    private int calculateMaxBufferSize() {
        return 16 * 1024 * 1024;
    }
}
