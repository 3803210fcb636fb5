package org.buaa.imagesearch.config;

import io.minio.MinioClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 对象存储配置类
 *
 * <p>存储桶的创建推迟到任务首次使用时（见 MinioMediaPersister#ensureNamespace），
 * 存储服务不可用时应用仍可启动，仅对应任务失败。</p>
 */
@Configuration
public class ObjectStorageConfig {

    @Value("${minio.endpoint}")
    private String serviceEndpoint;

    @Value("${minio.accessKey}")
    private String accessKeyId;

    @Value("${minio.secretKey}")
    private String secretAccessKey;

    /**
     * 创建MinIO客户端Bean
     *
     * @return MinIO客户端实例
     */
    @Bean
    public MinioClient minioClient() {
        return MinioClient.builder()
            .endpoint(serviceEndpoint)
            .credentials(accessKeyId, secretAccessKey)
            .build();
    }
}
