package org.buaa.imagesearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 批量摄取配置
 */
@Component
@ConfigurationProperties(prefix = "ingestion")
@Data
public class IngestionProperties {

    /** 未指定时的批大小 */
    private int defaultBatchSize = 10;

    /** 批大小上限 */
    private int maxBatchSize = 100;

    /** 批内并发上限，0 表示与批大小一致 */
    private int maxConcurrency = 0;

    /** 批与批之间的节流间隔，用于避开上游向量服务的限流 */
    private Duration pacingDelay = Duration.ofSeconds(1);

    /** 向量维度，索引与向量服务必须一致 */
    private int vectorDimension = 1536;

    private Retry retry = new Retry();
    private Timeouts timeouts = new Timeouts();
    private Media media = new Media();
    private Progress progress = new Progress();
    private Index index = new Index();

    /**
     * 解析批内并发度
     */
    public int resolveConcurrency(int batchSize) {
        if (maxConcurrency <= 0) {
            return Math.max(1, batchSize);
        }
        return Math.max(1, Math.min(maxConcurrency, batchSize));
    }

    @Data
    public static class Retry {
        /** 最大尝试次数（含首次） */
        private int maxAttempts = 3;
        /** 首次退避时长，之后逐次翻倍 */
        private Duration initialBackoff = Duration.ofSeconds(4);
        /** 退避上限 */
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    @Data
    public static class Timeouts {
        private Duration fetch = Duration.ofSeconds(30);
        private Duration describe = Duration.ofSeconds(60);
        private Duration embed = Duration.ofSeconds(30);
        private Duration explain = Duration.ofSeconds(30);
        private Duration storage = Duration.ofSeconds(30);
        private Duration index = Duration.ofSeconds(30);
        /** 任务启动时确认存储桶与索引存在的超时 */
        private Duration setup = Duration.ofSeconds(30);
    }

    @Data
    public static class Media {
        /** 单张图片最大字节数 */
        private long maxFileSize = 20L * 1024 * 1024;
        /** 归一化后最长边像素 */
        private int maxDimension = 800;
        /** JPEG 压缩质量 */
        private float jpegQuality = 0.85f;
    }

    @Data
    public static class Progress {
        /** 已结束任务的进度保留时长，超时后自动清理 */
        private Duration retention = Duration.ofHours(24);
        /** 同时保留的已结束任务进度上限，未结束的任务不受限制 */
        private long maxJobs = 1000;
    }

    @Data
    public static class Index {
        /** elasticsearch 或 memory */
        private String backend = "elasticsearch";
        private String name = "image-index";
    }
}
