package org.buaa.imagesearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * 异步任务执行器配置。
 * 用于批量图片摄取的后台任务，提交请求立即返回任务ID。
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * 摄取任务线程池，每个线程驱动一个任务的批次循环
     *
     * @return 异步执行器
     */
    @Bean(name = "ingestionJobExecutor")
    public Executor ingestionJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("image-ingestion-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
