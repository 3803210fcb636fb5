package org.buaa.imagesearch.ingest;

import org.buaa.imagesearch.common.convention.exception.SetupException;

/**
 * 流水线会话工厂
 */
public interface PipelineSessionFactory {

    /**
     * 打开任务会话：确认存储桶与索引存在，并创建任务独占的下载连接池
     *
     * @throws SetupException 存储或索引不可用
     */
    PipelineSession open(String jobId);
}
