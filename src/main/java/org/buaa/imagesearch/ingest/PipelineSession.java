package org.buaa.imagesearch.ingest;

import lombok.Getter;
import org.buaa.imagesearch.service.Indexer;
import org.buaa.imagesearch.service.MediaFetcher;
import org.buaa.imagesearch.service.MediaTransformer;
import org.buaa.imagesearch.service.Persister;
import org.buaa.imagesearch.service.VectorDeriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 任务级流水线会话
 * 持有一次任务所需的各阶段组件，任务结束时释放任务独占的资源
 */
@Getter
public class PipelineSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineSession.class);

    private final String jobId;
    private final MediaFetcher fetcher;
    private final MediaTransformer transformer;
    private final VectorDeriver deriver;
    private final Persister persister;
    private final Indexer indexer;
    private final List<Runnable> releaseActions;

    public PipelineSession(String jobId,
                           MediaFetcher fetcher,
                           MediaTransformer transformer,
                           VectorDeriver deriver,
                           Persister persister,
                           Indexer indexer,
                           List<Runnable> releaseActions) {
        this.jobId = jobId;
        this.fetcher = fetcher;
        this.transformer = transformer;
        this.deriver = deriver;
        this.persister = persister;
        this.indexer = indexer;
        this.releaseActions = new ArrayList<>(releaseActions);
    }

    /**
     * 释放资源，单个释放动作失败不影响其余动作
     */
    @Override
    public void close() {
        for (Runnable action : releaseActions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.warn("会话资源释放失败 - 任务: {}, 原因: {}", jobId, e.getMessage(), e);
            }
        }
        log.debug("流水线会话已关闭 - 任务: {}", jobId);
    }
}
