package org.buaa.imagesearch.ingest;

import org.buaa.imagesearch.common.consts.SystemConstants;
import org.buaa.imagesearch.common.convention.exception.AbstractException;
import org.buaa.imagesearch.common.convention.exception.NotFoundException;
import org.buaa.imagesearch.common.convention.exception.SetupException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.dto.IndexRecord;
import org.buaa.imagesearch.dto.ProcessedMedia;
import org.buaa.imagesearch.dto.SourceItem;
import org.buaa.imagesearch.dto.Vector;
import org.buaa.imagesearch.tool.RetryableCaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 批量摄取编排
 *
 * <p>任务按批顺序执行：批内图片并发处理，一批全部结束后才开始下一批，批与批之间按配置节流。
 * 单张图片的失败只记录在进度中，不会中断任务；只有会话初始化失败会使整个任务失败。</p>
 */
@Component
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final PipelineSessionFactory sessionFactory;
    private final ProgressTracker progressTracker;
    private final RetryableCaller retryableCaller;
    private final IngestionProperties properties;
    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();

    public BatchOrchestrator(PipelineSessionFactory sessionFactory,
                             ProgressTracker progressTracker,
                             RetryableCaller retryableCaller,
                             IngestionProperties properties) {
        this.sessionFactory = sessionFactory;
        this.progressTracker = progressTracker;
        this.retryableCaller = retryableCaller;
        this.properties = properties;
    }

    /**
     * 在摄取线程池中执行任务
     */
    @Async("ingestionJobExecutor")
    public void runAsync(BatchJob job) {
        run(job);
    }

    /**
     * 同步执行任务，返回最终进度
     */
    public ProgressRecord run(BatchJob job) {
        List<List<SourceItem>> batches = job.partition();
        log.info("开始摄取任务 - 任务: {}, 图片数: {}, 批大小: {}, 批数: {}",
            job.getId(), job.size(), job.getBatchSize(), batches.size());
        int started = 0;
        try {
            try (PipelineSession session = sessionFactory.open(job.getId())) {
                for (int i = 0; i < batches.size(); i++) {
                    if (isCancelled(job.getId())) {
                        return finishCancelled(job.getId());
                    }
                    if (i == 0) {
                        progressTracker.markRunning(job.getId());
                    }
                    List<SourceItem> batch = batches.get(i);
                    started += batch.size();
                    List<ItemOutcome> outcomes = runBatch(session, batch);
                    progressTracker.recordBatch(job.getId(), batch.get(0), outcomes);

                    if (i < batches.size() - 1 && !pause()) {
                        return finishCancelled(job.getId());
                    }
                }
            }
            ProgressRecord completed = progressTracker.markCompleted(job.getId());
            log.info("摄取任务完成 - 任务: {}, 成功: {}, 失败: {}",
                job.getId(), completed.getSucceededCount(), completed.getFailedCount());
            return completed;
        } catch (SetupException e) {
            log.error("摄取任务初始化失败 - 任务: {}", job.getId(), e);
            return abort(job, started, e.getErrorMessage());
        } catch (NotFoundException e) {
            log.warn("摄取任务进度已被删除，停止执行 - 任务: {}", job.getId());
            return null;
        } catch (RuntimeException e) {
            log.error("摄取任务异常终止 - 任务: {}", job.getId(), e);
            return abort(job, started, summarize(e));
        } finally {
            cancelRequests.remove(job.getId());
        }
    }

    /**
     * 请求取消任务，当前批次结束后生效
     *
     * @return 任务存在且尚未结束时返回 true
     */
    public boolean cancel(String jobId) {
        ProgressRecord record = progressTracker.get(jobId);
        if (record.getStatus().isTerminal()) {
            return false;
        }
        cancelRequests.add(jobId);
        // 任务可能在检查之后结束，此时执行方已清理过取消标记
        Optional<ProgressRecord> latest = progressTracker.find(jobId);
        if (latest.isEmpty() || latest.get().getStatus().isTerminal()) {
            cancelRequests.remove(jobId);
            return false;
        }
        log.info("收到取消请求 - 任务: {}", jobId);
        return true;
    }

    int pendingCancelRequests() {
        return cancelRequests.size();
    }

    private boolean isCancelled(String jobId) {
        return cancelRequests.contains(jobId) || progressTracker.find(jobId).isEmpty();
    }

    private ProgressRecord finishCancelled(String jobId) {
        log.info("摄取任务已取消 - 任务: {}", jobId);
        return progressTracker.markCancelled(jobId);
    }

    private ProgressRecord abort(BatchJob job, int started, String reason) {
        List<SourceItem> unstarted = job.getItems().subList(Math.min(started, job.size()), job.size());
        return progressTracker.markFailed(job.getId(), unstarted, reason);
    }

    /**
     * 批间节流，等待期间被中断视为取消
     */
    private boolean pause() {
        Duration delay = properties.getPacingDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 批内并发处理，全部图片结束后返回
     */
    List<ItemOutcome> runBatch(PipelineSession session, List<SourceItem> batch) {
        int concurrency = properties.resolveConcurrency(batch.size());
        return Flux.fromIterable(batch)
            .flatMap(item -> processItem(session, item), concurrency)
            .collectList()
            .block();
    }

    /**
     * 单张图片：下载、归一化、生成向量、存储、写索引；任何失败都转换为失败结果
     */
    private Mono<ItemOutcome> processItem(PipelineSession session, SourceItem item) {
        Instant startTime = Instant.now();
        String imageId = UUID.randomUUID().toString();
        String objectKey = imageId + SystemConstants.PROCESSED_EXTENSION;

        return retryableCaller.call("fetch", () -> session.getFetcher().fetch(item))
            .flatMap(raw -> Mono.fromCallable(() -> session.getTransformer().transform(raw, buildMetadata(item)))
                .subscribeOn(Schedulers.boundedElastic()))
            .flatMap(media -> session.getDeriver().derive(media.getContent())
                .flatMap(vector -> persistAndPublish(session, imageId, objectKey, media, vector)))
            .map(published -> published
                ? ItemOutcome.success(item, imageId)
                : ItemOutcome.failure(item, "索引写入未被确认"))
            .defaultIfEmpty(ItemOutcome.failure(item, "处理流程未产生结果"))
            .doOnNext(outcome -> {
                if (outcome.isSuccess()) {
                    log.debug("图片处理成功 - 地址: {}, 图片ID: {}, 耗时: {}ms",
                        item, imageId, Duration.between(startTime, Instant.now()).toMillis());
                }
            })
            .onErrorResume(error -> {
                log.error("图片处理失败 - 地址: {}, 原因: {}", item, summarize(error));
                return Mono.just(ItemOutcome.failure(item, summarize(error)));
            });
    }

    private Mono<Boolean> persistAndPublish(PipelineSession session,
                                            String imageId,
                                            String objectKey,
                                            ProcessedMedia media,
                                            Vector vector) {
        return retryableCaller.call("store",
                () -> session.getPersister().store(objectKey, media.getContent(), media.getMetadata()))
            .flatMap(publicUrl -> {
                IndexRecord record = IndexRecord.builder()
                    .id(imageId)
                    .vector(vector)
                    .primaryAddress(publicUrl)
                    .secondaryAddress(objectKey)
                    .metadata(media.getMetadata())
                    .build();
                return retryableCaller.call("publish", () -> session.getIndexer().publish(record));
            });
    }

    private Map<String, String> buildMetadata(SourceItem item) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(SystemConstants.META_SOURCE_URL, item.getUrl());
        metadata.put(SystemConstants.META_INDEXED_AT, Instant.now().toString());
        return metadata;
    }

    static String summarize(Throwable error) {
        if (error instanceof AbstractException) {
            return ((AbstractException) error).getErrorMessage();
        }
        String message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : error.getClass().getSimpleName() + ": " + message;
    }
}
