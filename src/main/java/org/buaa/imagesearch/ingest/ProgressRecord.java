package org.buaa.imagesearch.ingest;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.buaa.imagesearch.dto.SourceItem;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 任务进度快照，不可变；每次更新产生新快照
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class ProgressRecord {

    private final String jobId;

    private final JobStatus status;

    private final int totalCount;

    private final int processedCount;

    private final int succeededCount;

    /** 最近一批的首个图片地址 */
    private final SourceItem currentItem;

    @Singular
    private final List<ItemFailure> failures;

    private final LocalDateTime createdAt;

    private final LocalDateTime updatedAt;

    public static ProgressRecord queued(BatchJob job) {
        LocalDateTime now = LocalDateTime.now();
        return ProgressRecord.builder()
            .jobId(job.getId())
            .status(JobStatus.QUEUED)
            .totalCount(job.size())
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * 状态迁移，不允许回退
     */
    public ProgressRecord withStatus(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(String.format("任务 %s 状态不能从 %s 变为 %s", jobId, status, next));
        }
        return toBuilder().status(next).updatedAt(LocalDateTime.now()).build();
    }

    /**
     * 合并一批的处理结果
     */
    public ProgressRecord withBatch(SourceItem batchHead, List<ItemOutcome> outcomes) {
        if (status.isTerminal()) {
            throw new IllegalStateException("任务已结束，不能继续记录进度: " + jobId);
        }
        if (processedCount + outcomes.size() > totalCount) {
            throw new IllegalStateException(String.format("任务 %s 已处理数 %d 超过总数 %d",
                jobId, processedCount + outcomes.size(), totalCount));
        }
        ProgressRecordBuilder builder = toBuilder()
            .processedCount(processedCount + outcomes.size())
            .currentItem(batchHead)
            .updatedAt(LocalDateTime.now());
        int succeeded = succeededCount;
        for (ItemOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                succeeded++;
            } else {
                builder.failure(outcome.toFailure());
            }
        }
        return builder.succeededCount(succeeded).build();
    }

    /**
     * 任务级失败：为每个未开始的图片追加一条失败记录
     */
    public ProgressRecord withAbort(List<SourceItem> unstarted, String reason) {
        ProgressRecordBuilder builder = toBuilder()
            .status(nextFailedStatus())
            .updatedAt(LocalDateTime.now());
        for (SourceItem item : unstarted) {
            builder.failure(new ItemFailure(item, reason));
        }
        return builder.build();
    }

    private JobStatus nextFailedStatus() {
        if (!status.canTransitionTo(JobStatus.FAILED)) {
            throw new IllegalStateException(String.format("任务 %s 状态不能从 %s 变为 %s", jobId, status, JobStatus.FAILED));
        }
        return JobStatus.FAILED;
    }

    public int getFailedCount() {
        return failures.size();
    }
}
