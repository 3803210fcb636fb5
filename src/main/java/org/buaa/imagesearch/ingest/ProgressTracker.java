package org.buaa.imagesearch.ingest;

import com.google.common.util.concurrent.Striped;
import org.buaa.imagesearch.common.convention.exception.NotFoundException;
import org.buaa.imagesearch.dto.SourceItem;
import org.buaa.imagesearch.service.ProgressStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.UnaryOperator;

/**
 * 任务进度跟踪
 * 同一任务的更新串行执行，读取方总是拿到完整的快照
 */
@Component
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final ProgressStore store;
    private final Striped<Lock> jobLocks = Striped.lock(64);

    public ProgressTracker(ProgressStore store) {
        this.store = store;
    }

    public ProgressRecord create(BatchJob job) {
        ProgressRecord record = ProgressRecord.queued(job);
        store.put(record);
        return record;
    }

    public Optional<ProgressRecord> find(String jobId) {
        return store.get(jobId);
    }

    public ProgressRecord get(String jobId) {
        return store.get(jobId).orElseThrow(() -> new NotFoundException("任务不存在: " + jobId));
    }

    public ProgressRecord markRunning(String jobId) {
        return update(jobId, record -> record.withStatus(JobStatus.RUNNING));
    }

    public ProgressRecord recordBatch(String jobId, SourceItem batchHead, List<ItemOutcome> outcomes) {
        ProgressRecord updated = update(jobId, record -> record.withBatch(batchHead, outcomes));
        log.info("批次完成 - 任务: {}, 进度: {}/{}, 失败: {}",
            jobId, updated.getProcessedCount(), updated.getTotalCount(), updated.getFailedCount());
        return updated;
    }

    public ProgressRecord markCompleted(String jobId) {
        return update(jobId, record -> record.withStatus(JobStatus.COMPLETED));
    }

    public ProgressRecord markCancelled(String jobId) {
        return update(jobId, record -> record.withStatus(JobStatus.CANCELLED));
    }

    public ProgressRecord markFailed(String jobId, List<SourceItem> unstarted, String reason) {
        return update(jobId, record -> record.withAbort(unstarted, reason));
    }

    public boolean remove(String jobId) {
        Lock lock = jobLocks.get(jobId);
        lock.lock();
        try {
            return store.remove(jobId);
        } finally {
            lock.unlock();
        }
    }

    public long trackedJobs() {
        return store.size();
    }

    private ProgressRecord update(String jobId, UnaryOperator<ProgressRecord> change) {
        Lock lock = jobLocks.get(jobId);
        lock.lock();
        try {
            ProgressRecord updated = change.apply(get(jobId));
            store.put(updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }
}
