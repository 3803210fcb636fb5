package org.buaa.imagesearch.service.impl;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.ingest.ProgressRecord;
import org.buaa.imagesearch.service.ProgressStore;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 Guava Cache 的进度存储
 *
 * <p>未结束的任务保存在常驻表中，不会被淘汰；任务进入终态后移入缓存，
 * 写入后超过保留时长自动淘汰，超过容量上限时淘汰最早的记录。</p>
 */
@Component
public class InMemoryProgressStore implements ProgressStore {

    private final Map<String, ProgressRecord> activeRecords = new ConcurrentHashMap<>();
    private final Cache<String, ProgressRecord> finishedRecords;

    public InMemoryProgressStore(IngestionProperties properties) {
        IngestionProperties.Progress config = properties.getProgress();
        this.finishedRecords = CacheBuilder.newBuilder()
            .expireAfterWrite(config.getRetention())
            .maximumSize(config.getMaxJobs())
            .build();
    }

    @Override
    public Optional<ProgressRecord> get(String jobId) {
        ProgressRecord active = activeRecords.get(jobId);
        if (active != null) {
            return Optional.of(active);
        }
        return Optional.ofNullable(finishedRecords.getIfPresent(jobId));
    }

    @Override
    public void put(ProgressRecord record) {
        String jobId = record.getJobId();
        if (record.getStatus().isTerminal()) {
            // 先写缓存再移出常驻表，读取方不会看到空档
            finishedRecords.put(jobId, record);
            activeRecords.remove(jobId);
        } else {
            activeRecords.put(jobId, record);
            finishedRecords.invalidate(jobId);
        }
    }

    @Override
    public boolean remove(String jobId) {
        boolean active = activeRecords.remove(jobId) != null;
        boolean finished = finishedRecords.asMap().remove(jobId) != null;
        return active || finished;
    }

    @Override
    public long size() {
        finishedRecords.cleanUp();
        return activeRecords.size() + finishedRecords.size();
    }
}
