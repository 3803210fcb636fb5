package org.buaa.imagesearch.service;

import org.buaa.imagesearch.ingest.ProgressRecord;

import java.util.Optional;

/**
 * 任务进度存储
 */
public interface ProgressStore {

    Optional<ProgressRecord> get(String jobId);

    void put(ProgressRecord record);

    /**
     * @return 记录是否存在
     */
    boolean remove(String jobId);

    long size();
}
