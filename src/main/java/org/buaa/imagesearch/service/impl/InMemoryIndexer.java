package org.buaa.imagesearch.service.impl;

import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.dto.IndexRecord;
import org.buaa.imagesearch.dto.IndexStats;
import org.buaa.imagesearch.dto.ScoredRecord;
import org.buaa.imagesearch.dto.Vector;
import org.buaa.imagesearch.service.Indexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 进程内向量索引，暴力计算余弦相似度
 * 用于本地开发与测试，得分与 Elasticsearch cosine 一致映射到 [0, 1]
 */
@Service
@ConditionalOnProperty(prefix = "ingestion.index", name = "backend", havingValue = "memory")
public class InMemoryIndexer implements Indexer {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIndexer.class);

    private final Map<String, IndexRecord> records = new ConcurrentHashMap<>();
    private final int dimension;

    public InMemoryIndexer(IngestionProperties properties) {
        this.dimension = properties.getVectorDimension();
    }

    @Override
    public Mono<Void> ensureIndex() {
        return Mono.empty();
    }

    @Override
    public Mono<Boolean> publish(IndexRecord record) {
        return Mono.fromCallable(() -> {
            record.getVector().requireDimension(dimension);
            records.put(record.getId(), record);
            log.debug("内存索引写入 - 图片ID: {}, 当前记录数: {}", record.getId(), records.size());
            return Boolean.TRUE;
        });
    }

    @Override
    public Mono<List<ScoredRecord>> search(Vector query, int k) {
        return Mono.fromCallable(() -> {
            if (k <= 0) {
                throw new ValidationException("检索数量必须大于 0");
            }
            query.requireDimension(dimension);
            return records.values().stream()
                .map(record -> new ScoredRecord(
                    record.getId(),
                    record.getPrimaryAddress(),
                    record.getSecondaryAddress(),
                    record.getMetadata(),
                    query.similarityScore(record.getVector())))
                .sorted(Comparator.comparingDouble(ScoredRecord::getScore).reversed())
                .limit(k)
                .collect(Collectors.toList());
        });
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return Mono.fromCallable(() -> records.remove(id) != null);
    }

    @Override
    public Mono<IndexStats> stats() {
        return Mono.fromCallable(() -> new IndexStats(records.size(), (long) records.size() * dimension * Float.BYTES));
    }
}
