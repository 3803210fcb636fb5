package org.buaa.imagesearch.service.impl;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Result;
import co.elastic.clients.elasticsearch.core.IndexResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.indices.IndicesStatsResponse;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.dao.entity.ImageDocumentDO;
import org.buaa.imagesearch.dto.IndexRecord;
import org.buaa.imagesearch.dto.IndexStats;
import org.buaa.imagesearch.dto.ScoredRecord;
import org.buaa.imagesearch.dto.Vector;
import org.buaa.imagesearch.service.Indexer;
import org.buaa.imagesearch.tool.RemoteErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Elasticsearch 向量索引
 * dense_vector 字段采用余弦相似度，检索使用 kNN
 */
@Service
@ConditionalOnProperty(prefix = "ingestion.index", name = "backend", havingValue = "elasticsearch", matchIfMissing = true)
public class ElasticsearchIndexer implements Indexer {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchIndexer.class);
    private static final String VECTOR_FIELD = "embedding";
    private static final int MAX_NUM_CANDIDATES = 10000;

    private final ElasticsearchClient esClient;
    private final String imageIndex;
    private final int dimension;
    private final Duration timeout;
    private final AtomicBoolean indexReady = new AtomicBoolean(false);

    public ElasticsearchIndexer(ElasticsearchClient esClient, IngestionProperties properties) {
        this.esClient = esClient;
        this.imageIndex = properties.getIndex().getName();
        this.dimension = properties.getVectorDimension();
        this.timeout = properties.getTimeouts().getIndex();
    }

    @Override
    public Mono<Void> ensureIndex() {
        if (indexReady.get()) {
            return Mono.empty();
        }
        return blocking(() -> {
            boolean exists = esClient.indices().exists(e -> e.index(imageIndex)).value();
            if (!exists) {
                esClient.indices().create(c -> c
                    .index(imageIndex)
                    .mappings(m -> m
                        .properties("imageId", p -> p.keyword(k -> k))
                        .properties("imageUrl", p -> p.keyword(k -> k.index(false)))
                        .properties("blobName", p -> p.keyword(k -> k))
                        .properties("createdAt", p -> p.keyword(k -> k))
                        .properties("metadata", p -> p.flattened(f -> f))
                        .properties(VECTOR_FIELD, p -> p.denseVector(d -> d
                            .dims(dimension)
                            .index(true)
                            .similarity("cosine")))));
                log.info("创建图片索引: {}, 向量维度: {}", imageIndex, dimension);
            }
            indexReady.set(true);
            return Boolean.TRUE;
        }).then();
    }

    @Override
    public Mono<Boolean> publish(IndexRecord record) {
        try {
            record.getVector().requireDimension(dimension);
        } catch (RuntimeException e) {
            return Mono.error(e);
        }
        ImageDocumentDO document = ImageDocumentDO.builder()
            .imageId(record.getId())
            .imageUrl(record.getPrimaryAddress())
            .blobName(record.getSecondaryAddress())
            .embedding(record.getVector().toArray())
            .metadata(record.getMetadata())
            .createdAt(LocalDateTime.now().toString())
            .build();

        return blocking(() -> {
            IndexResponse response = esClient.index(i -> i
                .index(imageIndex)
                .id(record.getId())
                .document(document));
            log.debug("索引写入完成 - 图片ID: {}, 结果: {}", record.getId(), response.result());
            return response.result() == Result.Created || response.result() == Result.Updated;
        });
    }

    @Override
    public Mono<List<ScoredRecord>> search(Vector query, int k) {
        if (k <= 0) {
            return Mono.error(new ValidationException("检索数量必须大于 0"));
        }
        try {
            query.requireDimension(dimension);
        } catch (RuntimeException e) {
            return Mono.error(e);
        }
        int numCandidates = Math.max(k, Math.min(k * 10, MAX_NUM_CANDIDATES));
        List<Float> queryVector = query.toList();

        return blocking(() -> {
            try {
                SearchResponse<ImageDocumentDO> response = esClient.search(s -> s
                    .index(imageIndex)
                    .knn(knn -> knn
                        .field(VECTOR_FIELD)
                        .queryVector(queryVector)
                        .k(k)
                        .numCandidates(numCandidates))
                    .size(k)
                    .source(src -> src.filter(f -> f.excludes(VECTOR_FIELD))), ImageDocumentDO.class);

                return response.hits().hits().stream()
                    .filter(hit -> hit.source() != null)
                    .map(hit -> new ScoredRecord(
                        hit.id(),
                        hit.source().getImageUrl(),
                        hit.source().getBlobName(),
                        hit.source().getMetadata() == null ? Collections.emptyMap() : hit.source().getMetadata(),
                        hit.score() == null ? 0.0 : hit.score()))
                    .collect(Collectors.toList());
            } catch (ElasticsearchException e) {
                if (isIndexMissing(e)) {
                    log.warn("索引 {} 不存在，返回空结果", imageIndex);
                    return Collections.<ScoredRecord>emptyList();
                }
                throw e;
            }
        });
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return blocking(() -> {
            try {
                Result result = esClient.delete(d -> d.index(imageIndex).id(id)).result();
                log.info("索引删除 - 图片ID: {}, 结果: {}", id, result);
                return result == Result.Deleted;
            } catch (ElasticsearchException e) {
                if (isIndexMissing(e)) {
                    return Boolean.FALSE;
                }
                throw e;
            }
        });
    }

    @Override
    public Mono<IndexStats> stats() {
        return blocking(() -> {
            try {
                long count = esClient.count(c -> c.index(imageIndex)).count();
                IndicesStatsResponse statsResponse = esClient.indices().stats(s -> s.index(imageIndex));
                long sizeInBytes = statsResponse.indices().values().stream()
                    .filter(stats -> stats.total() != null && stats.total().store() != null)
                    .mapToLong(stats -> stats.total().store().sizeInBytes())
                    .sum();
                return new IndexStats(count, sizeInBytes);
            } catch (ElasticsearchException e) {
                if (isIndexMissing(e)) {
                    return new IndexStats(0, 0);
                }
                throw e;
            }
        });
    }

    private <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call)
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .onErrorMap(RemoteErrors::classify);
    }

    private boolean isIndexMissing(Throwable error) {
        if (error == null) {
            return false;
        }
        String message = error.getMessage();
        if (message != null && message.toLowerCase(Locale.ROOT).contains("index_not_found")) {
            return true;
        }
        return isIndexMissing(error.getCause());
    }
}
