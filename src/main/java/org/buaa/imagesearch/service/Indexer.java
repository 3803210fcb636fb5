package org.buaa.imagesearch.service;

import org.buaa.imagesearch.dto.IndexRecord;
import org.buaa.imagesearch.dto.IndexStats;
import org.buaa.imagesearch.dto.ScoredRecord;
import org.buaa.imagesearch.dto.Vector;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 向量索引
 */
public interface Indexer {

    /**
     * 确保索引存在，不存在时按配置维度创建，可重复调用
     */
    Mono<Void> ensureIndex();

    /**
     * 写入记录，相同 id 覆盖；向量维度不符时抛出 DimensionMismatchException
     *
     * @return 写入是否被确认
     */
    Mono<Boolean> publish(IndexRecord record);

    /**
     * 余弦相似度检索，按得分降序返回至多 k 条
     */
    Mono<List<ScoredRecord>> search(Vector query, int k);

    /**
     * 删除记录，记录不存在时返回 false
     */
    Mono<Boolean> delete(String id);

    Mono<IndexStats> stats();
}
