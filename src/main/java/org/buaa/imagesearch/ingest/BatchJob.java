package org.buaa.imagesearch.ingest;

import lombok.Getter;
import lombok.ToString;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.dto.SourceItem;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 摄取任务，提交后不可变
 */
@Getter
@ToString(exclude = "items")
public final class BatchJob {

    private final String id;

    private final List<SourceItem> items;

    private final int batchSize;

    private final LocalDateTime createdAt;

    private BatchJob(String id, List<SourceItem> items, int batchSize) {
        this.id = id;
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.batchSize = batchSize;
        this.createdAt = LocalDateTime.now();
    }

    public static BatchJob create(List<SourceItem> items, int batchSize) {
        return create(UUID.randomUUID().toString(), items, batchSize);
    }

    public static BatchJob create(String id, List<SourceItem> items, int batchSize) {
        if (items == null || items.isEmpty()) {
            throw new ValidationException("图片地址列表不能为空");
        }
        if (batchSize < 1) {
            throw new ValidationException("批大小必须大于等于 1");
        }
        return new BatchJob(id, items, batchSize);
    }

    public int size() {
        return items.size();
    }

    /**
     * 按批大小切分，除最后一批外每批恰好 batchSize 个
     */
    public List<List<SourceItem>> partition() {
        List<List<SourceItem>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += batchSize) {
            batches.add(items.subList(start, Math.min(start + batchSize, items.size())));
        }
        return batches;
    }
}
