package org.buaa.imagesearch.ingest;

import lombok.Getter;
import lombok.ToString;
import org.buaa.imagesearch.dto.SourceItem;

/**
 * 单张图片的处理结果，成功时携带图片ID，失败时携带错误摘要
 */
@Getter
@ToString
public final class ItemOutcome {

    private final SourceItem item;

    private final boolean success;

    private final String imageId;

    private final String errorSummary;

    private ItemOutcome(SourceItem item, boolean success, String imageId, String errorSummary) {
        this.item = item;
        this.success = success;
        this.imageId = imageId;
        this.errorSummary = errorSummary;
    }

    public static ItemOutcome success(SourceItem item, String imageId) {
        return new ItemOutcome(item, true, imageId, null);
    }

    public static ItemOutcome failure(SourceItem item, String errorSummary) {
        return new ItemOutcome(item, false, null, errorSummary);
    }

    public ItemFailure toFailure() {
        if (success) {
            throw new IllegalStateException("成功结果不能转换为失败记录: " + item);
        }
        return new ItemFailure(item, errorSummary);
    }
}
