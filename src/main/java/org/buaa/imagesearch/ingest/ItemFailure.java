package org.buaa.imagesearch.ingest;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.buaa.imagesearch.dto.SourceItem;

/**
 * 单张图片的失败记录
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class ItemFailure {

    private final SourceItem item;

    private final String error;
}
