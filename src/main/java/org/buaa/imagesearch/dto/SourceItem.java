package org.buaa.imagesearch.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 待摄取的图片地址，由调用方提供，不可变
 */
@Getter
@EqualsAndHashCode
public final class SourceItem {

    @JsonValue
    private final String url;

    private SourceItem(String url) {
        this.url = url;
    }

    public static SourceItem of(String url) {
        return new SourceItem(url == null ? null : url.trim());
    }

    @Override
    public String toString() {
        return url;
    }
}
