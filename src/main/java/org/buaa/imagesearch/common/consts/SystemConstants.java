package org.buaa.imagesearch.common.consts;

/**
 * 系统常量
 */
public class SystemConstants {

    /**
     * 相似原因生成失败时的兜底说明
     */
    public static final String FALLBACK_EXPLANATION = "Both images share similar visual characteristics and composition.";

    /**
     * 图片描述提示词
     */
    public static final String DESCRIBE_PROMPT = "Generate a detailed description of this image that captures its visual elements, objects, colors, composition, and style.";

    /**
     * 相似原因提示词
     */
    public static final String COMPARE_PROMPT = "Compare these two images and explain why they are visually similar in 1 short sentence. Focus on the most obvious visual similarity like objects, colors, or composition.";

    /**
     * 归一化后图片的内容类型
     */
    public static final String PROCESSED_CONTENT_TYPE = "image/jpeg";

    /**
     * 存储对象扩展名
     */
    public static final String PROCESSED_EXTENSION = ".jpg";

    /**
     * CSV 中图片地址列名
     */
    public static final String CSV_URL_COLUMN = "photo_image_url";

    /**
     * 元数据：来源地址
     */
    public static final String META_SOURCE_URL = "source_url";

    /**
     * 元数据：索引时间
     */
    public static final String META_INDEXED_AT = "indexed_at";
}
