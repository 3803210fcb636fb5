package org.buaa.imagesearch.common.convention.errorcode;

/**
 * 图片检索业务错误码枚举
 *
 * 错误码规范：
 * - 0: 成功
 * - A0xxx: 客户端错误（参数校验、资源不存在等）
 * - B0xxx: 服务端错误（业务逻辑、初始化等）
 * - C0xxx: 外部依赖错误（第三方服务）
 */
public enum ImageSearchErrorCode implements IErrorCode {

    // ==================== 通用错误 ====================
    SUCCESS("0", "操作成功"),

    CLIENT_ERROR("A0001", "客户端请求错误"),

    SERVICE_ERROR("B0001", "服务端执行错误"),

    // ==================== 参数校验错误 (A01xx) ====================
    PARAM_EMPTY("A0101", "必填参数为空"),

    PARAM_INVALID("A0102", "参数格式错误"),

    // ==================== 文件相关错误 (A02xx) ====================
    FILE_TYPE_NOT_SUPPORTED("A0201", "不支持的文件格式"),

    FILE_SIZE_EXCEEDED("A0204", "文件大小超出限制"),

    CSV_PARSE_FAILED("A0205", "CSV文件解析失败"),

    // ==================== 资源不存在 (A04xx) ====================
    /**
     * 404 等价错误，任务、图片或存储对象不存在
     */
    RESOURCE_NOT_FOUND("A0401", "资源不存在"),

    // ==================== 向量错误 (A05xx) ====================
    DIMENSION_MISMATCH("A0501", "向量维度不一致"),

    // ==================== 服务端错误 (B0xxx) ====================
    /**
     * 任务依赖的外部服务初始化失败，整个任务终止
     */
    SETUP_FAILED("B0201", "任务初始化失败"),

    // ==================== 外部依赖错误 (C0xxx) ====================
    TRANSIENT_REMOTE_ERROR("C0201", "远程服务暂时不可用"),

    PERMANENT_REMOTE_ERROR("C0202", "远程服务拒绝请求"),

    MEDIA_FETCH_ERROR("C0203", "图片下载失败"),

    RETRY_EXHAUSTED("C0204", "远程调用重试次数已耗尽");

    private final String code;
    private final String message;

    ImageSearchErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return this.code;
    }

    @Override
    public String message() {
        return this.message;
    }
}
