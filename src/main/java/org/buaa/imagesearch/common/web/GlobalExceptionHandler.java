package org.buaa.imagesearch.common.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.buaa.imagesearch.common.convention.errorcode.ImageSearchErrorCode;
import org.buaa.imagesearch.common.convention.exception.AbstractException;
import org.buaa.imagesearch.common.convention.exception.NotFoundException;
import org.buaa.imagesearch.common.convention.result.Result;
import org.buaa.imagesearch.common.convention.result.Results;
import org.springframework.http.HttpStatus;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * 全局异常处理器
 * 统一捕获并处理所有Controller抛出的异常
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理参数校验异常（Bean Validation）
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public Result<Void> handleValidationException(MethodArgumentNotValidException ex, HttpServletRequest request) {
        FieldError firstError = ex.getBindingResult().getFieldError();
        String errorMessage = firstError != null ? firstError.getDefaultMessage() : "参数校验失败";

        log.error("[{}] {} - 参数校验失败: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                errorMessage);

        return Results.failure(ImageSearchErrorCode.PARAM_INVALID.code(), errorMessage);
    }

    /**
     * 处理方法参数约束异常（@RequestParam 上的 @Min/@Max 等）
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public Result<Void> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        log.error("[{}] {} - 参数约束不满足: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                ex.getMessage());
        return Results.failure(ImageSearchErrorCode.PARAM_INVALID.code(), ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public Result<Void> handleUploadTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        log.error("[{}] {} - 上传文件过大", request.getMethod(), getFullRequestUrl(request));
        return Results.failure(ImageSearchErrorCode.FILE_SIZE_EXCEEDED);
    }

    /**
     * 资源不存在，返回 404
     */
    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Result<Void> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        log.warn("[{}] {} - 资源不存在: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                ex.getErrorMessage());
        return Results.failure(ex);
    }

    /**
     * 处理业务异常（ClientException / ServiceException）
     */
    @ExceptionHandler(AbstractException.class)
    public Result<Void> handleAbstractException(AbstractException ex, HttpServletRequest request) {
        // 如果有原始异常，打印完整堆栈；否则只打印错误信息
        if (ex.getCause() != null) {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode(),
                    ex);
        } else {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode());
        }

        return Results.failure(ex);
    }

    /**
     * 处理未捕获的异常（兜底处理）
     */
    @ExceptionHandler(Throwable.class)
    public Result<Void> handleThrowable(Throwable throwable, HttpServletRequest request) {
        log.error("[{}] {} - 系统异常",
                request.getMethod(),
                getFullRequestUrl(request),
                throwable);

        // 返回通用服务端错误，避免暴露内部异常细节
        return Results.failure(ImageSearchErrorCode.SERVICE_ERROR);
    }

    private String getFullRequestUrl(HttpServletRequest request) {
        String queryString = request.getQueryString();
        return request.getRequestURI() +
                (queryString != null ? "?" + queryString : "");
    }
}
