package org.buaa.imagesearch.tool;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import io.minio.errors.ServerException;
import org.buaa.imagesearch.common.convention.exception.AbstractException;
import org.buaa.imagesearch.common.convention.exception.PermanentRemoteException;
import org.buaa.imagesearch.common.convention.exception.TransientRemoteException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * 远程调用异常分类
 *
 * <p>超时、连接失败、5xx、429 以及对象存储服务端错误归为可重试；其余 4xx 与无法识别的异常归为不可重试。
 * 已经是业务异常的直接透传。</p>
 */
public final class RemoteErrors {

    private static final int TOO_MANY_REQUESTS = 429;

    private RemoteErrors() {
    }

    public static Throwable classify(Throwable error) {
        if (error instanceof AbstractException) {
            return error;
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException responseError = (WebClientResponseException) error;
            int status = responseError.getStatusCode().value();
            String message = "远程服务返回 HTTP " + status;
            return isRetriableStatus(status)
                ? new TransientRemoteException(message, error)
                : new PermanentRemoteException(message, error);
        }
        if (error instanceof ElasticsearchException) {
            int status = ((ElasticsearchException) error).status();
            String message = "Elasticsearch 返回 HTTP " + status + ": " + error.getMessage();
            return isRetriableStatus(status)
                ? new TransientRemoteException(message, error)
                : new PermanentRemoteException(message, error);
        }
        if (error instanceof ServerException) {
            return new TransientRemoteException("对象存储服务端错误: " + error.getMessage(), error);
        }
        if (error instanceof TimeoutException) {
            return new TransientRemoteException("远程调用超时", error);
        }
        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return new TransientRemoteException("远程连接失败: " + error.getMessage(), error);
        }
        return new PermanentRemoteException("远程调用失败: " + error.getMessage(), error);
    }

    public static boolean isTransient(Throwable error) {
        return error instanceof TransientRemoteException;
    }

    public static boolean isRetriableStatus(int status) {
        return status >= 500 || status == TOO_MANY_REQUESTS;
    }
}
