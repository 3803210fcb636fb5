package org.buaa.imagesearch.service.impl;

import cn.hutool.core.util.StrUtil;
import org.buaa.imagesearch.common.convention.exception.FetchException;
import org.buaa.imagesearch.common.convention.exception.TransientRemoteException;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.dto.SourceItem;
import org.buaa.imagesearch.service.MediaFetcher;
import org.buaa.imagesearch.tool.RemoteErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.TimeoutException;

/**
 * 基于 WebClient 的图片下载器
 * 由任务会话创建，持有任务独占的连接池
 */
public class HttpMediaFetcher implements MediaFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpMediaFetcher.class);

    private final WebClient httpClient;
    private final long maxFileSize;
    private final Duration timeout;

    public HttpMediaFetcher(WebClient httpClient, long maxFileSize, Duration timeout) {
        this.httpClient = httpClient;
        this.maxFileSize = maxFileSize;
        this.timeout = timeout;
    }

    @Override
    public Mono<byte[]> fetch(SourceItem source) {
        String url = source == null ? null : source.getUrl();
        URI uri;
        try {
            uri = parseUri(url);
        } catch (ValidationException e) {
            return Mono.error(e);
        }

        log.debug("下载图片: {}", url);
        return httpClient.get()
            .uri(uri)
            .accept(MediaType.ALL)
            .exchangeToMono(response -> readImage(url, response))
            .timeout(timeout)
            .onErrorMap(TimeoutException.class,
                e -> new TransientRemoteException("图片下载超时: " + url, e))
            .onErrorMap(WebClientRequestException.class,
                e -> new TransientRemoteException("图片下载连接失败: " + url + ", " + e.getMessage(), e))
            .onErrorMap(DataBufferLimitException.class,
                e -> new FetchException(url, "图片超过大小限制: " + maxFileSize + " 字节", e));
    }

    private Mono<byte[]> readImage(String url, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (!status.is2xxSuccessful()) {
            String message = "图片下载失败: HTTP " + status.value() + ", " + url;
            Mono<byte[]> error = RemoteErrors.isRetriableStatus(status.value())
                ? Mono.error(new TransientRemoteException(message, null))
                : Mono.error(new FetchException(url, message));
            return response.releaseBody().then(error);
        }

        MediaType contentType = response.headers().contentType().orElse(null);
        if (contentType == null || !"image".equalsIgnoreCase(contentType.getType())) {
            return response.releaseBody()
                .then(Mono.error(new FetchException(url, "地址内容不是图片: " + contentType)));
        }

        OptionalLong contentLength = response.headers().contentLength();
        if (contentLength.isPresent() && contentLength.getAsLong() > maxFileSize) {
            return response.releaseBody()
                .then(Mono.error(new FetchException(url, "图片超过大小限制: " + contentLength.getAsLong() + " 字节")));
        }

        return response.bodyToMono(byte[].class)
            .switchIfEmpty(Mono.error(new FetchException(url, "图片内容为空")))
            .flatMap(bytes -> bytes.length > maxFileSize
                ? Mono.error(new FetchException(url, "图片超过大小限制: " + bytes.length + " 字节"))
                : Mono.just(bytes));
    }

    private URI parseUri(String url) {
        if (StrUtil.isBlank(url)) {
            throw new ValidationException("图片地址不能为空");
        }
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme) || uri.getHost() == null) {
                throw new ValidationException("图片地址格式非法: " + url);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("图片地址格式非法: " + url, e);
        }
    }
}
