package org.buaa.imagesearch.service.impl;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.SetBucketPolicyArgs;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import org.buaa.imagesearch.common.consts.SystemConstants;
import org.buaa.imagesearch.common.convention.exception.NotFoundException;
import org.buaa.imagesearch.common.convention.exception.ValidationException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.service.Persister;
import org.buaa.imagesearch.tool.RemoteErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MinIO 对象存储
 * MinIO 客户端为阻塞调用，统一切换到 boundedElastic 线程执行
 */
@Service
public class MinioMediaPersister implements Persister {

    private static final Logger log = LoggerFactory.getLogger(MinioMediaPersister.class);

    private static final String PUBLIC_READ_POLICY = "{\"Version\":\"2012-10-17\",\"Statement\":[{\"Effect\":\"Allow\","
        + "\"Principal\":{\"AWS\":[\"*\"]},\"Action\":[\"s3:GetObject\"],\"Resource\":[\"arn:aws:s3:::%s/*\"]}]}";

    private final MinioClient minioClient;
    private final String storageBucket;
    private final String publicUrl;
    private final Duration timeout;
    private final AtomicBoolean namespaceReady = new AtomicBoolean(false);

    public MinioMediaPersister(MinioClient minioClient,
                               IngestionProperties properties,
                               @Value("${minio.bucketName}") String storageBucket,
                               @Value("${minio.publicUrl:${minio.endpoint}}") String publicUrl) {
        this.minioClient = minioClient;
        this.storageBucket = storageBucket;
        this.publicUrl = publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
        this.timeout = properties.getTimeouts().getStorage();
    }

    @Override
    public Mono<Void> ensureNamespace() {
        if (namespaceReady.get()) {
            return Mono.empty();
        }
        return blocking(() -> {
            boolean exists = minioClient.bucketExists(BucketExistsArgs.builder().bucket(storageBucket).build());
            if (!exists) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(storageBucket).build());
                minioClient.setBucketPolicy(SetBucketPolicyArgs.builder()
                    .bucket(storageBucket)
                    .config(String.format(PUBLIC_READ_POLICY, storageBucket))
                    .build());
                log.info("创建存储桶: {}", storageBucket);
            }
            namespaceReady.set(true);
            return Boolean.TRUE;
        }).then();
    }

    @Override
    public Mono<String> store(String key, byte[] content, Map<String, String> metadata) {
        if (key == null || key.isBlank() || content == null) {
            return Mono.error(new ValidationException("存储键与内容不能为空"));
        }
        return blocking(() -> {
            minioClient.putObject(PutObjectArgs.builder()
                .bucket(storageBucket)
                .object(key)
                .stream(new ByteArrayInputStream(content), content.length, -1)
                .contentType(SystemConstants.PROCESSED_CONTENT_TYPE)
                .userMetadata(metadata == null ? Map.of() : metadata)
                .build());
            log.debug("对象写入完成: {}/{}, {} 字节", storageBucket, key, content.length);
            return buildPublicUrl(key);
        });
    }

    @Override
    public Mono<byte[]> retrieve(String key) {
        return blocking(() -> {
            try (InputStream inputStream = minioClient.getObject(
                GetObjectArgs.builder()
                    .bucket(storageBucket)
                    .object(key)
                    .build())) {
                return inputStream.readAllBytes();
            }
        });
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return blocking(() -> {
            try {
                minioClient.statObject(StatObjectArgs.builder().bucket(storageBucket).object(key).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    return Boolean.FALSE;
                }
                throw e;
            }
            minioClient.removeObject(RemoveObjectArgs.builder()
                .bucket(storageBucket)
                .object(key)
                .build());
            log.info("对象删除完成: {}/{}", storageBucket, key);
            return Boolean.TRUE;
        });
    }

    public String buildPublicUrl(String key) {
        return publicUrl + "/" + storageBucket + "/" + key;
    }

    private <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call)
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .onErrorMap(this::translate);
    }

    private Throwable translate(Throwable error) {
        if (error instanceof ErrorResponseException) {
            ErrorResponseException responseError = (ErrorResponseException) error;
            if (isMissing(responseError)) {
                return new NotFoundException("存储对象不存在: " + responseError.errorResponse().objectName(), error);
            }
        }
        return RemoteErrors.classify(error);
    }

    private boolean isMissing(ErrorResponseException error) {
        String code = error.errorResponse() == null ? null : error.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchObject".equals(code);
    }
}
