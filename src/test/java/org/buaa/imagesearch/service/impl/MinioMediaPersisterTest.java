package org.buaa.imagesearch.service.impl;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.ObjectWriteResponse;
import io.minio.PutObjectArgs;
import io.minio.SetBucketPolicyArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.ErrorResponse;
import okhttp3.Headers;
import org.buaa.imagesearch.common.convention.exception.NotFoundException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.io.ByteArrayInputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MinioMediaPersisterTest {

    private MinioClient minioClient;
    private MinioMediaPersister persister;

    @BeforeEach
    void setUp() {
        minioClient = mock(MinioClient.class);
        persister = new MinioMediaPersister(minioClient, new IngestionProperties(), "images", "http://cdn.example.com/");
    }

    @Test
    void testStoreReturnsPublicUrlAndSendsMetadata() throws Exception {
        when(minioClient.putObject(any(PutObjectArgs.class))).thenReturn(mock(ObjectWriteResponse.class));

        StepVerifier.create(persister.store("abc.jpg", new byte[]{1, 2, 3}, Map.of("source_url", "http://example.com/a")))
            .expectNext("http://cdn.example.com/images/abc.jpg")
            .verifyComplete();

        ArgumentCaptor<PutObjectArgs> captor = ArgumentCaptor.forClass(PutObjectArgs.class);
        verify(minioClient).putObject(captor.capture());
        assertEquals("images", captor.getValue().bucket());
        assertEquals("abc.jpg", captor.getValue().object());
        assertEquals("image/jpeg", captor.getValue().contentType());
    }

    @Test
    void testRetrieveReturnsStoredBytes() throws Exception {
        byte[] content = {9, 8, 7};
        when(minioClient.getObject(any(GetObjectArgs.class))).thenReturn(
            new GetObjectResponse(Headers.of(), "images", null, "abc.jpg", new ByteArrayInputStream(content)));

        StepVerifier.create(persister.retrieve("abc.jpg"))
            .assertNext(bytes -> assertArrayEquals(content, bytes))
            .verifyComplete();
    }

    @Test
    void testStoreThenRetrieveReturnsSameBytes() throws Exception {
        Map<String, byte[]> bucket = new ConcurrentHashMap<>();
        when(minioClient.putObject(any(PutObjectArgs.class))).thenAnswer(invocation -> {
            PutObjectArgs args = invocation.getArgument(0);
            bucket.put(args.object(), args.stream().readAllBytes());
            return mock(ObjectWriteResponse.class);
        });
        when(minioClient.getObject(any(GetObjectArgs.class))).thenAnswer(invocation -> {
            GetObjectArgs args = invocation.getArgument(0);
            return new GetObjectResponse(Headers.of(), args.bucket(), null, args.object(),
                new ByteArrayInputStream(bucket.get(args.object())));
        });
        byte[] content = {(byte) 0xFF, (byte) 0xD8, 5, 4, 3, 2, 1, (byte) 0xFF, (byte) 0xD9};

        persister.store("round.jpg", content, Map.of()).block();

        StepVerifier.create(persister.retrieve("round.jpg"))
            .assertNext(bytes -> assertArrayEquals(content, bytes))
            .verifyComplete();
    }

    @Test
    void testRetrieveMissingObjectIsNotFound() throws Exception {
        ErrorResponse errorResponse = new ErrorResponse("NoSuchKey", "missing", "images", "gone.jpg",
            "/images/gone.jpg", "req-1", "host-1");
        when(minioClient.getObject(any(GetObjectArgs.class)))
            .thenThrow(new ErrorResponseException(errorResponse, null, null));

        StepVerifier.create(persister.retrieve("gone.jpg"))
            .expectError(NotFoundException.class)
            .verify();
    }

    @Test
    void testEnsureNamespaceCreatesBucketOnce() throws Exception {
        when(minioClient.bucketExists(any(BucketExistsArgs.class))).thenReturn(false);

        persister.ensureNamespace().block();
        persister.ensureNamespace().block();

        verify(minioClient, times(1)).bucketExists(any(BucketExistsArgs.class));
        verify(minioClient).makeBucket(any(MakeBucketArgs.class));
        verify(minioClient).setBucketPolicy(any(SetBucketPolicyArgs.class));
    }

    @Test
    void testEnsureNamespaceKeepsExistingBucket() throws Exception {
        when(minioClient.bucketExists(any(BucketExistsArgs.class))).thenReturn(true);

        persister.ensureNamespace().block();

        verify(minioClient, never()).makeBucket(any(MakeBucketArgs.class));
    }
}
