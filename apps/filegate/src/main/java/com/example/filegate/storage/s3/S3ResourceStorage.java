package com.example.filegate.storage.s3;

import com.example.filegate.common.util.StringSanitizer;
import com.example.filegate.config.properties.FileGateProperties.StorageProperties;
import com.example.filegate.metadata.repository.FileMetadataRepository;
import com.example.filegate.storage.AbstractResourceStorage;
import com.example.filegate.storage.exception.StorageAccessException;
import com.example.filegate.storage.model.FileRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.MediaType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Storage backed by an S3 bucket. Object key = key prefix + identifier without its leading slash.
 */
@Slf4j
public class S3ResourceStorage extends AbstractResourceStorage {

    private final S3AsyncClient s3Client;
    private final String bucket;
    private final String keyPrefix;

    public S3ResourceStorage(StorageProperties properties, FileMetadataRepository metadataRepository,
                             S3AsyncClient s3Client) {
        super(properties, metadataRepository);
        if (properties.bucket() == null || properties.bucket().isBlank()) {
            throw new IllegalStateException("S3 storage " + properties.uid() + " has no bucket configured");
        }
        this.s3Client = s3Client;
        this.bucket = properties.bucket();
        String prefix = trimSlashes(properties.keyPrefix());
        this.keyPrefix = prefix.isEmpty() ? "" : prefix + "/";
    }

    public String toObjectKey(String identifier) {
        return keyPrefix + identifier.substring(1);
    }

    @Override
    public Mono<Boolean> hasFile(String identifier) {
        if (!isValidIdentifier(identifier)) {
            return Mono.just(false);
        }
        return headObject(identifier)
                .map(response -> true)
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<FileRecord> getFile(String identifier) {
        if (!isValidIdentifier(identifier)) {
            return Mono.empty();
        }
        return headObject(identifier)
                .flatMap(response -> {
                    if (response.contentLength() == null) {
                        return Mono.error(new StorageAccessException(getUid(), identifier,
                                "Object in bucket " + bucket + " has no content length", null));
                    }
                    return Mono.just(FileRecord.of(
                            getUid(),
                            identifier,
                            response.contentType() != null
                                    ? response.contentType()
                                    : MediaType.APPLICATION_OCTET_STREAM_VALUE,
                            response.contentLength()));
                })
                .flatMap(this::withMetadata);
    }

    @Override
    public Flux<DataBuffer> readContent(FileRecord file, DataBufferFactory bufferFactory) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(toObjectKey(file.identifier()))
                .build();

        return Mono.fromFuture(() -> s3Client.getObject(request, AsyncResponseTransformer.toPublisher()))
                .flatMapMany(Flux::from)
                .map(bufferFactory::wrap)
                .onErrorMap(SdkException.class, e -> new StorageAccessException(getUid(), file.identifier(),
                        "Failed to read object from bucket " + bucket, e));
    }

    @Override
    public Mono<Boolean> isReachable() {
        return Mono.fromFuture(() -> s3Client.headBucket(HeadBucketRequest.builder()
                        .bucket(bucket)
                        .build()))
                .map(response -> true)
                .onErrorResume(e -> {
                    log.warn("S3 bucket {} of storage {} is not reachable: {}", bucket, getUid(), e.getMessage());
                    return Mono.just(false);
                });
    }

    // Completes empty when the object does not exist
    private Mono<HeadObjectResponse> headObject(String identifier) {
        String key = toObjectKey(identifier);
        return Mono.fromFuture(() -> s3Client.headObject(HeadObjectRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .build()))
                .onErrorResume(this::isNotFound, e -> {
                    log.debug("Object not found: bucket={}, key={}", bucket, StringSanitizer.forLog(key));
                    return Mono.empty();
                })
                .onErrorMap(e -> !(e instanceof StorageAccessException), e -> new StorageAccessException(
                        getUid(), identifier, "Failed to look up object in bucket " + bucket, e));
    }

    private boolean isNotFound(Throwable e) {
        return e instanceof NoSuchKeyException
                || (e instanceof S3Exception s3Exception && s3Exception.statusCode() == 404);
    }

    private boolean isValidIdentifier(String identifier) {
        return identifier != null && identifier.startsWith("/") && identifier.length() > 1
                && !identifier.endsWith("/");
    }
}
