package com.example.filegate.storage.local;

import com.example.filegate.config.properties.FileGateProperties.StorageProperties;
import com.example.filegate.metadata.repository.FileMetadataRepository;
import com.example.filegate.common.util.StringSanitizer;
import com.example.filegate.storage.AbstractResourceStorage;
import com.example.filegate.storage.exception.StorageAccessException;
import com.example.filegate.storage.model.FileRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Storage backed by a directory on the local file system.
 */
@Slf4j
public class LocalResourceStorage extends AbstractResourceStorage {

    private static final int READ_BUFFER_SIZE = 8192;

    private final Path basePath;

    public LocalResourceStorage(StorageProperties properties, FileMetadataRepository metadataRepository) {
        super(properties, metadataRepository);
        if (properties.basePath() == null || properties.basePath().isBlank()) {
            throw new IllegalStateException("Local storage " + properties.uid() + " has no base-path configured");
        }
        this.basePath = Paths.get(properties.basePath()).toAbsolutePath().normalize();
    }

    @Override
    public Mono<Boolean> hasFile(String identifier) {
        return Mono.fromCallable(() -> resolve(identifier)
                        .map(Files::isRegularFile)
                        .orElse(false))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<FileRecord> getFile(String identifier) {
        return Mono.fromCallable(() -> stat(identifier))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::justOrEmpty)
                .flatMap(this::withMetadata);
    }

    @Override
    public Flux<DataBuffer> readContent(FileRecord file, DataBufferFactory bufferFactory) {
        Path path = resolve(file.identifier())
                .orElseThrow(() -> new StorageAccessException(getUid(), file.identifier(),
                        "Identifier resolves outside of storage base path", null));
        return DataBufferUtils.read(path, bufferFactory, READ_BUFFER_SIZE)
                .onErrorMap(IOException.class, e -> new StorageAccessException(getUid(), file.identifier(),
                        "Failed to read file", e));
    }

    @Override
    public Mono<Boolean> isReachable() {
        return Mono.fromCallable(() -> Files.isDirectory(basePath) && Files.isReadable(basePath))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Optional<FileRecord> stat(String identifier) {
        Optional<Path> resolved = resolve(identifier).filter(Files::isRegularFile);
        if (resolved.isEmpty()) {
            return Optional.empty();
        }
        Path path = resolved.get();
        try {
            String mimeType = MediaTypeFactory.getMediaType(path.getFileName().toString())
                    .orElse(MediaType.APPLICATION_OCTET_STREAM)
                    .toString();
            return Optional.of(FileRecord.of(getUid(), identifier, mimeType, Files.size(path)));
        } catch (IOException e) {
            throw new StorageAccessException(getUid(), identifier, "Failed to stat file", e);
        }
    }

    // Empty when the identifier escapes the base path or is not a valid path on this platform
    private Optional<Path> resolve(String identifier) {
        if (identifier == null || !identifier.startsWith("/")) {
            return Optional.empty();
        }
        try {
            Path resolved = basePath.resolve(identifier.substring(1)).normalize();
            if (!resolved.startsWith(basePath)) {
                log.debug("Rejected identifier outside storage {}: {}", getUid(), StringSanitizer.forLog(identifier));
                return Optional.empty();
            }
            return Optional.of(resolved);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }
}
