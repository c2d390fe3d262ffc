package com.example.filegate.storage;

import com.example.filegate.storage.model.FileRecord;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A file storage backend. Identifiers are storage-relative and start with a slash.
 *
 * <p>Lookups signal {@link com.example.filegate.storage.exception.StorageAccessException}
 * when the backend itself fails; a missing file is never an error.</p>
 */
public interface ResourceStorage {

    int getUid();

    String getName();

    StorageDriver getDriver();

    boolean isDefault();

    boolean isOnline();

    Mono<Boolean> hasFile(String identifier);

    /**
     * Resolves the file and its metadata. Completes empty if the file does not exist.
     */
    Mono<FileRecord> getFile(String identifier);

    boolean isWithinProcessingFolder(String identifier);

    Flux<DataBuffer> readContent(FileRecord file, DataBufferFactory bufferFactory);

    /**
     * Probes the backend (base directory or bucket). Used by health reporting.
     */
    Mono<Boolean> isReachable();
}
