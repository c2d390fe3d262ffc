package com.example.filegate.storage;

import com.example.filegate.config.properties.FileGateProperties.StorageProperties;
import com.example.filegate.metadata.repository.FileMetadataRepository;
import com.example.filegate.storage.model.FileRecord;
import reactor.core.publisher.Mono;

/**
 * Shared configuration handling for storage drivers: identity flags, processing folder
 * and merging of the metadata index into resolved files.
 */
public abstract class AbstractResourceStorage implements ResourceStorage {

    protected final StorageProperties properties;
    private final FileMetadataRepository metadataRepository;
    private final String processingFolderIdentifier;

    protected AbstractResourceStorage(StorageProperties properties, FileMetadataRepository metadataRepository) {
        this.properties = properties;
        this.metadataRepository = metadataRepository;
        this.processingFolderIdentifier = "/" + trimSlashes(properties.processingFolder()) + "/";
    }

    @Override
    public int getUid() {
        return properties.uid();
    }

    @Override
    public String getName() {
        return properties.name();
    }

    @Override
    public StorageDriver getDriver() {
        return properties.driver();
    }

    @Override
    public boolean isDefault() {
        return properties.isDefault();
    }

    @Override
    public boolean isOnline() {
        return properties.online();
    }

    @Override
    public boolean isWithinProcessingFolder(String identifier) {
        return identifier != null && identifier.startsWith(processingFolderIdentifier);
    }

    protected Mono<FileRecord> withMetadata(FileRecord file) {
        return metadataRepository.findByStorageUidAndIdentifier(getUid(), file.identifier())
                .map(file::withMetadata)
                .defaultIfEmpty(file);
    }

    protected static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[uid=" + getUid() + ", name=" + getName() + "]";
    }
}
