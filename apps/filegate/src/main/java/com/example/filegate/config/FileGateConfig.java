package com.example.filegate.config;

import com.example.filegate.config.properties.FileGateProperties;
import com.example.filegate.config.properties.FileGateProperties.StorageProperties;
import com.example.filegate.metadata.repository.FileMetadataRepository;
import com.example.filegate.security.filter.ProtectedPathMatcher;
import com.example.filegate.storage.ResourceStorage;
import com.example.filegate.storage.StorageRepository;
import com.example.filegate.storage.local.LocalResourceStorage;
import com.example.filegate.storage.s3.S3ResourceStorage;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3AsyncClient;

import java.util.List;

/**
 * Wires the gate's collaborators from {@link FileGateProperties}.
 */
@Configuration
public class FileGateConfig {

    @Bean
    public ProtectedPathMatcher protectedPathMatcher(FileGateProperties properties) {
        return new ProtectedPathMatcher(properties.protectedPrefix());
    }

    @Bean
    public StorageRepository storageRepository(
            FileGateProperties properties,
            FileMetadataRepository metadataRepository,
            ObjectProvider<S3AsyncClient> s3ClientProvider) {

        List<ResourceStorage> storages = properties.storages().stream()
                .map(storage -> createStorage(storage, metadataRepository, s3ClientProvider))
                .toList();
        return new StorageRepository(storages);
    }

    private ResourceStorage createStorage(
            StorageProperties storage,
            FileMetadataRepository metadataRepository,
            ObjectProvider<S3AsyncClient> s3ClientProvider) {

        return switch (storage.driver()) {
            case LOCAL -> new LocalResourceStorage(storage, metadataRepository);
            case S3 -> {
                S3AsyncClient s3Client = s3ClientProvider.getIfAvailable();
                if (s3Client == null) {
                    throw new IllegalStateException("Storage " + storage.uid()
                            + " uses the S3 driver but file-gate.s3.enabled is not set");
                }
                yield new S3ResourceStorage(storage, metadataRepository, s3Client);
            }
        };
    }
}
