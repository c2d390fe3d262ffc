package com.example.filegate.metadata.repository;

import com.example.filegate.metadata.document.FileMetadataDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface FileMetadataRepository extends ReactiveMongoRepository<FileMetadataDoc, String> {

    Mono<FileMetadataDoc> findByStorageUidAndIdentifier(int storageUid, String identifier);
}
