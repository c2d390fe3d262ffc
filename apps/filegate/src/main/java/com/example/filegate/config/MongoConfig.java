package com.example.filegate.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableReactiveMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

@Configuration
@EnableReactiveMongoRepositories(basePackages = "com.example.filegate.metadata.repository")
@EnableReactiveMongoAuditing
public class MongoConfig {
    // Compound index on (storageUid, identifier) is declared on FileMetadataDoc
}
