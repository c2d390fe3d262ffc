package com.example.filegate.config.properties;

import com.example.filegate.storage.StorageDriver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "file-gate")
public record FileGateProperties(
        @NotBlank String protectedPrefix,
        @Valid List<StorageProperties> storages,
        S3ClientProperties s3,
        @Valid List<FrontendUserProperties> frontendUsers
) {
    public static final String DEFAULT_PROTECTED_PREFIX = "fileadmin/";

    public record StorageProperties(
            @Positive int uid,
            String name,
            StorageDriver driver,
            boolean isDefault,
            Boolean online,
            String basePath,
            String bucket,
            String keyPrefix,
            String processingFolder
    ) {
        public static final String DEFAULT_PROCESSING_FOLDER = "_processed_";

        public StorageProperties {
            if (name == null || name.isBlank()) {
                name = "storage-" + uid;
            }
            if (driver == null) {
                driver = StorageDriver.LOCAL;
            }
            if (online == null) {
                online = Boolean.TRUE;
            }
            if (keyPrefix == null) {
                keyPrefix = "";
            }
            if (processingFolder == null || processingFolder.isBlank()) {
                processingFolder = DEFAULT_PROCESSING_FOLDER;
            }
        }
    }

    public record S3ClientProperties(
            boolean enabled,
            String region,
            String endpoint,
            String accessKeyId,
            String secretAccessKey
    ) {
        public S3ClientProperties {
            if (region == null || region.isBlank()) {
                region = "us-east-1";
            }
        }
    }

    // Password must carry an encoder id, e.g. {bcrypt}... or {noop}...
    public record FrontendUserProperties(
            @NotBlank String username,
            @NotBlank String password,
            List<Integer> groups
    ) {
        public FrontendUserProperties {
            if (groups == null) {
                groups = List.of();
            }
        }
    }

    public FileGateProperties {
        if (protectedPrefix == null || protectedPrefix.isBlank()) {
            protectedPrefix = DEFAULT_PROTECTED_PREFIX;
        }
        if (storages == null) {
            storages = List.of();
        }
        if (s3 == null) {
            s3 = new S3ClientProperties(false, "us-east-1", null, null, null);
        }
        if (frontendUsers == null) {
            frontendUsers = List.of();
        }
    }
}
