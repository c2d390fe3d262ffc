package com.example.filegate.storage.exception;

import lombok.Getter;

/**
 * Raised when a storage backend cannot answer a lookup or read (I/O failure, S3 error).
 */
@Getter
public class StorageAccessException extends RuntimeException {

    private final int storageUid;
    private final String identifier;

    public StorageAccessException(int storageUid, String identifier, String message, Throwable cause) {
        super(message, cause);
        this.storageUid = storageUid;
        this.identifier = identifier;
    }
}
