package com.example.filegate.storage;

public enum StorageDriver {
    LOCAL,
    S3
}
