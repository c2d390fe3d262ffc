package com.example.filegate.storage.model;

import com.example.filegate.common.util.GroupListParser;
import com.example.filegate.metadata.document.FileMetadataDoc;
import org.springframework.lang.Nullable;

import java.util.Set;

/**
 * A file resolved from a storage, merged with its metadata.
 *
 * @param storageUid uid of the owning storage
 * @param identifier storage-relative identifier, starting with a slash
 * @param name       file name (last identifier segment)
 * @param mimeType   MIME type reported by the storage
 * @param size       size in bytes
 * @param visible    visibility flag, null when the property is absent
 * @param feGroups   raw comma-separated group list, null when absent
 */
public record FileRecord(
        int storageUid,
        String identifier,
        String name,
        String mimeType,
        long size,
        @Nullable Boolean visible,
        @Nullable String feGroups
) {
    public static FileRecord of(int storageUid, String identifier, String mimeType, long size) {
        return new FileRecord(storageUid, identifier, nameOf(identifier), mimeType, size, null, null);
    }

    public FileRecord withMetadata(@Nullable FileMetadataDoc metadata) {
        if (metadata == null) {
            return this;
        }
        return new FileRecord(storageUid, identifier, name, mimeType, size,
                metadata.getVisible(), metadata.getFeGroups());
    }

    public boolean isVisible() {
        return visible == null || visible;
    }

    public boolean hasAccessGroups() {
        return !GroupListParser.isEmpty(feGroups);
    }

    /**
     * @throws com.example.filegate.common.exception.InvalidGroupListException if the list holds a non-numeric token
     */
    public Set<Integer> accessGroups() {
        return GroupListParser.parse(feGroups);
    }

    private static String nameOf(String identifier) {
        int lastSlash = identifier.lastIndexOf('/');
        return lastSlash >= 0 ? identifier.substring(lastSlash + 1) : identifier;
    }
}
