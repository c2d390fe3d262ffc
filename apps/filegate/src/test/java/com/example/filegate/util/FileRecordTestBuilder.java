package com.example.filegate.util;

import com.example.filegate.storage.model.FileRecord;

/**
 * Test builder for FileRecord.
 * Defaults describe a public PDF in storage 1.
 */
public class FileRecordTestBuilder {

    private int storageUid = 1;
    private String identifier = "/user_upload/report.pdf";
    private String mimeType = "application/pdf";
    private long size = 11L;
    private Boolean visible;
    private String feGroups;

    public static FileRecordTestBuilder aFileRecord() {
        return new FileRecordTestBuilder();
    }

    public static FileRecord aPublicFile() {
        return aFileRecord().build();
    }

    public static FileRecord aHiddenFile() {
        return aFileRecord()
                .withVisible(false)
                .build();
    }

    public static FileRecord aRestrictedFile(String feGroups) {
        return aFileRecord()
                .withVisible(true)
                .withFeGroups(feGroups)
                .build();
    }

    public FileRecordTestBuilder withStorageUid(int storageUid) {
        this.storageUid = storageUid;
        return this;
    }

    public FileRecordTestBuilder withIdentifier(String identifier) {
        this.identifier = identifier;
        return this;
    }

    public FileRecordTestBuilder withMimeType(String mimeType) {
        this.mimeType = mimeType;
        return this;
    }

    public FileRecordTestBuilder withSize(long size) {
        this.size = size;
        return this;
    }

    public FileRecordTestBuilder withVisible(Boolean visible) {
        this.visible = visible;
        return this;
    }

    public FileRecordTestBuilder withFeGroups(String feGroups) {
        this.feGroups = feGroups;
        return this;
    }

    public FileRecord build() {
        String name = identifier.substring(identifier.lastIndexOf('/') + 1);
        return new FileRecord(storageUid, identifier, name, mimeType, size, visible, feGroups);
    }
}
