package com.example.filegate.metadata.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document holding editorial metadata of a stored file.
 * File bytes live in the storage; this carries the access-control properties.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "file_metadata")
@CompoundIndex(name = "storage_identifier_idx", def = "{'storageUid': 1, 'identifier': 1}", unique = true)
public class FileMetadataDoc {

    @Id
    private String id;

    /**
     * Uid of the storage holding the file.
     */
    private int storageUid;

    /**
     * Storage-relative identifier, always starting with a slash (e.g. /user_upload/report.pdf).
     */
    private String identifier;

    /**
     * Visibility flag. Null means the property was never set, which counts as visible.
     */
    private Boolean visible;

    /**
     * Comma-separated frontend group ids allowed to view the file. Null or empty means public; a list of only separators grants nobody.
     */
    private String feGroups;

    private String title;

    private String description;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
