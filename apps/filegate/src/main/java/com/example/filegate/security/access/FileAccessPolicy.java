package com.example.filegate.security.access;

import com.example.filegate.security.context.FrontendUser;
import com.example.filegate.storage.ResourceStorage;
import com.example.filegate.storage.model.FileRecord;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Decides whether a visitor may read a file. First matching rule wins:
 * <ol>
 *   <li>files in the storage's processing folder are always readable (the web server is
 *       expected to serve that folder directly, so this rule should not be hit)</li>
 *   <li>hidden files are never readable</li>
 *   <li>files without access groups are public</li>
 *   <li>otherwise the visitor needs at least one of the file's access groups</li>
 * </ol>
 */
@Component
public class FileAccessPolicy {

    /**
     * @throws com.example.filegate.common.exception.InvalidGroupListException if the file's group list is malformed
     */
    public boolean isAccessible(ResourceStorage storage, FileRecord file, FrontendUser user) {
        if (storage.isWithinProcessingFolder(file.identifier())) {
            return true;
        }

        if (!file.isVisible()) {
            return false;
        }

        if (!file.hasAccessGroups()) {
            return true;
        }

        Set<Integer> accessGroups = file.accessGroups();
        return user.groupIds().stream().anyMatch(accessGroups::contains);
    }
}
