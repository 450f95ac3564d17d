package com.codeops.drive.entity;

import com.codeops.drive.entity.enums.ShareTargetType;
import com.codeops.drive.exception.ValidationException;

import java.util.UUID;

/**
 * The file or folder a share applies to. Exactly one of the two ids is set.
 *
 * @param fileId   the file id, or null for a folder target
 * @param folderId the folder id, or null for a file target
 * @throws ValidationException if both or neither id is given
 */
public record ShareTarget(UUID fileId, UUID folderId) {

    public ShareTarget {
        if (fileId == null && folderId == null) {
            throw new ValidationException("File ID or Folder ID is required");
        }
        if (fileId != null && folderId != null) {
            throw new ValidationException("Provide either File ID or Folder ID, not both");
        }
    }

    public static ShareTarget file(UUID fileId) {
        return new ShareTarget(fileId, null);
    }

    public static ShareTarget folder(UUID folderId) {
        return new ShareTarget(null, folderId);
    }

    public ShareTargetType type() {
        return fileId != null ? ShareTargetType.FILE : ShareTargetType.FOLDER;
    }

    public UUID id() {
        return fileId != null ? fileId : folderId;
    }
}
