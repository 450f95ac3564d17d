package com.codeops.drive.dto.request;

import java.util.UUID;

/**
 * @param folderId the destination folder, or null to move the file to the owner's root
 */
public record MoveFileRequest(
        UUID folderId
) {}
