package com.codeops.drive.dto.response;

import com.codeops.drive.entity.enums.SharePermission;
import com.codeops.drive.entity.enums.ShareTargetType;

import java.time.Instant;
import java.util.UUID;

/**
 * An item another user has shared with the caller. {@code fileSize} and {@code mimeType}
 * are null for folder targets.
 */
public record SharedItemResponse(
        UUID shareId,
        ShareTargetType targetType,
        UUID targetId,
        String targetName,
        Long fileSize,
        String mimeType,
        SharePermission permission,
        UserSummaryResponse owner,
        UserSummaryResponse sharedBy,
        Instant sharedAt
) {}
