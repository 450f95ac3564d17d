package com.codeops.drive.dto.response;

import com.codeops.drive.entity.enums.SharePermission;
import com.codeops.drive.entity.enums.ShareTargetType;

import java.time.Instant;
import java.util.UUID;

public record ShareResponse(
        UUID id,
        ShareTargetType targetType,
        UUID fileId,
        UUID folderId,
        UserSummaryResponse sharedWith,
        UUID sharedByUserId,
        SharePermission permission,
        Instant createdAt
) {}
