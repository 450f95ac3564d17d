package com.codeops.drive.dto.response;

import java.time.Instant;
import java.util.UUID;

public record FileResponse(
        UUID id,
        String name,
        UUID folderId,
        long fileSize,
        String mimeType,
        String fileType,
        Boolean isPublic,
        String publicToken,
        Instant publicExpiresAt,
        Instant createdAt,
        Instant updatedAt
) {}
