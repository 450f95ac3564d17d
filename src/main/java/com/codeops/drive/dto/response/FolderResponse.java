package com.codeops.drive.dto.response;

import java.time.Instant;
import java.util.UUID;

public record FolderResponse(
        UUID id,
        String name,
        UUID parentId,
        String path,
        Instant createdAt,
        Instant updatedAt
) {}
