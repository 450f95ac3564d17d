package com.codeops.drive.dto.response;

import java.time.Instant;

/**
 * What an anonymous holder of a public link may see about the file.
 */
public record PublicFileInfoResponse(
        String name,
        long fileSize,
        String fileType,
        String mimeType,
        Instant expiresAt,
        String sharedBy,
        Instant createdAt
) {}
