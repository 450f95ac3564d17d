package com.codeops.drive.dto.response;

import java.time.Instant;

public record DownloadResponse(
        String downloadUrl,
        String fileName,
        Instant expiresAt
) {}
