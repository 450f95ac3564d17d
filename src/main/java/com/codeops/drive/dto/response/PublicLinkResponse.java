package com.codeops.drive.dto.response;

import java.time.Instant;

public record PublicLinkResponse(
        String publicToken,
        String publicUrl,
        Instant expiresAt
) {}
