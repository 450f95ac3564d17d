package com.codeops.drive.dto.response;

import java.util.UUID;

public record UserSummaryResponse(
        UUID id,
        String name,
        String email
) {}
