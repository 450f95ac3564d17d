package com.codeops.drive.dto.response;

import java.util.UUID;

public record BreadcrumbItemResponse(
        UUID id,
        String name
) {}
