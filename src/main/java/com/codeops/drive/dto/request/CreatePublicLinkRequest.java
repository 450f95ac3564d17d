package com.codeops.drive.dto.request;

import com.codeops.drive.config.AppConstants;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

/**
 * @param expiresIn link lifetime in hours, or null for a link that never expires
 */
public record CreatePublicLinkRequest(
        @Positive @Max(AppConstants.MAX_PUBLIC_LINK_TTL_HOURS) Integer expiresIn
) {}
