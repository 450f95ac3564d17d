package com.codeops.drive.dto.request;

import com.codeops.drive.entity.enums.SharePermission;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Share request targeting exactly one of {@code fileId} or {@code folderId}.
 * A missing permission defaults to {@link SharePermission#VIEW}.
 */
public record GrantShareRequest(
        UUID fileId,
        UUID folderId,
        @NotNull UUID sharedWith,
        SharePermission permission
) {}
