package com.codeops.drive.dto.response;

import java.util.List;

/**
 * A folder together with its ancestors, ordered from the root down to the folder itself.
 */
public record FolderDetailResponse(
        FolderResponse folder,
        List<BreadcrumbItemResponse> breadcrumb
) {}
