package com.codeops.drive.dto.response;

public record StorageStatsResponse(
        long totalSize,
        String totalSizeFormatted,
        long fileCount,
        long folderCount
) {}
