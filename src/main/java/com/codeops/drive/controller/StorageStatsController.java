package com.codeops.drive.controller;

import com.codeops.drive.config.AppConstants;
import com.codeops.drive.dto.response.StorageStatsResponse;
import com.codeops.drive.security.SecurityUtils;
import com.codeops.drive.service.FileService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Storage usage of the caller.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX + "/stats")
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Tag(name = "Stats", description = "Storage usage")
public class StorageStatsController {

    private final FileService fileService;

    @GetMapping
    public StorageStatsResponse getStats() {
        return fileService.getStorageStats(SecurityUtils.getCurrentUserId());
    }
}
