package com.codeops.drive.controller;

import com.codeops.drive.config.AppConstants;
import com.codeops.drive.dto.request.CreatePublicLinkRequest;
import com.codeops.drive.dto.response.MessageResponse;
import com.codeops.drive.dto.response.PublicLinkResponse;
import com.codeops.drive.security.SecurityUtils;
import com.codeops.drive.service.PublicLinkService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST controller for issuing and revoking public links on the caller's files.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX + "/files/{fileId}/public")
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Public Links", description = "Issue and revoke anonymous download links")
public class PublicLinkController {

    private final PublicLinkService publicLinkService;

    /**
     * Issues a public link, replacing any existing one. The body is optional.
     *
     * @param fileId  the file ID
     * @param request the optional lifetime in hours
     * @return the token, URL and expiry
     */
    @PostMapping
    public PublicLinkResponse createPublicLink(@PathVariable UUID fileId,
                                               @Valid @RequestBody(required = false) CreatePublicLinkRequest request) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        Integer expiresIn = request != null ? request.expiresIn() : null;
        log.info("Creating public link for file {} (ttl {}h) for user {}", fileId, expiresIn, ownerId);
        return publicLinkService.issuePublicLink(fileId, ownerId, expiresIn);
    }

    /**
     * Revokes the public link of a file.
     *
     * @param fileId the file ID
     * @return a confirmation message
     */
    @DeleteMapping
    public MessageResponse revokePublicLink(@PathVariable UUID fileId) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        log.info("Revoking public link for file {} for user {}", fileId, ownerId);
        publicLinkService.revokePublicLink(fileId, ownerId);
        return MessageResponse.ok("Public link removed successfully");
    }
}
