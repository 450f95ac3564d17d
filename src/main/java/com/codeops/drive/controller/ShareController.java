package com.codeops.drive.controller;

import com.codeops.drive.config.AppConstants;
import com.codeops.drive.dto.request.GrantShareRequest;
import com.codeops.drive.dto.response.MessageResponse;
import com.codeops.drive.dto.response.ShareResponse;
import com.codeops.drive.dto.response.SharedItemResponse;
import com.codeops.drive.entity.ShareTarget;
import com.codeops.drive.security.SecurityUtils;
import com.codeops.drive.service.ShareService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for sharing files and folders with other users. Provides grant,
 * revoke, per-target listing, and the list of items shared with the caller.
 * All endpoints require authentication.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX)
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Shares", description = "File and folder sharing grants")
public class ShareController {

    private final ShareService shareService;

    /**
     * Shares a file or folder with another user. Returns 201 for a new share and 200 when
     * an existing share's permission was updated.
     *
     * @param request the target, grantee and permission
     * @return the share
     */
    @PostMapping("/share")
    public ResponseEntity<ShareResponse> grantShare(@Valid @RequestBody GrantShareRequest request) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        log.info("Sharing file {} / folder {} with user {} at {}",
                request.fileId(), request.folderId(), request.sharedWith(), request.permission());
        ShareService.GrantResult result = shareService.grantShare(ownerId, request);
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(result.share());
    }

    /**
     * Lists the shares on one of the caller's files or folders.
     *
     * @param fileId   the file ID, if the target is a file
     * @param folderId the folder ID, if the target is a folder
     * @return the shares on the target
     */
    @GetMapping("/shares")
    public List<ShareResponse> getShares(@RequestParam(required = false) UUID fileId,
                                         @RequestParam(required = false) UUID folderId) {
        return shareService.getSharesForTarget(new ShareTarget(fileId, folderId), SecurityUtils.getCurrentUserId());
    }

    /**
     * Revokes a share created by the caller.
     *
     * @param shareId the share ID
     * @return a confirmation message
     */
    @DeleteMapping("/share/{shareId}")
    public MessageResponse revokeShare(@PathVariable UUID shareId) {
        UUID userId = SecurityUtils.getCurrentUserId();
        log.info("Revoking share {} by user {}", shareId, userId);
        shareService.revokeShare(shareId, userId);
        return MessageResponse.ok("Share removed successfully");
    }

    /**
     * Lists the files and folders other users have shared with the caller.
     *
     * @return the shared items, newest first
     */
    @GetMapping("/shared-with-me")
    public List<SharedItemResponse> getSharedWithMe() {
        return shareService.getSharedWithMe(SecurityUtils.getCurrentUserId());
    }
}
