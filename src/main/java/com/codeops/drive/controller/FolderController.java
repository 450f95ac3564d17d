package com.codeops.drive.controller;

import com.codeops.drive.config.AppConstants;
import com.codeops.drive.dto.request.CreateFolderRequest;
import com.codeops.drive.dto.request.RenameFolderRequest;
import com.codeops.drive.dto.response.FolderDetailResponse;
import com.codeops.drive.dto.response.FolderResponse;
import com.codeops.drive.dto.response.MessageResponse;
import com.codeops.drive.security.SecurityUtils;
import com.codeops.drive.service.FolderService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for the caller's folder tree. Provides level and flat listings,
 * breadcrumbs, creation, and cascading rename and delete.
 * All endpoints require authentication and act on the caller's own folders.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX + "/folders")
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Folders", description = "Folder tree listing, creation, rename and delete")
public class FolderController {

    private final FolderService folderService;

    /**
     * Lists the folders at one level of the tree.
     *
     * @param parentId the parent folder ID; absent or "null" for the root level
     * @return the folders at that level, ordered by name
     */
    @GetMapping
    public List<FolderResponse> listFolders(@RequestParam(required = false) String parentId) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        return folderService.listFolders(ownerId, RequestIds.optional(parentId, "parentId"));
    }

    /**
     * Lists all of the caller's folders, ordered by path.
     *
     * @return every folder of the caller
     */
    @GetMapping("/all")
    public List<FolderResponse> listAllFolders() {
        return folderService.listAllFolders(SecurityUtils.getCurrentUserId());
    }

    /**
     * Returns a folder with its breadcrumb from the root.
     *
     * @param folderId the folder ID
     * @return the folder and its ancestors
     */
    @GetMapping("/{folderId}")
    public FolderDetailResponse getFolder(@PathVariable UUID folderId) {
        return folderService.getFolderWithBreadcrumb(folderId, SecurityUtils.getCurrentUserId());
    }

    /**
     * Creates a folder.
     *
     * @param request the folder name and optional parent
     * @return the created folder
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public FolderResponse createFolder(@Valid @RequestBody CreateFolderRequest request) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        log.info("Creating folder '{}' under {} for user {}", request.name(), request.parentId(), ownerId);
        return folderService.createFolder(ownerId, request);
    }

    /**
     * Renames a folder, rewriting the paths of everything below it.
     *
     * @param folderId the folder ID
     * @param request  the new name
     * @return the renamed folder
     */
    @PatchMapping("/{folderId}")
    public FolderResponse renameFolder(@PathVariable UUID folderId,
                                       @Valid @RequestBody RenameFolderRequest request) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        log.info("Renaming folder {} to '{}' for user {}", folderId, request.name(), ownerId);
        return folderService.renameFolder(folderId, ownerId, request.name());
    }

    /**
     * Deletes a folder with all subfolders, files and shares below it.
     *
     * @param folderId the folder ID
     * @return a confirmation message
     */
    @DeleteMapping("/{folderId}")
    public MessageResponse deleteFolder(@PathVariable UUID folderId) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        log.info("Deleting folder {} for user {}", folderId, ownerId);
        folderService.deleteFolder(folderId, ownerId);
        return MessageResponse.ok("Folder deleted successfully");
    }
}
