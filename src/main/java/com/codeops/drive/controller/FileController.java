package com.codeops.drive.controller;

import com.codeops.drive.config.AppConstants;
import com.codeops.drive.dto.request.MoveFileRequest;
import com.codeops.drive.dto.request.RenameFileRequest;
import com.codeops.drive.dto.response.DownloadResponse;
import com.codeops.drive.dto.response.FileResponse;
import com.codeops.drive.dto.response.MessageResponse;
import com.codeops.drive.security.SecurityUtils;
import com.codeops.drive.service.FileService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for files: listing, upload, rename, move, delete and signed download.
 * All endpoints require authentication. Download is also available to users holding a
 * share on the file.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX + "/files")
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Files", description = "File upload, listing, rename, move, delete and download")
public class FileController {

    private final FileService fileService;

    /**
     * Lists the files at one level of the tree.
     *
     * @param folderId the folder ID; absent or "null" for the root level
     * @return the files at that level, ordered by name
     */
    @GetMapping
    public List<FileResponse> listFiles(@RequestParam(required = false) String folderId) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        return fileService.listFiles(ownerId, RequestIds.optional(folderId, "folderId"));
    }

    /**
     * Uploads a file.
     *
     * @param file     the multipart content
     * @param folderId the destination folder; absent or "null" for the root
     * @return the stored file
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public FileResponse uploadFile(@RequestParam("file") MultipartFile file,
                                   @RequestParam(required = false) String folderId) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        log.info("Uploading '{}' ({} bytes) for user {}", file.getOriginalFilename(), file.getSize(), ownerId);
        return fileService.uploadFile(ownerId, RequestIds.optional(folderId, "folderId"), file);
    }

    /**
     * Renames a file.
     *
     * @param fileId  the file ID
     * @param request the new name
     * @return the renamed file
     */
    @PatchMapping("/{fileId}")
    public FileResponse renameFile(@PathVariable UUID fileId,
                                   @Valid @RequestBody RenameFileRequest request) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        log.info("Renaming file {} to '{}' for user {}", fileId, request.name(), ownerId);
        return fileService.renameFile(fileId, ownerId, request.name());
    }

    /**
     * Moves a file to another folder or to the root.
     *
     * @param fileId  the file ID
     * @param request the destination folder, null for the root
     * @return the moved file
     */
    @PatchMapping("/{fileId}/move")
    public FileResponse moveFile(@PathVariable UUID fileId,
                                 @RequestBody MoveFileRequest request) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        log.info("Moving file {} to folder {} for user {}", fileId, request.folderId(), ownerId);
        return fileService.moveFile(fileId, ownerId, request.folderId());
    }

    /**
     * Deletes a file.
     *
     * @param fileId the file ID
     * @return a confirmation message
     */
    @DeleteMapping("/{fileId}")
    public MessageResponse deleteFile(@PathVariable UUID fileId) {
        UUID ownerId = SecurityUtils.getCurrentUserId();
        log.info("Deleting file {} for user {}", fileId, ownerId);
        fileService.deleteFile(fileId, ownerId);
        return MessageResponse.ok("File deleted successfully");
    }

    /**
     * Returns a short-lived download URL for a file the caller owns or has been shared.
     *
     * @param fileId the file ID
     * @return the signed URL, file name and expiry
     */
    @GetMapping("/{fileId}/download")
    public DownloadResponse downloadFile(@PathVariable UUID fileId) {
        return fileService.getDownloadTarget(fileId, SecurityUtils.getCurrentUserId());
    }
}
