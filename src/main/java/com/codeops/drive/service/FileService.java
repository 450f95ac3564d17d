package com.codeops.drive.service;

import com.codeops.drive.blob.BlobStoreClient;
import com.codeops.drive.blob.BlobStoreException;
import com.codeops.drive.blob.SignedDownload;
import com.codeops.drive.config.AppConstants;
import com.codeops.drive.config.StorageProperties;
import com.codeops.drive.dto.mapper.StoredFileMapper;
import com.codeops.drive.dto.response.DownloadResponse;
import com.codeops.drive.dto.response.FileResponse;
import com.codeops.drive.dto.response.StorageStatsResponse;
import com.codeops.drive.entity.ShareTarget;
import com.codeops.drive.entity.StoredFile;
import com.codeops.drive.exception.AuthorizationException;
import com.codeops.drive.exception.DriveException;
import com.codeops.drive.exception.NotFoundException;
import com.codeops.drive.exception.PayloadTooLargeException;
import com.codeops.drive.exception.ValidationException;
import com.codeops.drive.repository.FolderRepository;
import com.codeops.drive.repository.ShareRepository;
import com.codeops.drive.repository.StoredFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Service for file metadata and the blob content behind it: listing, upload, rename,
 * move, delete, download resolution, and per-owner usage statistics.
 *
 * <p>Uploads write the blob before the metadata row, so a backend failure leaves no
 * metadata behind. Rename and move touch metadata only; the blob key never changes.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class FileService {

    private static final String[] SIZE_UNITS = {"Bytes", "KB", "MB", "GB"};
    private static final String DEFAULT_FILE_NAME = "unnamed";

    private final StoredFileRepository fileRepository;
    private final FolderRepository folderRepository;
    private final ShareRepository shareRepository;
    private final ShareService shareService;
    private final BlobStoreClient blobStoreClient;
    private final StoredFileMapper fileMapper;
    private final StorageProperties storageProperties;

    /**
     * Lists the files directly inside a folder, or at the owner's root, ordered by name.
     *
     * @param ownerId  the acting user
     * @param folderId the folder, or null for the root level
     * @return the files at that level
     * @throws NotFoundException if the folder does not exist or belongs to someone else
     */
    @Transactional(readOnly = true)
    public List<FileResponse> listFiles(UUID ownerId, UUID folderId) {
        List<StoredFile> files;
        if (folderId == null) {
            files = fileRepository.findByOwnerIdAndFolderIdIsNullOrderByNameAsc(ownerId);
        } else {
            requireOwnedFolder(folderId, ownerId);
            files = fileRepository.findByOwnerIdAndFolderIdOrderByNameAsc(ownerId, folderId);
        }
        return files.stream().map(fileMapper::toResponse).toList();
    }

    /**
     * Uploads a file into one of the owner's folders or the root. The content is written
     * to the blob store first; if recording the metadata then fails, the blob key is
     * logged as orphaned and the error propagates.
     *
     * @param ownerId  the acting user
     * @param folderId the destination folder, or null for the root
     * @param upload   the uploaded content with its declared name and mime type
     * @return the stored file
     * @throws ValidationException      if no content was sent or the name is too long
     * @throws PayloadTooLargeException if the content exceeds the configured maximum size
     * @throws NotFoundException        if the folder does not exist or belongs to someone else
     * @throws BlobStoreException       if the blob backend fails the write
     */
    public FileResponse uploadFile(UUID ownerId, UUID folderId, MultipartFile upload) {
        if (upload == null || upload.isEmpty()) {
            throw new ValidationException("File is required");
        }
        if (upload.getSize() > storageProperties.getMaxFileSize()) {
            throw new PayloadTooLargeException("File size exceeds the maximum of "
                    + formatFileSize(storageProperties.getMaxFileSize()));
        }
        if (folderId != null) {
            requireOwnedFolder(folderId, ownerId);
        }

        String name = resolveUploadName(upload.getOriginalFilename());
        String mimeType = StringUtils.hasText(upload.getContentType())
                ? upload.getContentType()
                : AppConstants.DEFAULT_MIME_TYPE;

        String blobKey;
        try (InputStream content = upload.getInputStream()) {
            blobKey = blobStoreClient.put(content, upload.getSize(), mimeType);
        } catch (IOException e) {
            throw new DriveException("Failed to read uploaded content", e);
        }

        StoredFile file = StoredFile.builder()
                .name(name)
                .folderId(folderId)
                .ownerId(ownerId)
                .blobKey(blobKey)
                .blobSize(upload.getSize())
                .mimeType(mimeType)
                .fileType(extensionOf(name))
                .build();
        StoredFile saved;
        try {
            saved = fileRepository.saveAndFlush(file);
        } catch (RuntimeException e) {
            log.error("Orphaned blob {}: metadata for upload '{}' by {} could not be saved", blobKey, name, ownerId);
            throw e;
        }

        log.info("Uploaded file {} '{}' ({} bytes) for owner {}", saved.getId(), name, saved.getBlobSize(), ownerId);
        return fileMapper.toResponse(saved);
    }

    /**
     * Renames a file. Only metadata changes.
     *
     * @param fileId  the file ID
     * @param ownerId the acting user
     * @param newName the new name
     * @return the renamed file
     * @throws ValidationException if the name is blank or too long
     * @throws NotFoundException   if the file does not exist or belongs to someone else
     */
    public FileResponse renameFile(UUID fileId, UUID ownerId, String newName) {
        String name = validateFileName(newName);
        StoredFile file = findOwnedFile(fileId, ownerId);
        file.setName(name);
        file.setFileType(extensionOf(name));
        StoredFile saved = fileRepository.save(file);
        log.info("Renamed file {} to '{}'", fileId, name);
        return fileMapper.toResponse(saved);
    }

    /**
     * Moves a file to another of the owner's folders, or to the root.
     *
     * @param fileId   the file ID
     * @param ownerId  the acting user
     * @param folderId the destination folder, or null for the root
     * @return the moved file
     * @throws NotFoundException if the file or destination does not exist or belongs to someone else
     */
    public FileResponse moveFile(UUID fileId, UUID ownerId, UUID folderId) {
        StoredFile file = findOwnedFile(fileId, ownerId);
        if (folderId != null) {
            requireOwnedFolder(folderId, ownerId);
        }
        file.setFolderId(folderId);
        StoredFile saved = fileRepository.save(file);
        log.info("Moved file {} to folder {}", fileId, folderId != null ? folderId : "root");
        return fileMapper.toResponse(saved);
    }

    /**
     * Deletes a file, its shares and its blob. A blob backend failure is logged and
     * does not prevent the metadata delete.
     *
     * @param fileId  the file ID
     * @param ownerId the acting user
     * @throws NotFoundException if the file does not exist or belongs to someone else
     */
    public void deleteFile(UUID fileId, UUID ownerId) {
        StoredFile file = findOwnedFile(fileId, ownerId);
        try {
            blobStoreClient.delete(file.getBlobKey());
        } catch (BlobStoreException e) {
            log.warn("Failed to delete blob for file {}: {}", fileId, e.getMessage());
        }
        shareRepository.deleteByFileIdIn(List.of(fileId));
        fileRepository.delete(file);
        log.info("Deleted file {} '{}'", fileId, file.getName());
    }

    /**
     * Resolves a signed download for a file. The owner and users holding a share on the
     * file may download it; folder shares do not extend to the files inside.
     *
     * @param fileId      the file ID
     * @param requesterId the acting user
     * @return the signed URL, file name and URL expiry
     * @throws NotFoundException      if the file does not exist
     * @throws AuthorizationException if the caller neither owns the file nor holds a share on it
     * @throws BlobStoreException     if the URL cannot be signed
     */
    @Transactional(readOnly = true)
    public DownloadResponse getDownloadTarget(UUID fileId, UUID requesterId) {
        StoredFile file = fileRepository.findById(fileId)
                .orElseThrow(() -> new NotFoundException("File not found: " + fileId));
        if (!shareService.canAccess(ShareTarget.file(fileId), requesterId)) {
            throw new AuthorizationException("You do not have access to this file");
        }
        SignedDownload signed = blobStoreClient.signDownload(file.getBlobKey());
        log.debug("Issued download URL for file {} to user {}", fileId, requesterId);
        return new DownloadResponse(signed.url(), file.getName(), signed.expiresAt());
    }

    /**
     * Summarizes the owner's storage usage.
     *
     * @param ownerId the acting user
     * @return total bytes, a human-readable total, and file and folder counts
     */
    @Transactional(readOnly = true)
    public StorageStatsResponse getStorageStats(UUID ownerId) {
        long totalSize = fileRepository.sumBlobSizeByOwnerId(ownerId);
        return new StorageStatsResponse(
                totalSize,
                formatFileSize(totalSize),
                fileRepository.countByOwnerId(ownerId),
                folderRepository.countByOwnerId(ownerId));
    }

    /**
     * Formats a byte count with a binary unit and at most two decimals, for example
     * {@code "0 Bytes"}, {@code "500 Bytes"} or {@code "1.5 KB"}.
     *
     * @param bytes the byte count
     * @return the formatted size
     */
    public static String formatFileSize(long bytes) {
        if (bytes <= 0) {
            return "0 Bytes";
        }
        int unit = (int) Math.min(Math.floor(Math.log(bytes) / Math.log(1024)), SIZE_UNITS.length - 1);
        BigDecimal value = BigDecimal.valueOf(bytes)
                .divide(BigDecimal.valueOf(1024).pow(unit), 2, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        return value.toPlainString() + " " + SIZE_UNITS[unit];
    }

    private StoredFile findOwnedFile(UUID fileId, UUID ownerId) {
        return fileRepository.findByIdAndOwnerId(fileId, ownerId)
                .orElseThrow(() -> new NotFoundException("File not found: " + fileId));
    }

    private void requireOwnedFolder(UUID folderId, UUID ownerId) {
        folderRepository.findByIdAndOwnerId(folderId, ownerId)
                .orElseThrow(() -> new NotFoundException("Folder not found: " + folderId));
    }

    private static String resolveUploadName(String originalFilename) {
        String name = StringUtils.getFilename(StringUtils.cleanPath(
                originalFilename != null ? originalFilename : ""));
        if (!StringUtils.hasText(name)) {
            return DEFAULT_FILE_NAME;
        }
        return validateFileName(name);
    }

    static String validateFileName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("File name is required");
        }
        if (trimmed.length() > AppConstants.MAX_NAME_LENGTH) {
            throw new ValidationException("File name must be at most " + AppConstants.MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    static String extensionOf(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return null;
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
