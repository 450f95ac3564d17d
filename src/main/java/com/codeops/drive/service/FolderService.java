package com.codeops.drive.service;

import com.codeops.drive.blob.BlobStoreClient;
import com.codeops.drive.blob.BlobStoreException;
import com.codeops.drive.config.AppConstants;
import com.codeops.drive.dto.mapper.FolderMapper;
import com.codeops.drive.dto.request.CreateFolderRequest;
import com.codeops.drive.dto.response.BreadcrumbItemResponse;
import com.codeops.drive.dto.response.FolderDetailResponse;
import com.codeops.drive.dto.response.FolderResponse;
import com.codeops.drive.entity.Folder;
import com.codeops.drive.entity.StoredFile;
import com.codeops.drive.exception.ConflictException;
import com.codeops.drive.exception.NotFoundException;
import com.codeops.drive.exception.ValidationException;
import com.codeops.drive.repository.FolderRepository;
import com.codeops.drive.repository.ShareRepository;
import com.codeops.drive.repository.StoredFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Service for the per-user folder tree: creation, listing, breadcrumbs, and the
 * cascading rename and delete operations that keep materialized paths consistent.
 *
 * <p>Every folder's {@code path} equals the names of its ancestors joined with "/".
 * Rename rewrites the folder and every descendant in the same transaction, with the
 * subtree rows locked so overlapping renames serialize.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class FolderService {

    private static final String PATH_SEPARATOR = "/";

    private final FolderRepository folderRepository;
    private final StoredFileRepository fileRepository;
    private final ShareRepository shareRepository;
    private final BlobStoreClient blobStoreClient;
    private final FolderMapper folderMapper;

    /**
     * Creates a folder at the owner's root or under one of the owner's folders.
     *
     * @param ownerId the acting user
     * @param request the folder name and optional parent
     * @return the created folder
     * @throws ValidationException if the name is not a valid folder name
     * @throws NotFoundException   if the parent does not exist or belongs to someone else
     * @throws ConflictException   if a sibling already has this name
     */
    public FolderResponse createFolder(UUID ownerId, CreateFolderRequest request) {
        String name = validateFolderName(request.name());

        String parentPath = "";
        if (request.parentId() != null) {
            Folder parent = findOwnedFolder(request.parentId(), ownerId);
            parentPath = parent.getPath();
        }
        if (siblingNameTaken(ownerId, request.parentId(), name, null)) {
            throw new ConflictException("A folder named '" + name + "' already exists here");
        }

        Folder folder = Folder.builder()
                .name(name)
                .parentId(request.parentId())
                .ownerId(ownerId)
                .path(parentPath + PATH_SEPARATOR + name)
                .build();
        Folder saved = folderRepository.save(folder);
        log.info("Created folder {} at {} for owner {}", saved.getId(), saved.getPath(), ownerId);
        return folderMapper.toResponse(saved);
    }

    /**
     * Lists the folders directly under a parent, ordered by name.
     *
     * @param ownerId  the acting user
     * @param parentId the parent folder, or null for the root level
     * @return the folders at that level
     * @throws NotFoundException if the parent does not exist or belongs to someone else
     */
    @Transactional(readOnly = true)
    public List<FolderResponse> listFolders(UUID ownerId, UUID parentId) {
        List<Folder> folders;
        if (parentId == null) {
            folders = folderRepository.findByOwnerIdAndParentIdIsNullOrderByNameAsc(ownerId);
        } else {
            findOwnedFolder(parentId, ownerId);
            folders = folderRepository.findByOwnerIdAndParentIdOrderByNameAsc(ownerId, parentId);
        }
        return folders.stream().map(folderMapper::toResponse).toList();
    }

    /**
     * Lists every folder of the owner as a flat list ordered by path, for move pickers.
     *
     * @param ownerId the acting user
     * @return all folders of the owner
     */
    @Transactional(readOnly = true)
    public List<FolderResponse> listAllFolders(UUID ownerId) {
        return folderRepository.findByOwnerIdOrderByPathAsc(ownerId).stream()
                .map(folderMapper::toResponse)
                .toList();
    }

    /**
     * Gets a folder together with its ancestor chain, ordered from the root down to
     * the folder itself.
     *
     * @param folderId the folder ID
     * @param ownerId  the acting user
     * @return the folder and its breadcrumb
     * @throws NotFoundException if the folder does not exist or belongs to someone else
     */
    @Transactional(readOnly = true)
    public FolderDetailResponse getFolderWithBreadcrumb(UUID folderId, UUID ownerId) {
        Folder folder = findOwnedFolder(folderId, ownerId);

        List<BreadcrumbItemResponse> breadcrumb = new ArrayList<>();
        Set<UUID> visited = new HashSet<>();
        Folder current = folder;
        while (current != null && visited.add(current.getId())) {
            breadcrumb.add(folderMapper.toBreadcrumbItem(current));
            current = current.getParentId() == null
                    ? null
                    : folderRepository.findByIdAndOwnerId(current.getParentId(), ownerId).orElse(null);
        }
        Collections.reverse(breadcrumb);

        return new FolderDetailResponse(folderMapper.toResponse(folder), breadcrumb);
    }

    /**
     * Renames a folder and rewrites the path of every descendant. The folder and its
     * subtree are locked for the duration of the transaction; any failure rolls back
     * the whole rename. Renaming to the current name returns the folder unchanged.
     *
     * @param folderId the folder ID
     * @param ownerId  the acting user
     * @param newName  the new name
     * @return the renamed folder
     * @throws ValidationException if the name is not a valid folder name
     * @throws NotFoundException   if the folder does not exist or belongs to someone else
     * @throws ConflictException   if a sibling already has the new name
     */
    public FolderResponse renameFolder(UUID folderId, UUID ownerId, String newName) {
        String name = validateFolderName(newName);
        Folder folder = folderRepository.findWithLockByIdAndOwnerId(folderId, ownerId)
                .orElseThrow(() -> new NotFoundException("Folder not found: " + folderId));

        if (folder.getName().equals(name)) {
            return folderMapper.toResponse(folder);
        }
        if (siblingNameTaken(ownerId, folder.getParentId(), name, folder.getId())) {
            throw new ConflictException("A folder named '" + name + "' already exists here");
        }

        String oldPath = folder.getPath();
        String newPath = oldPath.substring(0, oldPath.lastIndexOf(PATH_SEPARATOR)) + PATH_SEPARATOR + name;

        folder.setName(name);
        folder.setPath(newPath);

        List<Folder> descendants = folderRepository.findByOwnerIdAndPathStartingWith(ownerId, oldPath + PATH_SEPARATOR);
        for (Folder descendant : descendants) {
            descendant.setPath(newPath + descendant.getPath().substring(oldPath.length()));
        }

        folderRepository.save(folder);
        folderRepository.saveAll(descendants);
        folderRepository.flush();

        log.info("Renamed folder {} from {} to {} ({} descendants rewritten)",
                folderId, oldPath, newPath, descendants.size());
        return folderMapper.toResponse(folder);
    }

    /**
     * Deletes a folder with all descendant folders, the files they contain, and every
     * share on any of them. A blob deletion is requested once per file; backend failures
     * are logged and do not stop the metadata delete, so orphaned blobs may remain.
     *
     * @param folderId the folder ID
     * @param ownerId  the acting user
     * @throws NotFoundException if the folder does not exist or belongs to someone else
     */
    public void deleteFolder(UUID folderId, UUID ownerId) {
        Folder folder = folderRepository.findWithLockByIdAndOwnerId(folderId, ownerId)
                .orElseThrow(() -> new NotFoundException("Folder not found: " + folderId));

        List<Folder> folders = new ArrayList<>();
        folders.add(folder);
        folders.addAll(folderRepository.findByOwnerIdAndPathStartingWith(ownerId, folder.getPath() + PATH_SEPARATOR));
        List<UUID> folderIds = folders.stream().map(Folder::getId).toList();

        List<StoredFile> files = fileRepository.findByFolderIdIn(folderIds);
        List<UUID> fileIds = files.stream().map(StoredFile::getId).toList();

        int blobFailures = 0;
        for (StoredFile file : files) {
            try {
                blobStoreClient.delete(file.getBlobKey());
            } catch (BlobStoreException e) {
                blobFailures++;
                log.warn("Failed to delete blob for file {} while deleting folder {}: {}",
                        file.getId(), folderId, e.getMessage());
            }
        }

        if (!fileIds.isEmpty()) {
            shareRepository.deleteByFileIdIn(fileIds);
        }
        shareRepository.deleteByFolderIdIn(folderIds);
        fileRepository.deleteAll(files);
        folderRepository.deleteAll(folders);

        log.info("Deleted folder {} ({}): {} folders, {} files, {} blob deletions failed",
                folderId, folder.getPath(), folders.size(), files.size(), blobFailures);
    }

    /**
     * Loads a folder owned by the given user.
     *
     * @param folderId the folder ID
     * @param ownerId  the expected owner
     * @return the folder
     * @throws NotFoundException if the folder does not exist or belongs to someone else
     */
    Folder findOwnedFolder(UUID folderId, UUID ownerId) {
        return folderRepository.findByIdAndOwnerId(folderId, ownerId)
                .orElseThrow(() -> new NotFoundException("Folder not found: " + folderId));
    }

    private boolean siblingNameTaken(UUID ownerId, UUID parentId, String name, UUID excludeId) {
        if (excludeId == null) {
            return parentId == null
                    ? folderRepository.existsByOwnerIdAndParentIdIsNullAndName(ownerId, name)
                    : folderRepository.existsByOwnerIdAndParentIdAndName(ownerId, parentId, name);
        }
        return parentId == null
                ? folderRepository.existsByOwnerIdAndParentIdIsNullAndNameAndIdNot(ownerId, name, excludeId)
                : folderRepository.existsByOwnerIdAndParentIdAndNameAndIdNot(ownerId, parentId, name, excludeId);
    }

    /**
     * Trims and validates a folder name. A "/" would corrupt the materialized path.
     *
     * @param name the requested name
     * @return the trimmed name
     * @throws ValidationException if the name is blank, too long, contains "/", or is "." or ".."
     */
    static String validateFolderName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("Folder name is required");
        }
        if (trimmed.length() > AppConstants.MAX_NAME_LENGTH) {
            throw new ValidationException("Folder name must be at most " + AppConstants.MAX_NAME_LENGTH + " characters");
        }
        if (trimmed.contains(PATH_SEPARATOR)) {
            throw new ValidationException("Folder name must not contain '/'");
        }
        if (trimmed.equals(".") || trimmed.equals("..")) {
            throw new ValidationException("Folder name must not be '.' or '..'");
        }
        return trimmed;
    }
}
