package com.codeops.drive.service;

import com.codeops.drive.dto.request.GrantShareRequest;
import com.codeops.drive.dto.response.ShareResponse;
import com.codeops.drive.dto.response.SharedItemResponse;
import com.codeops.drive.dto.response.UserSummaryResponse;
import com.codeops.drive.entity.Folder;
import com.codeops.drive.entity.Share;
import com.codeops.drive.entity.ShareTarget;
import com.codeops.drive.entity.StoredFile;
import com.codeops.drive.entity.enums.SharePermission;
import com.codeops.drive.entity.enums.ShareTargetType;
import com.codeops.drive.exception.AuthorizationException;
import com.codeops.drive.exception.NotFoundException;
import com.codeops.drive.exception.ValidationException;
import com.codeops.drive.repository.FolderRepository;
import com.codeops.drive.repository.ShareRepository;
import com.codeops.drive.repository.StoredFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for per-item sharing grants and access resolution.
 *
 * <p>A share targets exactly one file or one folder and grants VIEW or EDIT to a single
 * user other than the sharer. There is at most one share per target and grantee;
 * granting again updates the permission in place. Folder shares do not extend to the
 * files inside the folder.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class ShareService {

    private final ShareRepository shareRepository;
    private final StoredFileRepository fileRepository;
    private final FolderRepository folderRepository;
    private final UserDirectoryService userDirectoryService;

    /**
     * Outcome of a grant: the resulting share and whether it was newly created.
     *
     * @param share   the share as stored
     * @param created true if a new share was inserted, false if an existing one was updated
     */
    public record GrantResult(ShareResponse share, boolean created) {}

    /**
     * Grants a user access to a file or folder owned by the caller. If the user already
     * holds a share on the target, its permission is updated instead.
     *
     * @param ownerId the acting user, who must own the target
     * @param request the target, grantee and permission (VIEW when omitted)
     * @return the share and whether it was created
     * @throws ValidationException if the target is malformed or the grantee is the caller
     * @throws NotFoundException   if the target is not owned by the caller or the grantee does not exist
     */
    public GrantResult grantShare(UUID ownerId, GrantShareRequest request) {
        ShareTarget target = new ShareTarget(request.fileId(), request.folderId());
        requireOwnedTarget(target, ownerId);

        if (request.sharedWith().equals(ownerId)) {
            throw new ValidationException("You cannot share an item with yourself");
        }
        userDirectoryService.requireActiveUser(request.sharedWith());

        SharePermission permission = request.permission() != null ? request.permission() : SharePermission.VIEW;

        Optional<Share> existing = findShare(target, request.sharedWith());
        boolean created = existing.isEmpty();
        Share share = existing.orElseGet(() -> {
            Share fresh = Share.builder()
                    .sharedWithUserId(request.sharedWith())
                    .sharedByUserId(ownerId)
                    .build();
            fresh.setTarget(target);
            return fresh;
        });
        share.setPermission(permission);
        Share saved = shareRepository.save(share);

        log.info("{} {} share on {} {} for user {}", created ? "Created" : "Updated",
                permission, target.type(), target.id(), request.sharedWith());
        return new GrantResult(toShareResponse(saved,
                userDirectoryService.getSummaries(List.of(saved.getSharedWithUserId()))), created);
    }

    /**
     * Revokes a share. Only the user who created the share may revoke it.
     *
     * @param shareId     the share ID
     * @param requesterId the acting user
     * @throws NotFoundException      if the share does not exist
     * @throws AuthorizationException if the caller did not create the share
     */
    public void revokeShare(UUID shareId, UUID requesterId) {
        Share share = shareRepository.findById(shareId)
                .orElseThrow(() -> new NotFoundException("Share not found: " + shareId));
        if (!share.getSharedByUserId().equals(requesterId)) {
            throw new AuthorizationException("Only the user who shared this item can revoke access");
        }
        shareRepository.delete(share);
        log.info("Revoked share {} on {} {}", shareId, share.getTarget().type(), share.getTarget().id());
    }

    /**
     * Lists the items shared with the caller, newest first, each resolved to its target,
     * the target's owner and the sharer.
     *
     * @param userId the acting user
     * @return the shared items
     */
    @Transactional(readOnly = true)
    public List<SharedItemResponse> getSharedWithMe(UUID userId) {
        List<Share> shares = shareRepository.findBySharedWithUserIdOrderByCreatedAtDesc(userId);
        if (shares.isEmpty()) {
            return List.of();
        }

        Map<UUID, StoredFile> files = fileRepository.findByIdIn(shares.stream()
                        .map(Share::getFileId).filter(Objects::nonNull).toList()).stream()
                .collect(Collectors.toMap(StoredFile::getId, Function.identity()));
        Map<UUID, Folder> folders = folderRepository.findByIdIn(shares.stream()
                        .map(Share::getFolderId).filter(Objects::nonNull).toList()).stream()
                .collect(Collectors.toMap(Folder::getId, Function.identity()));

        Set<UUID> userIds = new HashSet<>();
        shares.forEach(s -> userIds.add(s.getSharedByUserId()));
        files.values().forEach(f -> userIds.add(f.getOwnerId()));
        folders.values().forEach(f -> userIds.add(f.getOwnerId()));
        Map<UUID, UserSummaryResponse> users = userDirectoryService.getSummaries(userIds);

        return shares.stream()
                .map(share -> toSharedItem(share, files, folders, users))
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Lists all shares on a file or folder owned by the caller.
     *
     * @param target  the file or folder
     * @param ownerId the acting user, who must own the target
     * @return the shares with grantee summaries
     * @throws NotFoundException if the target is not owned by the caller
     */
    @Transactional(readOnly = true)
    public List<ShareResponse> getSharesForTarget(ShareTarget target, UUID ownerId) {
        requireOwnedTarget(target, ownerId);
        List<Share> shares = target.type() == ShareTargetType.FILE
                ? shareRepository.findByFileId(target.fileId())
                : shareRepository.findByFolderId(target.folderId());
        Map<UUID, UserSummaryResponse> grantees = userDirectoryService.getSummaries(
                shares.stream().map(Share::getSharedWithUserId).toList());
        return shares.stream().map(share -> toShareResponse(share, grantees)).toList();
    }

    /**
     * Resolves whether a user may read a file or folder: the owner always may, anyone
     * else needs a share on that exact target.
     *
     * @param target      the file or folder
     * @param principalId the user asking
     * @return true if the user may access the target; false also when the target does not exist
     */
    @Transactional(readOnly = true)
    public boolean canAccess(ShareTarget target, UUID principalId) {
        Optional<UUID> ownerId = target.type() == ShareTargetType.FILE
                ? fileRepository.findById(target.fileId()).map(StoredFile::getOwnerId)
                : folderRepository.findById(target.folderId()).map(Folder::getOwnerId);
        if (ownerId.isEmpty()) {
            return false;
        }
        return ownerId.get().equals(principalId) || findShare(target, principalId).isPresent();
    }

    private Optional<Share> findShare(ShareTarget target, UUID userId) {
        return target.type() == ShareTargetType.FILE
                ? shareRepository.findByFileIdAndSharedWithUserId(target.fileId(), userId)
                : shareRepository.findByFolderIdAndSharedWithUserId(target.folderId(), userId);
    }

    private void requireOwnedTarget(ShareTarget target, UUID ownerId) {
        if (target.type() == ShareTargetType.FILE) {
            fileRepository.findByIdAndOwnerId(target.fileId(), ownerId)
                    .orElseThrow(() -> new NotFoundException("File not found: " + target.fileId()));
        } else {
            folderRepository.findByIdAndOwnerId(target.folderId(), ownerId)
                    .orElseThrow(() -> new NotFoundException("Folder not found: " + target.folderId()));
        }
    }

    private ShareResponse toShareResponse(Share share, Map<UUID, UserSummaryResponse> users) {
        ShareTarget target = share.getTarget();
        return new ShareResponse(
                share.getId(),
                target.type(),
                target.fileId(),
                target.folderId(),
                users.get(share.getSharedWithUserId()),
                share.getSharedByUserId(),
                share.getPermission(),
                share.getCreatedAt());
    }

    private SharedItemResponse toSharedItem(Share share, Map<UUID, StoredFile> files,
                                            Map<UUID, Folder> folders, Map<UUID, UserSummaryResponse> users) {
        ShareTarget target = share.getTarget();
        if (target.type() == ShareTargetType.FILE) {
            StoredFile file = files.get(target.fileId());
            if (file == null) {
                log.warn("Share {} points at missing file {}", share.getId(), target.fileId());
                return null;
            }
            return new SharedItemResponse(share.getId(), ShareTargetType.FILE, file.getId(), file.getName(),
                    file.getBlobSize(), file.getMimeType(), share.getPermission(),
                    users.get(file.getOwnerId()), users.get(share.getSharedByUserId()), share.getCreatedAt());
        }
        Folder folder = folders.get(target.folderId());
        if (folder == null) {
            log.warn("Share {} points at missing folder {}", share.getId(), target.folderId());
            return null;
        }
        return new SharedItemResponse(share.getId(), ShareTargetType.FOLDER, folder.getId(), folder.getName(),
                null, null, share.getPermission(),
                users.get(folder.getOwnerId()), users.get(share.getSharedByUserId()), share.getCreatedAt());
    }
}
