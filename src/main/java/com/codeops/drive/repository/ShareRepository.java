package com.codeops.drive.repository;

import com.codeops.drive.entity.Share;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ShareRepository extends JpaRepository<Share, UUID> {

    List<Share> findByFileId(UUID fileId);

    List<Share> findByFolderId(UUID folderId);

    List<Share> findBySharedWithUserIdOrderByCreatedAtDesc(UUID userId);

    Optional<Share> findByFileIdAndSharedWithUserId(UUID fileId, UUID userId);

    Optional<Share> findByFolderIdAndSharedWithUserId(UUID folderId, UUID userId);

    boolean existsByFileIdAndSharedWithUserId(UUID fileId, UUID userId);

    boolean existsByFolderIdAndSharedWithUserId(UUID folderId, UUID userId);

    @Modifying
    @Query("DELETE FROM Share s WHERE s.fileId IN :fileIds")
    int deleteByFileIdIn(@Param("fileIds") Collection<UUID> fileIds);

    @Modifying
    @Query("DELETE FROM Share s WHERE s.folderId IN :folderIds")
    int deleteByFolderIdIn(@Param("folderIds") Collection<UUID> folderIds);
}
