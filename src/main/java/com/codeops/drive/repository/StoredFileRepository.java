package com.codeops.drive.repository;

import com.codeops.drive.entity.StoredFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StoredFileRepository extends JpaRepository<StoredFile, UUID> {

    Optional<StoredFile> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<StoredFile> findByOwnerIdAndFolderIdIsNullOrderByNameAsc(UUID ownerId);

    List<StoredFile> findByOwnerIdAndFolderIdOrderByNameAsc(UUID ownerId, UUID folderId);

    List<StoredFile> findByFolderIdIn(Collection<UUID> folderIds);

    List<StoredFile> findByIdIn(Collection<UUID> ids);

    Optional<StoredFile> findByPublicTokenAndIsPublicTrue(String publicToken);

    Optional<StoredFile> findByBlobKey(String blobKey);

    boolean existsByPublicToken(String publicToken);

    long countByOwnerId(UUID ownerId);

    @Query("SELECT COALESCE(SUM(f.blobSize), 0) FROM StoredFile f WHERE f.ownerId = :ownerId")
    long sumBlobSizeByOwnerId(@Param("ownerId") UUID ownerId);
}
