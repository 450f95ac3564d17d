package com.codeops.drive.repository;

import com.codeops.drive.entity.Folder;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FolderRepository extends JpaRepository<Folder, UUID> {

    Optional<Folder> findByIdAndOwnerId(UUID id, UUID ownerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Folder> findWithLockByIdAndOwnerId(UUID id, UUID ownerId);

    List<Folder> findByOwnerIdAndParentIdIsNullOrderByNameAsc(UUID ownerId);

    List<Folder> findByOwnerIdAndParentIdOrderByNameAsc(UUID ownerId, UUID parentId);

    List<Folder> findByOwnerIdOrderByPathAsc(UUID ownerId);

    List<Folder> findByIdIn(Collection<UUID> ids);

    boolean existsByOwnerIdAndParentIdIsNullAndName(UUID ownerId, String name);

    boolean existsByOwnerIdAndParentIdAndName(UUID ownerId, UUID parentId, String name);

    boolean existsByOwnerIdAndParentIdIsNullAndNameAndIdNot(UUID ownerId, String name, UUID id);

    boolean existsByOwnerIdAndParentIdAndNameAndIdNot(UUID ownerId, UUID parentId, String name, UUID id);

    /**
     * Loads every folder of the owner whose path starts with the given prefix and locks
     * the rows for the rest of the transaction. Wildcards in the prefix are escaped.
     *
     * @param ownerId    the owner
     * @param pathPrefix the prefix, normally {@code folder.path + "/"}
     * @return the locked descendants
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    List<Folder> findByOwnerIdAndPathStartingWith(UUID ownerId, String pathPrefix);

    long countByOwnerId(UUID ownerId);
}
