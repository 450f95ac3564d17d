package com.codeops.drive.entity;

import com.codeops.drive.entity.enums.SharePermission;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * An access grant on exactly one file or one folder for a user other than the sharer.
 * At most one grant exists per target and grantee; re-sharing updates the permission.
 */
@Entity
@Table(name = "storage_shares",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_storage_shares_file_grantee",
                        columnNames = {"file_id", "shared_with_user_id"}),
                @UniqueConstraint(name = "uk_storage_shares_folder_grantee",
                        columnNames = {"folder_id", "shared_with_user_id"})
        },
        indexes = {
                @Index(name = "idx_storage_shares_shared_with", columnList = "shared_with_user_id"),
                @Index(name = "idx_storage_shares_shared_by", columnList = "shared_by_user_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Share extends BaseEntity {

    @Column(name = "file_id")
    private UUID fileId;

    @Column(name = "folder_id")
    private UUID folderId;

    @Column(name = "shared_with_user_id", nullable = false)
    private UUID sharedWithUserId;

    @Column(name = "shared_by_user_id", nullable = false)
    private UUID sharedByUserId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private SharePermission permission;

    /**
     * Returns the target of this share.
     *
     * @return the file or folder this share grants access to
     */
    public ShareTarget getTarget() {
        return new ShareTarget(fileId, folderId);
    }

    /**
     * Points this share at the given target, clearing the other reference.
     *
     * @param target the file or folder
     */
    public void setTarget(ShareTarget target) {
        this.fileId = target.fileId();
        this.folderId = target.folderId();
    }

    @PrePersist
    @PreUpdate
    void checkInvariants() {
        new ShareTarget(fileId, folderId);
        if (sharedWithUserId != null && sharedWithUserId.equals(sharedByUserId)) {
            throw new IllegalStateException("A share cannot grant access to its own sharer");
        }
    }
}
