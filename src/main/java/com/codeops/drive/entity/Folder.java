package com.codeops.drive.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * A node in a user's folder tree.
 *
 * <p>{@code path} is the materialized ancestor chain: {@code "/" + name} at the root,
 * {@code parent.path + "/" + name} below it. It is rewritten for the whole subtree
 * whenever a folder is renamed. {@code parentId} is a plain id reference; deleting a
 * parent removes its descendants explicitly.</p>
 */
@Entity
@Table(name = "storage_folders",
        uniqueConstraints = @UniqueConstraint(name = "uk_storage_folders_owner_scope_name",
                columnNames = {"owner_id", "sibling_scope", "name"}),
        indexes = {
                @Index(name = "idx_storage_folders_owner_parent", columnList = "owner_id, parent_id"),
                @Index(name = "idx_storage_folders_owner_path", columnList = "owner_id, path")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Folder extends BaseEntity {

    public static final String ROOT_SCOPE = "root";

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "parent_id")
    private UUID parentId;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(nullable = false, length = 1000)
    private String path;

    /**
     * The parent id as text, or {@value #ROOT_SCOPE} for top-level folders. The sibling-name
     * unique key uses this instead of {@code parent_id}, which as NULL never collides.
     */
    @Column(name = "sibling_scope", nullable = false, length = 36)
    @Setter(AccessLevel.NONE)
    private String siblingScope;

    @PrePersist
    @PreUpdate
    void assignSiblingScope() {
        siblingScope = parentId != null ? parentId.toString() : ROOT_SCOPE;
    }
}
