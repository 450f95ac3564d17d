package com.codeops.drive.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Metadata for a file whose content lives in the blob store under {@code blobKey}.
 *
 * <p>{@code folderId == null} means the file sits at the owner's root. The blob key never
 * changes after insert; rename and move touch metadata only. The public link fields are
 * always written together: {@code publicToken} is set exactly when {@code isPublic} is true.</p>
 */
@Entity
@Table(name = "storage_files",
        indexes = {
                @Index(name = "idx_storage_files_owner_folder", columnList = "owner_id, folder_id"),
                @Index(name = "idx_storage_files_folder_id", columnList = "folder_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoredFile extends BaseEntity {

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "folder_id")
    private UUID folderId;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "blob_key", nullable = false, unique = true, updatable = false, length = 500)
    private String blobKey;

    @Column(name = "blob_size", nullable = false)
    private long blobSize;

    @Column(name = "mime_type", length = 100)
    private String mimeType;

    @Column(name = "file_type", length = 100)
    private String fileType;

    @Builder.Default
    @Column(name = "is_public", nullable = false)
    private Boolean isPublic = false;

    @Column(name = "public_token", unique = true, length = 64)
    private String publicToken;

    @Column(name = "public_expires_at")
    private Instant publicExpiresAt;

    /**
     * Marks the file public under the given token.
     *
     * @param token     the link token
     * @param expiresAt the expiry, or null for a link that never expires
     */
    public void publish(String token, Instant expiresAt) {
        this.isPublic = true;
        this.publicToken = token;
        this.publicExpiresAt = expiresAt;
    }

    /**
     * Clears all public link state. Safe to call on a file that was never public.
     */
    public void unpublish() {
        this.isPublic = false;
        this.publicToken = null;
        this.publicExpiresAt = null;
    }

    /**
     * Returns whether the public link has an expiry that lies before {@code now}.
     *
     * @param now the reference time
     * @return true if the link is expired
     */
    public boolean isPublicLinkExpired(Instant now) {
        return publicExpiresAt != null && publicExpiresAt.isBefore(now);
    }
}
