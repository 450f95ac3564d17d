package com.codeops.drive.service;

import com.codeops.drive.blob.BlobStoreClient;
import com.codeops.drive.blob.SignedDownload;
import com.codeops.drive.config.AppConstants;
import com.codeops.drive.dto.response.DownloadResponse;
import com.codeops.drive.dto.response.PublicFileInfoResponse;
import com.codeops.drive.dto.response.PublicLinkResponse;
import com.codeops.drive.entity.StoredFile;
import com.codeops.drive.exception.GoneException;
import com.codeops.drive.exception.NotFoundException;
import com.codeops.drive.exception.ValidationException;
import com.codeops.drive.repository.StoredFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Service for anonymous public links on files. A link is an unguessable token that
 * resolves to a reduced view of the file and a signed download, until it expires or
 * the owner revokes it. Expiry is evaluated when the link is read.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class PublicLinkService {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final StoredFileRepository fileRepository;
    private final UserDirectoryService userDirectoryService;
    private final BlobStoreClient blobStoreClient;
    private final Clock clock;

    /**
     * Makes a file publicly downloadable under a fresh token, replacing any previous token.
     *
     * @param fileId   the file ID
     * @param ownerId  the acting user, who must own the file
     * @param ttlHours the link lifetime in hours, or null for a link that never expires
     * @return the token, the public URL and the expiry
     * @throws ValidationException if the lifetime is not positive
     * @throws NotFoundException   if the file does not exist or belongs to someone else
     */
    public PublicLinkResponse issuePublicLink(UUID fileId, UUID ownerId, Integer ttlHours) {
        if (ttlHours != null && ttlHours <= 0) {
            throw new ValidationException("Expiry must be a positive number of hours");
        }
        StoredFile file = findOwnedFile(fileId, ownerId);

        String token = generateUniqueToken();
        Instant expiresAt = ttlHours != null ? clock.instant().plus(Duration.ofHours(ttlHours)) : null;
        file.publish(token, expiresAt);
        fileRepository.save(file);

        log.info("Issued public link for file {} (expires {})", fileId, expiresAt != null ? expiresAt : "never");
        return new PublicLinkResponse(token, publicUrl(token), expiresAt);
    }

    /**
     * Removes the public link from a file. Revoking a file without a link is a no-op.
     *
     * @param fileId  the file ID
     * @param ownerId the acting user, who must own the file
     * @throws NotFoundException if the file does not exist or belongs to someone else
     */
    public void revokePublicLink(UUID fileId, UUID ownerId) {
        StoredFile file = findOwnedFile(fileId, ownerId);
        file.unpublish();
        fileRepository.save(file);
        log.info("Revoked public link for file {}", fileId);
    }

    /**
     * Resolves a public token to the file's public information.
     *
     * @param token the public token
     * @return the reduced file view
     * @throws NotFoundException if no public file has this token
     * @throws GoneException     if the link has expired
     */
    @Transactional(readOnly = true)
    public PublicFileInfoResponse resolvePublic(String token) {
        StoredFile file = findLiveLink(token);
        return new PublicFileInfoResponse(
                file.getName(),
                file.getBlobSize(),
                file.getFileType(),
                file.getMimeType(),
                file.getPublicExpiresAt(),
                userDirectoryService.getDisplayName(file.getOwnerId()),
                file.getCreatedAt());
    }

    /**
     * Resolves a public token to a signed download of the file.
     *
     * @param token the public token
     * @return the signed URL, file name and URL expiry
     * @throws NotFoundException if no public file has this token
     * @throws GoneException     if the link has expired
     */
    @Transactional(readOnly = true)
    public DownloadResponse resolvePublicDownload(String token) {
        StoredFile file = findLiveLink(token);
        SignedDownload signed = blobStoreClient.signDownload(file.getBlobKey());
        log.debug("Issued public download URL for file {}", file.getId());
        return new DownloadResponse(signed.url(), file.getName(), signed.expiresAt());
    }

    /**
     * Builds the public info URL for a token, relative to the service root.
     *
     * @param token the public token
     * @return the URL path
     */
    public static String publicUrl(String token) {
        return AppConstants.API_PREFIX + "/public/" + token;
    }

    private StoredFile findLiveLink(String token) {
        StoredFile file = fileRepository.findByPublicTokenAndIsPublicTrue(token)
                .orElseThrow(() -> new NotFoundException("Public link not found"));
        if (file.isPublicLinkExpired(clock.instant())) {
            throw new GoneException("Public link has expired");
        }
        return file;
    }

    private StoredFile findOwnedFile(UUID fileId, UUID ownerId) {
        return fileRepository.findByIdAndOwnerId(fileId, ownerId)
                .orElseThrow(() -> new NotFoundException("File not found: " + fileId));
    }

    private String generateUniqueToken() {
        String token;
        do {
            byte[] bytes = new byte[AppConstants.PUBLIC_TOKEN_BYTES];
            RANDOM.nextBytes(bytes);
            token = HexFormat.of().formatHex(bytes);
        } while (fileRepository.existsByPublicToken(token));
        return token;
    }
}
