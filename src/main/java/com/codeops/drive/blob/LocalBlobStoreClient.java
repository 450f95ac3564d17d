package com.codeops.drive.blob;

import com.codeops.drive.config.AppConstants;
import com.codeops.drive.config.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Filesystem-backed blob store for single-node deployments and development.
 *
 * <p>Objects are written to {@code codeops.storage.local-root}. Signed downloads point at
 * {@link LocalBlobController} and carry an HMAC-SHA256 signature over the key and expiry,
 * so the URL can be handed to an unauthenticated client.</p>
 */
@Component
@ConditionalOnProperty(prefix = "codeops.storage", name = "provider", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalBlobStoreClient implements BlobStoreClient {

    public static final String DOWNLOAD_PATH = AppConstants.API_PREFIX + "/blobs";

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final Path rootLocation;
    private final byte[] signingKey;
    private final long signedUrlTtlSeconds;
    private final Clock clock;

    public LocalBlobStoreClient(StorageProperties storageProperties, Clock clock) {
        this.rootLocation = Paths.get(storageProperties.getLocalRoot()).toAbsolutePath().normalize();
        this.signedUrlTtlSeconds = storageProperties.getSignedUrlTtlSeconds();
        this.clock = clock;
        this.signingKey = resolveSigningKey(storageProperties.getSigningSecret());
        init();
    }

    private void init() {
        try {
            Files.createDirectories(rootLocation);
        } catch (IOException e) {
            throw new BlobStoreException("Could not initialize blob storage location", e);
        }
        log.info("Local blob store rooted at {}", rootLocation);
    }

    @Override
    public String put(InputStream content, long sizeHint, String contentType) {
        String key = BlobKeys.newKey();
        Path destination = resolve(key);
        try {
            Files.createDirectories(destination.getParent());
            try (OutputStream out = Files.newOutputStream(destination)) {
                content.transferTo(out);
            }
        } catch (IOException e) {
            discardPartial(destination, key);
            throw new BlobStoreException("Failed to write blob " + key, e);
        }
        log.debug("Stored blob {} ({} bytes, {})", key, sizeHint, contentType);
        return key;
    }

    private void discardPartial(Path destination, String key) {
        try {
            Files.deleteIfExists(destination);
        } catch (IOException e) {
            log.warn("Could not remove partial blob {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void delete(String blobKey) {
        try {
            Files.delete(resolve(blobKey));
        } catch (NoSuchFileException e) {
            throw new BlobStoreException("Blob not found: " + blobKey, e);
        } catch (IOException e) {
            throw new BlobStoreException("Failed to delete blob " + blobKey, e);
        }
    }

    @Override
    public SignedDownload signDownload(String blobKey) {
        if (!Files.exists(resolve(blobKey))) {
            throw new BlobStoreException("Blob not found: " + blobKey);
        }
        Instant expiresAt = clock.instant().plusSeconds(signedUrlTtlSeconds);
        long expires = expiresAt.getEpochSecond();
        String url = DOWNLOAD_PATH
                + "?key=" + URLEncoder.encode(blobKey, StandardCharsets.UTF_8)
                + "&expires=" + expires
                + "&signature=" + sign(blobKey, expires);
        return new SignedDownload(url, expiresAt);
    }

    /**
     * Checks a signed download request and returns the blob's location on disk.
     *
     * @param blobKey   the key from the URL
     * @param expires   the expiry from the URL, in epoch seconds
     * @param signature the signature from the URL
     * @return the path of the blob, or null if the signature is invalid, expired, or the blob is missing
     */
    public Path verifyAndLocate(String blobKey, long expires, String signature) {
        if (!BlobKeys.isValid(blobKey) || signature == null) {
            return null;
        }
        if (clock.instant().getEpochSecond() > expires) {
            return null;
        }
        byte[] expected = sign(blobKey, expires).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, actual)) {
            return null;
        }
        Path path = resolve(blobKey);
        return Files.isRegularFile(path) ? path : null;
    }

    private Path resolve(String blobKey) {
        if (!BlobKeys.isValid(blobKey)) {
            throw new BlobStoreException("Invalid blob key");
        }
        Path path = rootLocation.resolve(blobKey).normalize();
        if (!path.startsWith(rootLocation)) {
            throw new BlobStoreException("Blob key resolves outside the storage root");
        }
        return path;
    }

    private String sign(String blobKey, long expires) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingKey, HMAC_ALGORITHM));
            byte[] digest = mac.doFinal((blobKey + ":" + expires).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new BlobStoreException("Failed to sign download URL", e);
        }
    }

    private static byte[] resolveSigningKey(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.getBytes(StandardCharsets.UTF_8);
        }
        log.warn("codeops.storage.signing-secret is not set; signed URLs will not survive a restart");
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        return key;
    }
}
