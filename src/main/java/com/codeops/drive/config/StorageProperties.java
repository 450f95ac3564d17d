package com.codeops.drive.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the blob backend and upload limits, bound to the
 * {@code codeops.storage} prefix.
 *
 * <p>{@code provider} selects the {@link com.codeops.drive.blob.BlobStoreClient}
 * implementation: {@code local} (filesystem under {@code localRoot}) or {@code s3}
 * (bucket {@code bucket} in {@code region}).</p>
 */
@ConfigurationProperties(prefix = "codeops.storage")
@Getter
@Setter
public class StorageProperties {

    private String provider = "local";

    private String localRoot = "./drive-blobs";

    private String bucket;

    private String region;

    private long maxFileSize = AppConstants.DEFAULT_MAX_FILE_SIZE;

    private long signedUrlTtlSeconds = AppConstants.DEFAULT_SIGNED_URL_TTL_SECONDS;

    /** HMAC secret for local signed download URLs. */
    private String signingSecret;
}
