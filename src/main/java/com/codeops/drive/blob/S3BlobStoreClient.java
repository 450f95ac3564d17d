package com.codeops.drive.blob;

import com.amazonaws.HttpMethod;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.GeneratePresignedUrlRequest;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.codeops.drive.config.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.net.URL;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Blob store backed by an S3 bucket. Downloads are served by pre-signed GET URLs.
 */
@Component
@ConditionalOnProperty(prefix = "codeops.storage", name = "provider", havingValue = "s3")
@Slf4j
public class S3BlobStoreClient implements BlobStoreClient {

    private final AmazonS3 amazonS3;
    private final String bucketName;
    private final long signedUrlTtlSeconds;
    private final Clock clock;

    public S3BlobStoreClient(AmazonS3 amazonS3, StorageProperties storageProperties, Clock clock) {
        this.amazonS3 = amazonS3;
        this.bucketName = storageProperties.getBucket();
        this.signedUrlTtlSeconds = storageProperties.getSignedUrlTtlSeconds();
        this.clock = clock;
    }

    @Override
    public String put(InputStream content, long sizeHint, String contentType) {
        String key = BlobKeys.newKey();
        ObjectMetadata metadata = new ObjectMetadata();
        metadata.setContentType(contentType);
        metadata.setContentLength(sizeHint);
        try {
            amazonS3.putObject(bucketName, key, content, metadata);
        } catch (SdkClientException e) {
            throw new BlobStoreException("Failed to upload blob " + key, e);
        }
        log.debug("Uploaded blob {} to bucket {} ({} bytes)", key, bucketName, sizeHint);
        return key;
    }

    @Override
    public void delete(String blobKey) {
        try {
            amazonS3.deleteObject(bucketName, blobKey);
        } catch (SdkClientException e) {
            throw new BlobStoreException("Failed to delete blob " + blobKey, e);
        }
    }

    @Override
    public SignedDownload signDownload(String blobKey) {
        Instant expiresAt = clock.instant().plusSeconds(signedUrlTtlSeconds);
        GeneratePresignedUrlRequest request = new GeneratePresignedUrlRequest(bucketName, blobKey)
                .withMethod(HttpMethod.GET)
                .withExpiration(Date.from(expiresAt));
        try {
            URL url = amazonS3.generatePresignedUrl(request);
            return new SignedDownload(url.toString(), expiresAt);
        } catch (SdkClientException e) {
            throw new BlobStoreException("Failed to sign download for blob " + blobKey, e);
        }
    }
}
