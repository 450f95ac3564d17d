package com.codeops.drive.blob;

import java.time.Instant;

/**
 * A time-limited download reference produced by a {@link BlobStoreClient}.
 *
 * @param url       the URL to fetch the content from
 * @param expiresAt when the URL stops working
 */
public record SignedDownload(String url, Instant expiresAt) {}
