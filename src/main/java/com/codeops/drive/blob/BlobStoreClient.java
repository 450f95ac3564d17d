package com.codeops.drive.blob;

import java.io.InputStream;

/**
 * Narrow interface to the external blob backend holding raw file content.
 *
 * <p>Keys are opaque and globally unique; callers never derive meaning from them.
 * Every method may fail with {@link BlobStoreException}.</p>
 */
public interface BlobStoreClient {

    /**
     * Stores content under a newly generated key.
     *
     * @param content     the content stream, read to the end but not closed
     * @param sizeHint    the content length in bytes
     * @param contentType the mime type to record with the object
     * @return the key of the stored object
     * @throws BlobStoreException if the backend rejects or fails the write
     */
    String put(InputStream content, long sizeHint, String contentType);

    /**
     * Deletes the object stored under {@code blobKey}.
     *
     * @param blobKey the key returned by {@link #put}
     * @throws BlobStoreException if the backend fails the delete
     */
    void delete(String blobKey);

    /**
     * Produces a short-lived URL from which the object can be downloaded without further
     * authentication.
     *
     * @param blobKey the key returned by {@link #put}
     * @return the signed URL and its expiry
     * @throws BlobStoreException if the URL cannot be signed
     */
    SignedDownload signDownload(String blobKey);
}
