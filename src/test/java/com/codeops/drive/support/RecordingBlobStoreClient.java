package com.codeops.drive.support;

import com.codeops.drive.blob.BlobKeys;
import com.codeops.drive.blob.BlobStoreClient;
import com.codeops.drive.blob.BlobStoreException;
import com.codeops.drive.blob.SignedDownload;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory blob store that records deletions and can be told to fail them.
 */
public class RecordingBlobStoreClient implements BlobStoreClient {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();
    private final List<String> deleteRequests = new CopyOnWriteArrayList<>();
    private volatile boolean failDeletes;

    @Override
    public String put(InputStream content, long sizeHint, String contentType) {
        String key = BlobKeys.newKey();
        try {
            blobs.put(key, content.readAllBytes());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return key;
    }

    @Override
    public void delete(String blobKey) {
        deleteRequests.add(blobKey);
        if (failDeletes) {
            throw new BlobStoreException("Simulated backend outage");
        }
        blobs.remove(blobKey);
    }

    @Override
    public SignedDownload signDownload(String blobKey) {
        if (!blobs.containsKey(blobKey)) {
            throw new BlobStoreException("Blob not found: " + blobKey);
        }
        return new SignedDownload("memory://" + blobKey, Instant.now().plusSeconds(900));
    }

    public boolean contains(String blobKey) {
        return blobs.containsKey(blobKey);
    }

    public List<String> deleteRequests() {
        return List.copyOf(deleteRequests);
    }

    public void setFailDeletes(boolean failDeletes) {
        this.failDeletes = failDeletes;
    }

    public void reset() {
        blobs.clear();
        deleteRequests.clear();
        failDeletes = false;
    }
}
