package com.codeops.drive.controller;

import com.codeops.drive.blob.LocalBlobStoreClient;
import com.codeops.drive.config.AppConstants;
import com.codeops.drive.entity.StoredFile;
import com.codeops.drive.exception.NotFoundException;
import com.codeops.drive.repository.StoredFileRepository;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Serves blob content for signed URLs issued by {@link LocalBlobStoreClient}.
 * Unauthenticated: the HMAC signature in the URL is the credential.
 */
@RestController
@ConditionalOnProperty(prefix = "codeops.storage", name = "provider", havingValue = "local", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Blobs", description = "Signed content download for the local blob provider")
public class LocalBlobController {

    private final LocalBlobStoreClient localBlobStoreClient;
    private final StoredFileRepository storedFileRepository;

    /**
     * Streams the blob named by a signed URL.
     *
     * @param key       the blob key
     * @param expires   the URL expiry in epoch seconds
     * @param signature the HMAC signature
     * @return the blob content as an attachment
     */
    @GetMapping(AppConstants.API_PREFIX + "/blobs")
    public ResponseEntity<Resource> download(@RequestParam String key,
                                             @RequestParam long expires,
                                             @RequestParam String signature) {
        Path path = localBlobStoreClient.verifyAndLocate(key, expires, signature);
        if (path == null) {
            throw new NotFoundException("Download link is invalid or has expired");
        }

        Optional<StoredFile> metadata = storedFileRepository.findByBlobKey(key);
        String fileName = metadata.map(StoredFile::getName).orElse("download");
        MediaType mediaType = metadata.map(StoredFile::getMimeType)
                .map(this::parseMediaType)
                .orElse(MediaType.APPLICATION_OCTET_STREAM);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(fileName, StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .contentType(mediaType)
                .body(new FileSystemResource(path));
    }

    private MediaType parseMediaType(String mimeType) {
        try {
            return MediaType.parseMediaType(mimeType);
        } catch (IllegalArgumentException e) {
            log.debug("Stored mime type '{}' is not parseable, serving as octet-stream", mimeType);
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
