package com.codeops.drive.blob;

import com.codeops.drive.config.StorageProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for LocalBlobStoreClient covering writes, deletes, and signed URL verification.
 */
class LocalBlobStoreClientTest {

    private static final Instant NOW = Instant.parse("2026-05-01T10:00:00Z");

    @TempDir
    Path root;

    private LocalBlobStoreClient client;

    @BeforeEach
    void setUp() {
        client = newClient(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void put_writesContentUnderGeneratedKey() throws Exception {
        String key = client.put(new ByteArrayInputStream("hello".getBytes(StandardCharsets.UTF_8)), 5, "text/plain");

        assertThat(BlobKeys.isValid(key)).isTrue();
        assertThat(Files.readString(root.resolve(key))).isEqualTo("hello");
    }

    @Test
    void put_streamFailsMidway_leavesNoPartialFile() throws Exception {
        InputStream failing = new InputStream() {
            private int served;

            @Override
            public int read() throws IOException {
                if (served++ < 4096) {
                    return 'x';
                }
                throw new IOException("connection reset");
            }
        };

        assertThatThrownBy(() -> client.put(failing, 8192, "text/plain"))
                .isInstanceOf(BlobStoreException.class)
                .hasCauseInstanceOf(IOException.class);

        try (Stream<Path> files = Files.walk(root)) {
            assertThat(files.filter(Files::isRegularFile)).isEmpty();
        }
    }

    @Test
    void delete_removesBlob() {
        String key = client.put(new ByteArrayInputStream(new byte[]{1}), 1, "application/octet-stream");

        client.delete(key);

        assertThat(Files.exists(root.resolve(key))).isFalse();
    }

    @Test
    void delete_missingBlob_throws() {
        assertThatThrownBy(() -> client.delete(BlobKeys.newKey()))
                .isInstanceOf(BlobStoreException.class);
    }

    @Test
    void delete_traversalKey_rejected() {
        assertThatThrownBy(() -> client.delete("files/../../etc/passwd"))
                .isInstanceOf(BlobStoreException.class)
                .hasMessageContaining("Invalid blob key");
    }

    @Test
    void signDownload_roundTripsThroughVerification() {
        String key = client.put(new ByteArrayInputStream(new byte[]{1, 2}), 2, "application/octet-stream");

        SignedDownload signed = client.signDownload(key);
        UriComponents uri = UriComponentsBuilder.fromUriString(signed.url()).build();

        assertThat(uri.getPath()).isEqualTo(LocalBlobStoreClient.DOWNLOAD_PATH);
        assertThat(signed.expiresAt()).isEqualTo(NOW.plusSeconds(3600));
        Path located = client.verifyAndLocate(key,
                Long.parseLong(uri.getQueryParams().getFirst("expires")),
                uri.getQueryParams().getFirst("signature"));
        assertThat(located).isEqualTo(root.resolve(key));
    }

    @Test
    void verifyAndLocate_tamperedSignature_null() {
        String key = client.put(new ByteArrayInputStream(new byte[]{1}), 1, "text/plain");
        long expires = NOW.plusSeconds(60).getEpochSecond();

        assertThat(client.verifyAndLocate(key, expires, "00".repeat(32))).isNull();
    }

    @Test
    void verifyAndLocate_expired_null() {
        String key = client.put(new ByteArrayInputStream(new byte[]{1}), 1, "text/plain");
        SignedDownload signed = client.signDownload(key);
        UriComponents uri = UriComponentsBuilder.fromUriString(signed.url()).build();

        LocalBlobStoreClient later = newClient(Clock.fixed(NOW.plusSeconds(7200), ZoneOffset.UTC));

        assertThat(later.verifyAndLocate(key,
                Long.parseLong(uri.getQueryParams().getFirst("expires")),
                uri.getQueryParams().getFirst("signature"))).isNull();
    }

    @Test
    void signDownload_missingBlob_throws() {
        assertThatThrownBy(() -> client.signDownload(BlobKeys.newKey()))
                .isInstanceOf(BlobStoreException.class);
    }

    private LocalBlobStoreClient newClient(Clock clock) {
        StorageProperties properties = new StorageProperties();
        properties.setLocalRoot(root.toString());
        properties.setSigningSecret("unit-test-signing-secret");
        return new LocalBlobStoreClient(properties, clock);
    }
}
