package com.codeops.drive.controller;

import com.codeops.drive.blob.LocalBlobStoreClient;
import com.codeops.drive.config.RequestCorrelationFilter;
import com.codeops.drive.entity.StoredFile;
import com.codeops.drive.repository.StoredFileRepository;
import com.codeops.drive.security.JwtAuthFilter;
import com.codeops.drive.security.JwtTokenValidator;
import com.codeops.drive.security.RateLimitFilter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LocalBlobController.class)
@Import(WebMvcTestSecurityConfig.class)
class LocalBlobControllerTest {

    @Autowired MockMvc mockMvc;

    @MockBean LocalBlobStoreClient localBlobStoreClient;
    @MockBean StoredFileRepository storedFileRepository;

    @MockBean JwtAuthFilter jwtAuthFilter;
    @MockBean JwtTokenValidator jwtTokenValidator;
    @MockBean RateLimitFilter rateLimitFilter;
    @MockBean RequestCorrelationFilter requestCorrelationFilter;

    private static final String KEY = "files/123e4567-e89b-12d3-a456-426614174000";
    private static final String URL = "/api/v1/drive/blobs";

    @TempDir
    Path tempDir;

    @Test
    void download_validSignature_streamsAttachment() throws Exception {
        Path blob = Files.writeString(tempDir.resolve("blob"), "quarterly numbers");
        when(localBlobStoreClient.verifyAndLocate(KEY, 1800000000L, "sig")).thenReturn(blob);
        when(storedFileRepository.findByBlobKey(KEY)).thenReturn(Optional.of(
                StoredFile.builder().name("report.txt").mimeType("text/plain").blobKey(KEY).build()));

        mockMvc.perform(get(URL).param("key", KEY).param("expires", "1800000000").param("signature", "sig"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("report.txt")))
                .andExpect(content().contentTypeCompatibleWith("text/plain"))
                .andExpect(content().string("quarterly numbers"));
    }

    @Test
    void download_rejectedSignature_404() throws Exception {
        when(localBlobStoreClient.verifyAndLocate(KEY, 1L, "bad")).thenReturn(null);

        mockMvc.perform(get(URL).param("key", KEY).param("expires", "1").param("signature", "bad"))
                .andExpect(status().isNotFound());
    }
}
