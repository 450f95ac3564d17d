package com.codeops.drive.controller;

import com.codeops.drive.config.AppConstants;
import com.codeops.drive.dto.response.DownloadResponse;
import com.codeops.drive.dto.response.PublicFileInfoResponse;
import com.codeops.drive.service.PublicLinkService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated access to files through their public tokens.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX + "/public/{token}")
@RequiredArgsConstructor
@Tag(name = "Public Files", description = "Anonymous access through public links")
public class PublicFileController {

    private final PublicLinkService publicLinkService;

    /**
     * Returns the public information of a file. The bare token path is kept for links
     * issued before the {@code /info} suffix existed.
     *
     * @param token the public token
     * @return the reduced file view
     */
    @GetMapping({"", "/info"})
    public PublicFileInfoResponse getPublicFileInfo(@PathVariable String token) {
        return publicLinkService.resolvePublic(token);
    }

    /**
     * Returns a short-lived download URL for a public file.
     *
     * @param token the public token
     * @return the signed URL, file name and expiry
     */
    @GetMapping("/download")
    public DownloadResponse downloadPublicFile(@PathVariable String token) {
        return publicLinkService.resolvePublicDownload(token);
    }
}
