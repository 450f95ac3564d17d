package com.codeops.drive.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for AppConstants verifying accessibility and values.
 */
class AppConstantsTest {

    @Test
    void constants_areAccessibleAndNonNull() {
        assertThat(AppConstants.API_PREFIX).isEqualTo("/api/v1/drive");
        assertThat(AppConstants.SERVICE_NAME).isEqualTo("codeops-drive");
        assertThat(AppConstants.RATE_LIMIT_REQUESTS).isEqualTo(100);
        assertThat(AppConstants.RATE_LIMIT_WINDOW_SECONDS).isEqualTo(60);
        assertThat(AppConstants.DEFAULT_MAX_FILE_SIZE).isEqualTo(10L * 1024 * 1024);
        assertThat(AppConstants.PUBLIC_TOKEN_BYTES).isEqualTo(32);
        assertThat(AppConstants.MAX_NAME_LENGTH).isEqualTo(255);
    }
}
