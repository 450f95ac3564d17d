package com.codeops.drive.entity;

import com.codeops.drive.entity.enums.ShareTargetType;
import com.codeops.drive.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShareTargetTest {

    @Test
    void file_resolvesTypeAndId() {
        UUID id = UUID.randomUUID();
        ShareTarget target = ShareTarget.file(id);

        assertThat(target.type()).isEqualTo(ShareTargetType.FILE);
        assertThat(target.id()).isEqualTo(id);
        assertThat(target.folderId()).isNull();
    }

    @Test
    void folder_resolvesTypeAndId() {
        UUID id = UUID.randomUUID();
        ShareTarget target = ShareTarget.folder(id);

        assertThat(target.type()).isEqualTo(ShareTargetType.FOLDER);
        assertThat(target.id()).isEqualTo(id);
    }

    @Test
    void neither_rejected() {
        assertThatThrownBy(() -> new ShareTarget(null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("File ID or Folder ID is required");
    }

    @Test
    void both_rejected() {
        assertThatThrownBy(() -> new ShareTarget(UUID.randomUUID(), UUID.randomUUID()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Provide either File ID or Folder ID, not both");
    }
}
