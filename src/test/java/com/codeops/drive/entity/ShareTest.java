package com.codeops.drive.entity;

import com.codeops.drive.entity.enums.SharePermission;
import com.codeops.drive.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the persistence-time invariant checks on Share.
 */
class ShareTest {

    @Test
    void setTarget_replacesOtherReference() {
        Share share = Share.builder().fileId(UUID.randomUUID()).build();
        UUID folderId = UUID.randomUUID();

        share.setTarget(ShareTarget.folder(folderId));

        assertThat(share.getFileId()).isNull();
        assertThat(share.getFolderId()).isEqualTo(folderId);
    }

    @Test
    void checkInvariants_validShare_passes() {
        Share share = Share.builder().fileId(UUID.randomUUID()).sharedByUserId(UUID.randomUUID())
                .sharedWithUserId(UUID.randomUUID()).permission(SharePermission.VIEW).build();

        assertThatCode(share::checkInvariants).doesNotThrowAnyException();
    }

    @Test
    void checkInvariants_bothTargets_rejected() {
        Share share = Share.builder().fileId(UUID.randomUUID()).folderId(UUID.randomUUID())
                .sharedByUserId(UUID.randomUUID()).sharedWithUserId(UUID.randomUUID()).build();

        assertThatThrownBy(share::checkInvariants).isInstanceOf(ValidationException.class);
    }

    @Test
    void checkInvariants_selfShare_rejected() {
        UUID user = UUID.randomUUID();
        Share share = Share.builder().fileId(UUID.randomUUID()).sharedByUserId(user).sharedWithUserId(user).build();

        assertThatThrownBy(share::checkInvariants).isInstanceOf(IllegalStateException.class);
    }
}
