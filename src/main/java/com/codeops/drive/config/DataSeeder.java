package com.codeops.drive.config;

import com.codeops.drive.entity.DriveUser;
import com.codeops.drive.entity.Folder;
import com.codeops.drive.repository.DriveUserRepository;
import com.codeops.drive.repository.FolderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Seeds sample users and a starter folder tree for development.
 * Only runs in the {@code dev} profile and is idempotent: skips if users already exist.
 */
@Component
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class DataSeeder implements CommandLineRunner {

    static final UUID SEED_OWNER_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");
    static final UUID SEED_COLLEAGUE_ID = UUID.fromString("00000000-0000-0000-0000-000000000003");
    static final UUID SEED_GUEST_ID = UUID.fromString("00000000-0000-0000-0000-000000000004");

    private final DriveUserRepository userRepository;
    private final FolderRepository folderRepository;

    /**
     * Seeds development data on application startup.
     *
     * @param args command-line arguments (unused)
     */
    @Override
    @Transactional
    public void run(String... args) {
        if (userRepository.count() > 0) {
            log.info("DataSeeder: Users already exist, skipping.");
            return;
        }

        userRepository.save(seedUser(SEED_OWNER_ID, "owner@codeops.dev", "Olivia", "Owner"));
        userRepository.save(seedUser(SEED_COLLEAGUE_ID, "colleague@codeops.dev", "Carlos", "Colleague"));
        userRepository.save(seedUser(SEED_GUEST_ID, "guest@codeops.dev", "Grace", "Guest"));

        Folder documents = seedFolder(null, "", "Documents");
        seedFolder(documents.getId(), documents.getPath(), "Reports");
        seedFolder(null, "", "Photos");

        log.info("DataSeeder: Seeded 3 users and 3 folders for owner {}", SEED_OWNER_ID);
    }

    private DriveUser seedUser(UUID id, String email, String firstName, String lastName) {
        return DriveUser.builder()
                .id(id)
                .email(email)
                .firstName(firstName)
                .lastName(lastName)
                .build();
    }

    private Folder seedFolder(UUID parentId, String parentPath, String name) {
        return folderRepository.save(Folder.builder()
                .name(name)
                .parentId(parentId)
                .ownerId(SEED_OWNER_ID)
                .path(parentPath + "/" + name)
                .build());
    }
}
