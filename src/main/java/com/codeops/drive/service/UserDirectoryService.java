package com.codeops.drive.service;

import com.codeops.drive.config.AppConstants;
import com.codeops.drive.dto.mapper.UserMapper;
import com.codeops.drive.dto.response.UserSummaryResponse;
import com.codeops.drive.entity.DriveUser;
import com.codeops.drive.exception.NotFoundException;
import com.codeops.drive.repository.DriveUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only lookups against the user directory. Users are provisioned by the identity
 * service; this service never creates or modifies them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserDirectoryService {

    private final DriveUserRepository userRepository;
    private final UserMapper userMapper;

    /**
     * Returns all active users, ordered by first then last name, for the share dialog.
     *
     * @return the active users
     */
    public List<UserSummaryResponse> listActiveUsers() {
        return userRepository.findByActiveTrueOrderByFirstNameAscLastNameAsc().stream()
                .map(userMapper::toSummary)
                .toList();
    }

    /**
     * Loads an active user or fails.
     *
     * @param userId the user ID
     * @return the user
     * @throws NotFoundException if no active user has this ID
     */
    public DriveUser requireActiveUser(UUID userId) {
        return userRepository.findById(userId)
                .filter(DriveUser::isActive)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }

    /**
     * Loads summaries for a batch of users. Unknown IDs are absent from the result.
     *
     * @param userIds the user IDs
     * @return summaries keyed by user ID
     */
    public Map<UUID, UserSummaryResponse> getSummaries(Collection<UUID> userIds) {
        if (userIds.isEmpty()) {
            return Map.of();
        }
        return userRepository.findByIdIn(userIds).stream()
                .map(userMapper::toSummary)
                .collect(Collectors.toMap(UserSummaryResponse::id, Function.identity()));
    }

    /**
     * Returns the display name of a user, or {@value AppConstants#UNKNOWN_OWNER} if the user
     * is not in the directory.
     *
     * @param userId the user ID
     * @return the display name
     */
    public String getDisplayName(UUID userId) {
        return userRepository.findById(userId)
                .map(DriveUser::getDisplayName)
                .orElse(AppConstants.UNKNOWN_OWNER);
    }
}
