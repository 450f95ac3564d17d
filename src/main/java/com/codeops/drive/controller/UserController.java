package com.codeops.drive.controller;

import com.codeops.drive.config.AppConstants;
import com.codeops.drive.dto.response.UserSummaryResponse;
import com.codeops.drive.service.UserDirectoryService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Active users that files and folders can be shared with.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX + "/users")
@PreAuthorize("isAuthenticated()")
@RequiredArgsConstructor
@Tag(name = "Users", description = "User directory lookup for sharing")
public class UserController {

    private final UserDirectoryService userDirectoryService;

    @GetMapping
    public List<UserSummaryResponse> listUsers() {
        return userDirectoryService.listActiveUsers();
    }
}
