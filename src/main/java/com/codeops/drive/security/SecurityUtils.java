package com.codeops.drive.security;

import com.codeops.drive.exception.AuthorizationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.UUID;

/**
 * Static accessors for the authenticated principal.
 */
public final class SecurityUtils {

    private SecurityUtils() {}

    /**
     * Returns the id of the authenticated user.
     *
     * @return the current user's UUID
     * @throws AuthorizationException if no user is authenticated
     */
    public static UUID getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof UUID userId)) {
            throw new AuthorizationException("No authenticated user");
        }
        return userId;
    }
}
