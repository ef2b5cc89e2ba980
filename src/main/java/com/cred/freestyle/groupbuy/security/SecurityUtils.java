package com.cred.freestyle.groupbuy.security;

import com.cred.freestyle.groupbuy.exception.UnauthenticatedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

/**
 * Utility class for reading the authenticated caller from the security context.
 *
 * @author Group Buy Team
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * @return The caller's identity, if the request carried a valid token
     */
    public static Optional<UserIdentity> findCurrentIdentity() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()) {
            Object principal = authentication.getPrincipal();
            if (principal instanceof UserIdentity) {
                return Optional.of((UserIdentity) principal);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The caller's identity
     * @throws UnauthenticatedException if the request is anonymous
     */
    public static UserIdentity currentIdentity() {
        return findCurrentIdentity()
                .orElseThrow(() -> new UnauthenticatedException("Authentication required"));
    }

    /**
     * @return The caller's user ID
     * @throws UnauthenticatedException if the request is anonymous
     */
    public static String getCurrentUserId() {
        return currentIdentity().getUserId();
    }
}
