package com.cred.freestyle.groupbuy.security;

import com.cred.freestyle.groupbuy.domain.model.User;
import com.cred.freestyle.groupbuy.exception.UnauthenticatedException;
import com.cred.freestyle.groupbuy.repository.UserRepository;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Component;

/**
 * Turns a bearer credential into a UserIdentity and checks admin rights.
 * The user is reloaded on every call, so role changes apply to tokens already issued.
 *
 * @author Group Buy Team
 */
@Component
public class IdentityGate {

    private static final Logger logger = LoggerFactory.getLogger(IdentityGate.class);

    private final JwtTokenService jwtTokenService;
    private final UserRepository userRepository;

    public IdentityGate(JwtTokenService jwtTokenService, UserRepository userRepository) {
        this.jwtTokenService = jwtTokenService;
        this.userRepository = userRepository;
    }

    /**
     * Resolve a bearer credential.
     *
     * @param credential Compact JWT, without the "Bearer " prefix
     * @return Identity of the token's user
     * @throws UnauthenticatedException if the token is missing, invalid, expired or its user is gone
     */
    public UserIdentity resolve(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new UnauthenticatedException("Missing authentication credentials");
        }

        String userId;
        try {
            userId = jwtTokenService.extractUserId(credential);
        } catch (ExpiredJwtException e) {
            throw new UnauthenticatedException("Token has expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthenticatedException("Invalid token", e);
        }

        if (userId == null) {
            throw new UnauthenticatedException("Invalid authentication credentials");
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UnauthenticatedException("User not found"));

        logger.debug("Resolved identity for user: {}", userId);
        return UserIdentity.fromUser(user);
    }

    /**
     * @param identity Resolved identity
     * @return The same identity if it carries the admin flag
     * @throws AccessDeniedException otherwise
     */
    public UserIdentity requireAdmin(UserIdentity identity) {
        if (identity == null || !identity.isAdmin()) {
            throw new AccessDeniedException("Admin access required");
        }
        return identity;
    }
}
