package com.cred.freestyle.groupbuy.service;

import com.cred.freestyle.groupbuy.domain.model.User;
import com.cred.freestyle.groupbuy.exception.EmailAlreadyRegisteredException;
import com.cred.freestyle.groupbuy.exception.ResourceNotFoundException;
import com.cred.freestyle.groupbuy.exception.UnauthenticatedException;
import com.cred.freestyle.groupbuy.repository.UserRepository;
import com.cred.freestyle.groupbuy.security.JwtTokenService;
import com.cred.freestyle.groupbuy.security.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registration, login and role management.
 *
 * Emails are stored trimmed and lower-cased, so lookups are case-insensitive.
 *
 * @author Group Buy Team
 */
@Service
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Set<String> bootstrapAdminEmails;

    public AuthService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            @Value("${groupbuy.security.bootstrap-admin-emails:}") String bootstrapAdminEmails
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.bootstrapAdminEmails = bootstrapAdminEmails == null
                ? Set.of()
                : Arrays.stream(bootstrapAdminEmails.split(","))
                        .map(AuthService::normalizeEmail)
                        .filter(email -> !email.isEmpty())
                        .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Register a new user and issue a token.
     *
     * @throws EmailAlreadyRegisteredException if the email is taken
     */
    @Transactional
    public AuthResult register(String name, String email, String password) {
        String normalizedEmail = normalizeEmail(email);

        if (userRepository.existsByEmail(normalizedEmail)) {
            logger.warn("Registration rejected, email already registered: {}", normalizedEmail);
            throw new EmailAlreadyRegisteredException(normalizedEmail);
        }

        User user = User.builder()
                .name(name.trim())
                .email(normalizedEmail)
                .passwordHash(passwordEncoder.encode(password))
                .premium(false)
                .admin(bootstrapAdminEmails.contains(normalizedEmail))
                .build();

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw new EmailAlreadyRegisteredException(normalizedEmail);
        }

        logger.info("User registered: userId={}, admin={}", user.getUserId(), user.isAdminUser());
        return new AuthResult(user, jwtTokenService.generateAccessToken(user));
    }

    /**
     * Check credentials and issue a token.
     *
     * @throws UnauthenticatedException if the email is unknown or the password does not match
     */
    @Transactional(readOnly = true)
    public AuthResult authenticate(String email, String password) {
        User user = userRepository.findByEmail(normalizeEmail(email))
                .orElseThrow(() -> new UnauthenticatedException("Invalid email or password"));

        if (password == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
            logger.warn("Login failed for userId={}", user.getUserId());
            throw new UnauthenticatedException("Invalid email or password");
        }

        logger.info("User logged in: userId={}", user.getUserId());
        return new AuthResult(user, jwtTokenService.generateAccessToken(user));
    }

    @Transactional(readOnly = true)
    public User getUser(String userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    /**
     * Set role flags of a user. Null leaves a flag unchanged.
     *
     * @param userId Target user
     * @param premium New premium flag or null
     * @param admin New admin flag or null
     * @param actor Admin performing the change
     * @return Updated user
     */
    @Transactional
    public User updateRoles(String userId, Boolean premium, Boolean admin, UserIdentity actor) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));

        if (premium != null) {
            user.setPremium(premium);
        }
        if (admin != null) {
            user.setAdmin(admin);
        }

        User saved = userRepository.save(user);
        logger.info("Roles updated: userId={}, premium={}, admin={}, by={}",
                userId, saved.getPremium(), saved.getAdmin(), actor.getUserId());
        return saved;
    }

    static String normalizeEmail(String email) {
        if (email == null) {
            throw new IllegalArgumentException("email is required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
