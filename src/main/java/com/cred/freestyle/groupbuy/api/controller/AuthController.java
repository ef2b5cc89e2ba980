package com.cred.freestyle.groupbuy.api.controller;

import com.cred.freestyle.groupbuy.api.dto.AuthResponse;
import com.cred.freestyle.groupbuy.api.dto.LoginRequest;
import com.cred.freestyle.groupbuy.api.dto.RegisterRequest;
import com.cred.freestyle.groupbuy.api.dto.UserResponse;
import com.cred.freestyle.groupbuy.security.JwtTokenService;
import com.cred.freestyle.groupbuy.security.SecurityUtils;
import com.cred.freestyle.groupbuy.service.AuthResult;
import com.cred.freestyle.groupbuy.service.AuthService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for registration, login and the current user.
 *
 * @author Group Buy Team
 */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AuthService authService;
    private final JwtTokenService jwtTokenService;

    public AuthController(AuthService authService, JwtTokenService jwtTokenService) {
        this.authService = authService;
        this.jwtTokenService = jwtTokenService;
    }

    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        AuthResult result = authService.register(request.getName(), request.getEmail(), request.getPassword());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(result));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        AuthResult result = authService.authenticate(request.getEmail(), request.getPassword());
        return ResponseEntity.ok(toResponse(result));
    }

    /**
     * Profile of the authenticated user, read fresh from the store.
     */
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me() {
        return ResponseEntity.ok(UserResponse.fromEntity(authService.getUser(SecurityUtils.getCurrentUserId())));
    }

    private AuthResponse toResponse(AuthResult result) {
        return new AuthResponse(
                result.getToken(),
                jwtTokenService.getAccessTokenExpiration() / 1000,
                UserResponse.fromEntity(result.getUser())
        );
    }
}
