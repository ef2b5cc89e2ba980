package com.cred.freestyle.groupbuy.security;

import com.cred.freestyle.groupbuy.domain.model.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Issues and verifies HS256 access tokens.
 *
 * Claims:
 * - sub: user ID
 * - email: user email
 * - iat / exp
 *
 * @author Group Buy Team
 */
@Service
public class JwtTokenService {

    private final SecretKey secretKey;
    private final long accessTokenExpiration;

    public JwtTokenService(
            @Value("${jwt.secret}") String jwtSecret,
            @Value("${jwt.access-token-expiration:604800000}") long accessTokenExpiration
    ) {
        // HS256 needs a key of at least 32 bytes; hmacShaKeyFor rejects shorter secrets
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        this.accessTokenExpiration = accessTokenExpiration;
    }

    /**
     * Generate an access token for a user.
     *
     * @param user Authenticated user
     * @return Signed compact JWT
     */
    public String generateAccessToken(User user) {
        Date now = new Date();
        Date expiration = new Date(now.getTime() + accessTokenExpiration);

        return Jwts.builder()
                .subject(user.getUserId())
                .claim("email", user.getEmail())
                .issuedAt(now)
                .expiration(expiration)
                .signWith(secretKey)
                .compact();
    }

    /**
     * Verify signature and expiry and return the user ID the token was issued to.
     *
     * @param token Compact JWT
     * @return Subject (user ID)
     * @throws ExpiredJwtException if the token has expired
     * @throws JwtException if the token is malformed or the signature does not match
     */
    public String extractUserId(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
        return claims.getSubject();
    }

    public long getAccessTokenExpiration() {
        return accessTokenExpiration;
    }
}
