package com.cred.freestyle.groupbuy.security;

import com.cred.freestyle.groupbuy.exception.UnauthenticatedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Reads "Authorization: Bearer <jwt>", resolves it through IdentityGate and stores the
 * resulting UserIdentity in the SecurityContext.
 *
 * A bad token does not end the request here: public routes stay reachable and protected
 * routes are rejected by RestAuthenticationEntryPoint, which reports the stored reason.
 *
 * @author Group Buy Team
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Request attribute carrying the reason a presented credential was rejected.
     */
    public static final String AUTH_ERROR_ATTRIBUTE = "groupbuy.authError";

    private final IdentityGate identityGate;

    public JwtAuthenticationFilter(IdentityGate identityGate) {
        this.identityGate = identityGate;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        String authHeader = request.getHeader(AUTHORIZATION_HEADER);

        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).trim();
            try {
                UserIdentity identity = identityGate.resolve(token);

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(identity, null, identity.getAuthorities());
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));

                SecurityContextHolder.getContext().setAuthentication(authentication);
                logger.debug("Authenticated user: {} (admin: {})", identity.getUserId(), identity.isAdmin());
            } catch (UnauthenticatedException e) {
                logger.debug("Rejected bearer credential: {}", e.getMessage());
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, e.getMessage());
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }
}
