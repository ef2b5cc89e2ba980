package com.cred.freestyle.groupbuy.security;

import com.cred.freestyle.groupbuy.domain.model.User;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Authenticated caller as seen by the core services: id, display fields and role flags.
 * Set as the principal of the Spring Security Authentication.
 *
 * @author Group Buy Team
 */
public final class UserIdentity {

    public static final String ROLE_USER = "ROLE_USER";
    public static final String ROLE_ADMIN = "ROLE_ADMIN";

    private final String userId;
    private final String name;
    private final String email;
    private final boolean premium;
    private final boolean admin;

    public UserIdentity(String userId, String name, String email, boolean premium, boolean admin) {
        this.userId = userId;
        this.name = name;
        this.email = email;
        this.premium = premium;
        this.admin = admin;
    }

    public static UserIdentity fromUser(User user) {
        return new UserIdentity(
                user.getUserId(),
                user.getName(),
                user.getEmail(),
                Boolean.TRUE.equals(user.getPremium()),
                Boolean.TRUE.equals(user.getAdmin())
        );
    }

    public List<GrantedAuthority> getAuthorities() {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority(ROLE_USER));
        if (admin) {
            authorities.add(new SimpleGrantedAuthority(ROLE_ADMIN));
        }
        return Collections.unmodifiableList(authorities);
    }

    public String getUserId() {
        return userId;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public boolean isPremium() {
        return premium;
    }

    public boolean isAdmin() {
        return admin;
    }

    @Override
    public String toString() {
        return "UserIdentity{userId='" + userId + "', admin=" + admin + '}';
    }
}
