package com.cred.freestyle.groupbuy.service;

import com.cred.freestyle.groupbuy.domain.model.User;

/**
 * A user together with a freshly issued access token.
 *
 * @author Group Buy Team
 */
public class AuthResult {

    private final User user;
    private final String token;

    public AuthResult(User user, String token) {
        this.user = user;
        this.token = token;
    }

    public User getUser() {
        return user;
    }

    public String getToken() {
        return token;
    }
}
