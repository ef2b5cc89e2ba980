package com.cred.freestyle.groupbuy.api.dto;

/**
 * Request DTO for changing a user's role flags. A null flag is left unchanged.
 *
 * @author Group Buy Team
 */
public class RoleUpdateRequest {

    private Boolean premium;
    private Boolean admin;

    public RoleUpdateRequest() {
    }

    public RoleUpdateRequest(Boolean premium, Boolean admin) {
        this.premium = premium;
        this.admin = admin;
    }

    public Boolean getPremium() {
        return premium;
    }

    public void setPremium(Boolean premium) {
        this.premium = premium;
    }

    public Boolean getAdmin() {
        return admin;
    }

    public void setAdmin(Boolean admin) {
        this.admin = admin;
    }
}
