package com.cred.freestyle.groupbuy.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for completing a negotiating group with its winning offer.
 *
 * @author Group Buy Team
 */
public class CompleteGroupRequest {

    @NotBlank(message = "Winning offer ID is required")
    private String winningOfferId;

    public CompleteGroupRequest() {
    }

    public CompleteGroupRequest(String winningOfferId) {
        this.winningOfferId = winningOfferId;
    }

    public String getWinningOfferId() {
        return winningOfferId;
    }

    public void setWinningOfferId(String winningOfferId) {
        this.winningOfferId = winningOfferId;
    }
}
