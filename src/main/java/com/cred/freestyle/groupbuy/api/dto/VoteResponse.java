package com.cred.freestyle.groupbuy.api.dto;

import com.cred.freestyle.groupbuy.service.VoteResult;

/**
 * Response DTO for a vote.
 *
 * @author Group Buy Team
 */
public class VoteResponse {

    private String offerId;
    private String groupId;
    private String previousOfferId;
    private Integer votes;
    private String message;

    public VoteResponse() {
    }

    public static VoteResponse fromResult(VoteResult result) {
        VoteResponse response = new VoteResponse();
        response.setOfferId(result.getOffer().getOfferId());
        response.setGroupId(result.getOffer().getGroupId());
        response.setPreviousOfferId(result.getPreviousOfferId());
        response.setVotes(result.getOffer().getVotes());
        response.setMessage(result.isChanged() ? "Vote recorded successfully" : "Vote unchanged");
        return response;
    }

    public String getOfferId() {
        return offerId;
    }

    public void setOfferId(String offerId) {
        this.offerId = offerId;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getPreviousOfferId() {
        return previousOfferId;
    }

    public void setPreviousOfferId(String previousOfferId) {
        this.previousOfferId = previousOfferId;
    }

    public Integer getVotes() {
        return votes;
    }

    public void setVotes(Integer votes) {
        this.votes = votes;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
