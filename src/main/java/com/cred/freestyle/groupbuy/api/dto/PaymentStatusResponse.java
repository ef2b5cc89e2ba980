package com.cred.freestyle.groupbuy.api.dto;

/**
 * Response DTO for the payment check of a group.
 *
 * @author Group Buy Team
 */
public class PaymentStatusResponse {

    private String groupId;
    private boolean hasPaid;

    public PaymentStatusResponse() {
    }

    public PaymentStatusResponse(String groupId, boolean hasPaid) {
        this.groupId = groupId;
        this.hasPaid = hasPaid;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public boolean isHasPaid() {
        return hasPaid;
    }

    public void setHasPaid(boolean hasPaid) {
        this.hasPaid = hasPaid;
    }
}
