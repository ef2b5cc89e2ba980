package com.cred.freestyle.groupbuy.exception;

/**
 * Exception thrown when a user tries to join a group without having paid its participation fee.
 *
 * @author Group Buy Team
 */
public class PaymentRequiredException extends RuntimeException {

    private final String userId;
    private final String groupId;

    public PaymentRequiredException(String userId, String groupId) {
        super(String.format("Payment required before joining group %s", groupId));
        this.userId = userId;
        this.groupId = groupId;
    }

    public String getUserId() {
        return userId;
    }

    public String getGroupId() {
        return groupId;
    }
}
