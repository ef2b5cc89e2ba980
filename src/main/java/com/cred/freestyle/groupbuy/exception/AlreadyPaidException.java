package com.cred.freestyle.groupbuy.exception;

/**
 * Exception thrown when a user pays the participation fee of the same group twice.
 *
 * @author Group Buy Team
 */
public class AlreadyPaidException extends RuntimeException {

    private final String userId;
    private final String groupId;

    public AlreadyPaidException(String userId, String groupId) {
        super(String.format("Participation fee for group %s has already been paid", groupId));
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
