package com.cred.freestyle.groupbuy.exception;

/**
 * Exception thrown when a user tries to join a group they already belong to.
 *
 * @author Group Buy Team
 */
public class AlreadyMemberException extends RuntimeException {

    private final String userId;
    private final String groupId;

    public AlreadyMemberException(String userId, String groupId) {
        super(String.format("User %s is already a member of group %s", userId, groupId));
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
