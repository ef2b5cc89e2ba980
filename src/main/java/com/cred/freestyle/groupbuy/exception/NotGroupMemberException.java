package com.cred.freestyle.groupbuy.exception;

/**
 * Exception thrown when a member-only operation is attempted by a non-member.
 *
 * @author Group Buy Team
 */
public class NotGroupMemberException extends RuntimeException {

    private final String userId;
    private final String groupId;

    public NotGroupMemberException(String userId, String groupId) {
        super(String.format("User %s is not a member of group %s", userId, groupId));
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
