package com.cred.freestyle.groupbuy.exception;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;

/**
 * Exception thrown when an operation is not allowed in the group's current lifecycle status.
 *
 * @author Group Buy Team
 */
public class InvalidGroupStateException extends RuntimeException {

    private final String groupId;
    private final GroupStatus currentStatus;

    public InvalidGroupStateException(String groupId, GroupStatus currentStatus, String message) {
        super(message);
        this.groupId = groupId;
        this.currentStatus = currentStatus;
    }

    public String getGroupId() {
        return groupId;
    }

    public GroupStatus getCurrentStatus() {
        return currentStatus;
    }
}
