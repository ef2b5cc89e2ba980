package com.cred.freestyle.groupbuy.exception;

/**
 * Exception thrown when a group has no free slot left or has stopped accepting members.
 *
 * @author Group Buy Team
 */
public class GroupFullException extends RuntimeException {

    private final String groupId;
    private final Integer maxMembers;

    public GroupFullException(String groupId, Integer maxMembers) {
        super(String.format("Group %s is full (capacity %d)", groupId, maxMembers));
        this.groupId = groupId;
        this.maxMembers = maxMembers;
    }

    public String getGroupId() {
        return groupId;
    }

    public Integer getMaxMembers() {
        return maxMembers;
    }
}
