package com.cred.freestyle.groupbuy.infrastructure.messaging.events;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;

import java.time.Instant;

/**
 * Event representing a buying group lifecycle change.
 * Raised inside the mutating transaction and relayed to Kafka after commit.
 *
 * Event Types:
 * - MEMBER_JOINED: a paid user took a slot
 * - GROUP_LOCKED: the last slot was taken
 * - OFFERS_CREATED: dealer offers were submitted, group is negotiating
 * - VOTE_CAST: a member voted or switched vote
 * - GROUP_COMPLETED: a winning offer was selected
 *
 * @author Group Buy Team
 */
public class GroupEvent {

    private String groupId;
    private String userId;
    private String offerId;
    private EventType eventType;
    private GroupStatus groupStatus;
    private Integer memberCount;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public GroupEvent() {
    }

    public GroupEvent(
            String groupId,
            String userId,
            String offerId,
            EventType eventType,
            GroupStatus groupStatus,
            Integer memberCount
    ) {
        this.groupId = groupId;
        this.userId = userId;
        this.offerId = offerId;
        this.eventType = eventType;
        this.groupStatus = groupStatus;
        this.memberCount = memberCount;
        this.timestamp = Instant.now();
    }

    public static GroupEvent memberJoined(String groupId, String userId, GroupStatus status, Integer memberCount) {
        return new GroupEvent(groupId, userId, null, EventType.MEMBER_JOINED, status, memberCount);
    }

    public static GroupEvent groupLocked(String groupId, Integer memberCount) {
        return new GroupEvent(groupId, null, null, EventType.GROUP_LOCKED, GroupStatus.LOCKED, memberCount);
    }

    public static GroupEvent offersCreated(String groupId, String adminId) {
        return new GroupEvent(groupId, adminId, null, EventType.OFFERS_CREATED, GroupStatus.NEGOTIATION, null);
    }

    public static GroupEvent voteCast(String groupId, String userId, String offerId) {
        return new GroupEvent(groupId, userId, offerId, EventType.VOTE_CAST, GroupStatus.NEGOTIATION, null);
    }

    public static GroupEvent groupCompleted(String groupId, String adminId, String winningOfferId) {
        return new GroupEvent(groupId, adminId, winningOfferId, EventType.GROUP_COMPLETED,
                GroupStatus.COMPLETED, null);
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getOfferId() {
        return offerId;
    }

    public void setOfferId(String offerId) {
        this.offerId = offerId;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public GroupStatus getGroupStatus() {
        return groupStatus;
    }

    public void setGroupStatus(GroupStatus groupStatus) {
        this.groupStatus = groupStatus;
    }

    public Integer getMemberCount() {
        return memberCount;
    }

    public void setMemberCount(Integer memberCount) {
        this.memberCount = memberCount;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * Event type enum.
     */
    public enum EventType {
        MEMBER_JOINED,
        GROUP_LOCKED,
        OFFERS_CREATED,
        VOTE_CAST,
        GROUP_COMPLETED
    }

    @Override
    public String toString() {
        return "GroupEvent{" +
                "groupId='" + groupId + '\'' +
                ", userId='" + userId + '\'' +
                ", offerId='" + offerId + '\'' +
                ", eventType=" + eventType +
                ", groupStatus=" + groupStatus +
                ", memberCount=" + memberCount +
                ", timestamp=" + timestamp +
                '}';
    }
}
