package com.cred.freestyle.groupbuy.api.dto;

import com.cred.freestyle.groupbuy.domain.model.GroupMember;
import java.time.Instant;

/**
 * Response DTO for a group member.
 *
 * @author Group Buy Team
 */
public class MemberResponse {

    private String memberId;
    private String groupId;
    private String userId;
    private String userName;
    private String userEmail;
    private Instant joinedAt;

    public MemberResponse() {
    }

    public static MemberResponse fromEntity(GroupMember member) {
        MemberResponse response = new MemberResponse();
        response.setMemberId(member.getMemberId());
        response.setGroupId(member.getGroupId());
        response.setUserId(member.getUserId());
        response.setUserName(member.getUserName());
        response.setUserEmail(member.getUserEmail());
        response.setJoinedAt(member.getJoinedAt());
        return response;
    }

    public String getMemberId() {
        return memberId;
    }

    public void setMemberId(String memberId) {
        this.memberId = memberId;
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

    public String getUserName() {
        return userName;
    }

    public void setUserName(String userName) {
        this.userName = userName;
    }

    public String getUserEmail() {
        return userEmail;
    }

    public void setUserEmail(String userEmail) {
        this.userEmail = userEmail;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(Instant joinedAt) {
        this.joinedAt = joinedAt;
    }
}
