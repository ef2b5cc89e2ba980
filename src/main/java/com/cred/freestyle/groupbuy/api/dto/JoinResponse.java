package com.cred.freestyle.groupbuy.api.dto;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;

/**
 * Response DTO for a successful join.
 *
 * @author Group Buy Team
 */
public class JoinResponse {

    private String groupId;
    private Integer currentMembers;
    private Integer maxMembers;
    private String status;
    private String message;

    public JoinResponse() {
    }

    public static JoinResponse fromEntity(BuyingGroup group) {
        JoinResponse response = new JoinResponse();
        response.setGroupId(group.getGroupId());
        response.setCurrentMembers(group.getCurrentMembers());
        response.setMaxMembers(group.getMaxMembers());
        response.setStatus(group.getStatus().name());
        response.setMessage("Successfully joined group");
        return response;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public Integer getCurrentMembers() {
        return currentMembers;
    }

    public void setCurrentMembers(Integer currentMembers) {
        this.currentMembers = currentMembers;
    }

    public Integer getMaxMembers() {
        return maxMembers;
    }

    public void setMaxMembers(Integer maxMembers) {
        this.maxMembers = maxMembers;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
