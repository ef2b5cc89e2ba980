package com.cred.freestyle.groupbuy.api.dto;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import java.time.Instant;

/**
 * Response DTO for a buying group.
 *
 * @author Group Buy Team
 */
public class GroupResponse {

    private String groupId;
    private String carModel;
    private String brand;
    private String city;
    private String imageUrl;
    private Integer maxMembers;
    private Integer currentMembers;
    private Integer remainingSlots;
    private String status;
    private String winningOfferId;
    private Instant createdAt;

    public GroupResponse() {
    }

    /**
     * Create response from BuyingGroup entity.
     *
     * @param group BuyingGroup entity
     * @return GroupResponse
     */
    public static GroupResponse fromEntity(BuyingGroup group) {
        GroupResponse response = new GroupResponse();
        response.setGroupId(group.getGroupId());
        response.setCarModel(group.getCarModel());
        response.setBrand(group.getBrand());
        response.setCity(group.getCity());
        response.setImageUrl(group.getImageUrl());
        response.setMaxMembers(group.getMaxMembers());
        response.setCurrentMembers(group.getCurrentMembers());
        response.setRemainingSlots(group.getRemainingSlots());
        response.setStatus(group.getStatus().name());
        response.setWinningOfferId(group.getWinningOfferId());
        response.setCreatedAt(group.getCreatedAt());
        return response;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getCarModel() {
        return carModel;
    }

    public void setCarModel(String carModel) {
        this.carModel = carModel;
    }

    public String getBrand() {
        return brand;
    }

    public void setBrand(String brand) {
        this.brand = brand;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public Integer getMaxMembers() {
        return maxMembers;
    }

    public void setMaxMembers(Integer maxMembers) {
        this.maxMembers = maxMembers;
    }

    public Integer getCurrentMembers() {
        return currentMembers;
    }

    public void setCurrentMembers(Integer currentMembers) {
        this.currentMembers = currentMembers;
    }

    public Integer getRemainingSlots() {
        return remainingSlots;
    }

    public void setRemainingSlots(Integer remainingSlots) {
        this.remainingSlots = remainingSlots;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getWinningOfferId() {
        return winningOfferId;
    }

    public void setWinningOfferId(String winningOfferId) {
        this.winningOfferId = winningOfferId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
