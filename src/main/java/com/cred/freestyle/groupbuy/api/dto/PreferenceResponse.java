package com.cred.freestyle.groupbuy.api.dto;

import com.cred.freestyle.groupbuy.domain.model.CarPreference;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a member's car preference.
 *
 * @author Group Buy Team
 */
public class PreferenceResponse {

    private String preferenceId;
    private String groupId;
    private String userId;
    private String userName;
    private String carModel;
    private String variant;
    private String transmission;
    private BigDecimal onRoadPrice;
    private Instant createdAt;
    private Instant updatedAt;

    public PreferenceResponse() {
    }

    public static PreferenceResponse fromEntity(CarPreference preference) {
        PreferenceResponse response = new PreferenceResponse();
        response.setPreferenceId(preference.getPreferenceId());
        response.setGroupId(preference.getGroupId());
        response.setUserId(preference.getUserId());
        response.setUserName(preference.getUserName());
        response.setCarModel(preference.getCarModel());
        response.setVariant(preference.getVariant());
        response.setTransmission(preference.getTransmission());
        response.setOnRoadPrice(preference.getOnRoadPrice());
        response.setCreatedAt(preference.getCreatedAt());
        response.setUpdatedAt(preference.getUpdatedAt());
        return response;
    }

    public String getPreferenceId() {
        return preferenceId;
    }

    public void setPreferenceId(String preferenceId) {
        this.preferenceId = preferenceId;
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

    public String getCarModel() {
        return carModel;
    }

    public void setCarModel(String carModel) {
        this.carModel = carModel;
    }

    public String getVariant() {
        return variant;
    }

    public void setVariant(String variant) {
        this.variant = variant;
    }

    public String getTransmission() {
        return transmission;
    }

    public void setTransmission(String transmission) {
        this.transmission = transmission;
    }

    public BigDecimal getOnRoadPrice() {
        return onRoadPrice;
    }

    public void setOnRoadPrice(BigDecimal onRoadPrice) {
        this.onRoadPrice = onRoadPrice;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
