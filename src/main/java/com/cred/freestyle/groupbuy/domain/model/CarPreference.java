package com.cred.freestyle.groupbuy.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A member's vehicle configuration choice within a group.
 * One live record per (user, group); a second save updates the record in place.
 *
 * @author Group Buy Team
 */
@Entity
@Table(name = "car_preferences", indexes = {
    @Index(name = "idx_preference_user_group", columnList = "user_id, group_id", unique = true),
    @Index(name = "idx_preference_group", columnList = "group_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CarPreference {

    @Id
    @Column(name = "preference_id", nullable = false, length = 36)
    private String preferenceId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "group_id", nullable = false, length = 36)
    private String groupId;

    @Column(name = "user_name", nullable = false, length = 200)
    private String userName;

    @Column(name = "car_model", nullable = false, length = 200)
    private String carModel;

    @Column(name = "variant", nullable = false, length = 100)
    private String variant;

    @Column(name = "transmission", length = 50)
    private String transmission;

    @Column(name = "on_road_price", precision = 14, scale = 2)
    private BigDecimal onRoadPrice;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (preferenceId == null) {
            preferenceId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Replace the mutable vehicle fields with the given choice.
     */
    public void applyChoice(VehicleChoice choice) {
        this.carModel = choice.getCarModel();
        this.variant = choice.getVariant();
        this.transmission = choice.getTransmission();
        this.onRoadPrice = choice.getOnRoadPrice();
    }
}
