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
 * One-time participation fee recorded for a (user, group) pair.
 * No money actually moves; the record is the precondition for joining the group.
 * Immutable once created.
 *
 * @author Group Buy Team
 */
@Entity
@Table(name = "payments", indexes = {
    @Index(name = "idx_payment_user_group", columnList = "user_id, group_id", unique = true),
    @Index(name = "idx_payment_group", columnList = "group_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @Column(name = "payment_id", nullable = false, length = 36)
    private String paymentId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "group_id", nullable = false, length = 36)
    private String groupId;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    /**
     * Vehicle the user declared when paying. Seeds the car preference on join.
     */
    @Column(name = "car_model", nullable = false, length = 200)
    private String carModel;

    @Column(name = "variant", nullable = false, length = 100)
    private String variant;

    @Column(name = "transmission", nullable = false, length = 50)
    private String transmission;

    @Column(name = "on_road_price", nullable = false, precision = 14, scale = 2)
    private BigDecimal onRoadPrice;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (paymentId == null) {
            paymentId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
    }

    /**
     * @return the vehicle declared with this payment
     */
    public VehicleChoice toVehicleChoice() {
        return new VehicleChoice(carModel, variant, transmission, onRoadPrice);
    }
}
