package com.cred.freestyle.groupbuy.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Buying group: one cohort of users collectively negotiating a bulk purchase of a car model.
 *
 * Lifecycle (monotonic):
 * - FORMING: accepting members, currentMembers < maxMembers
 * - LOCKED: capacity reached, no more joins, eligible for dealer offers
 * - NEGOTIATION: dealer offers exist, members vote
 * - COMPLETED: a winning offer was selected by an admin
 *
 * currentMembers is a cached count of group_members rows. It is only changed through
 * the conditional updates in BuyingGroupRepository, never by writing this field.
 *
 * @author Group Buy Team
 */
@Entity
@Table(name = "buying_groups", indexes = {
    @Index(name = "idx_group_status", columnList = "status"),
    @Index(name = "idx_group_brand", columnList = "brand"),
    @Index(name = "idx_group_city", columnList = "city")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuyingGroup {

    @Id
    @Column(name = "group_id", nullable = false, length = 36)
    private String groupId;

    @Column(name = "car_model", nullable = false, length = 200)
    private String carModel;

    @Column(name = "brand", nullable = false, length = 100)
    private String brand;

    @Column(name = "city", nullable = false, length = 100)
    private String city;

    @Column(name = "image_url", nullable = false, length = 1000)
    private String imageUrl;

    @Column(name = "max_members", nullable = false)
    private Integer maxMembers;

    @Column(name = "current_members", nullable = false)
    private Integer currentMembers;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private GroupStatus status;

    /**
     * Offer chosen when the group was completed. Null before completion.
     */
    @Column(name = "winning_offer_id", length = 36)
    private String winningOfferId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (groupId == null) {
            groupId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;

        if (currentMembers == null) currentMembers = 0;
        if (status == null) status = GroupStatus.FORMING;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * @return true if no slot is left
     */
    @JsonIgnore
    public boolean isFull() {
        return currentMembers != null && maxMembers != null && currentMembers >= maxMembers;
    }

    /**
     * @return true if the group still accepts members
     */
    @JsonIgnore
    public boolean isAcceptingMembers() {
        return status == GroupStatus.FORMING && !isFull();
    }

    @JsonIgnore
    public int getRemainingSlots() {
        if (currentMembers == null || maxMembers == null) {
            return 0;
        }
        return Math.max(0, maxMembers - currentMembers);
    }

    /**
     * Group status enum. Declaration order is the lifecycle order.
     */
    public enum GroupStatus {
        FORMING,
        LOCKED,
        NEGOTIATION,
        COMPLETED;

        /**
         * @return true if this status is the given one or comes after it
         */
        public boolean isAtLeast(GroupStatus other) {
            return this.ordinal() >= other.ordinal();
        }
    }
}
