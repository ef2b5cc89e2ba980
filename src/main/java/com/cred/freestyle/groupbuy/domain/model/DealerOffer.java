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
 * Dealer offer submitted by an admin for a locked group.
 * votes is the running tally of members currently pointing at this offer; it is only
 * changed through the conditional updates in DealerOfferRepository.
 *
 * @author Group Buy Team
 */
@Entity
@Table(name = "dealer_offers", indexes = {
    @Index(name = "idx_offer_group", columnList = "group_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DealerOffer {

    @Id
    @Column(name = "offer_id", nullable = false, length = 36)
    private String offerId;

    @Column(name = "group_id", nullable = false, length = 36)
    private String groupId;

    @Column(name = "dealer_name", nullable = false, length = 200)
    private String dealerName;

    @Column(name = "price", nullable = false, precision = 14, scale = 2)
    private BigDecimal price;

    @Column(name = "delivery_time", nullable = false, length = 100)
    private String deliveryTime;

    @Column(name = "bonus_items", length = 1000)
    private String bonusItems;

    @Column(name = "votes", nullable = false)
    private Integer votes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (offerId == null) {
            offerId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        if (votes == null) votes = 0;
    }
}
