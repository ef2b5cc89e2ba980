package com.cred.freestyle.groupbuy.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A member's current choice among the dealer offers of a group.
 * At most one vote per (user, group); switching offers repoints this row.
 *
 * @author Group Buy Team
 */
@Entity
@Table(name = "votes", indexes = {
    @Index(name = "idx_vote_user_group", columnList = "user_id, group_id", unique = true),
    @Index(name = "idx_vote_group", columnList = "group_id"),
    @Index(name = "idx_vote_offer", columnList = "offer_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vote {

    @Id
    @Column(name = "vote_id", nullable = false, length = 36)
    private String voteId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "group_id", nullable = false, length = 36)
    private String groupId;

    @Column(name = "offer_id", nullable = false, length = 36)
    private String offerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (voteId == null) {
            voteId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Point this vote at another offer of the same group.
     */
    public void switchTo(String newOfferId) {
        this.offerId = newOfferId;
    }
}
