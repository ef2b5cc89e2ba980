package com.cred.freestyle.groupbuy.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's confirmed, fee-paid slot in a buying group.
 * User display fields are copied at join time.
 * The unique (group_id, user_id) index guarantees one membership per user per group.
 *
 * @author Group Buy Team
 */
@Entity
@Table(name = "group_members", indexes = {
    @Index(name = "idx_member_group_user", columnList = "group_id, user_id", unique = true),
    @Index(name = "idx_member_user", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupMember {

    @Id
    @Column(name = "member_id", nullable = false, length = 36)
    private String memberId;

    @Column(name = "group_id", nullable = false, length = 36)
    private String groupId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "user_name", nullable = false, length = 200)
    private String userName;

    @Column(name = "user_email", nullable = false, length = 255)
    private String userEmail;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private Instant joinedAt;

    @PrePersist
    protected void onCreate() {
        if (memberId == null) {
            memberId = UUID.randomUUID().toString();
        }
        joinedAt = Instant.now();
    }
}
