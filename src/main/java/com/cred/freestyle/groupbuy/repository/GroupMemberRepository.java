package com.cred.freestyle.groupbuy.repository;

import com.cred.freestyle.groupbuy.domain.model.GroupMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for GroupMember entity.
 *
 * @author Group Buy Team
 */
@Repository
public interface GroupMemberRepository extends JpaRepository<GroupMember, String> {

    List<GroupMember> findByGroupId(String groupId);

    boolean existsByGroupIdAndUserId(String groupId, String userId);

    long countByGroupId(String groupId);

    /**
     * Find membership with pessimistic write lock.
     * Serializes concurrent preference saves by the same member.
     *
     * @param groupId Group ID
     * @param userId User ID
     * @return Optional containing the membership if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM GroupMember m WHERE m.groupId = :groupId AND m.userId = :userId")
    Optional<GroupMember> findByGroupIdAndUserIdWithLock(
            @Param("groupId") String groupId,
            @Param("userId") String userId
    );
}
