package com.cred.freestyle.groupbuy.repository;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for BuyingGroup entity.
 * Member counter and status changes go through the conditional updates below so that
 * concurrent joins can never push currentMembers past maxMembers.
 *
 * @author Group Buy Team
 */
@Repository
public interface BuyingGroupRepository extends JpaRepository<BuyingGroup, String> {

    /**
     * Find group by ID with pessimistic write lock.
     * Serializes every multi-step mutation of one group (join, vote, offer creation, completion).
     *
     * @param groupId Group ID
     * @return Optional containing the group if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM BuyingGroup g WHERE g.groupId = :groupId")
    Optional<BuyingGroup> findByIdWithLock(@Param("groupId") String groupId);

    /**
     * Filtered listing. Null brand or city means "any"; a null pattern disables the free-text match.
     * The pattern must already be lower-cased, escaped with '\' and wrapped in '%'.
     *
     * @param brand Exact brand or null
     * @param city Exact city or null
     * @param pattern LIKE pattern or null
     * @param pageable Result cap
     * @return Matching groups
     */
    @Query("SELECT g FROM BuyingGroup g WHERE " +
           "(:brand IS NULL OR g.brand = :brand) AND " +
           "(:city IS NULL OR g.city = :city) AND " +
           "(:pattern IS NULL OR " +
           "  LOWER(g.carModel) LIKE :pattern ESCAPE '\\' OR " +
           "  LOWER(g.brand) LIKE :pattern ESCAPE '\\' OR " +
           "  LOWER(g.city) LIKE :pattern ESCAPE '\\')")
    List<BuyingGroup> search(
            @Param("brand") String brand,
            @Param("city") String city,
            @Param("pattern") String pattern,
            Pageable pageable
    );

    /**
     * Find all groups in a given status.
     *
     * @param status Group status
     * @return List of groups
     */
    List<BuyingGroup> findByStatus(GroupStatus status);

    /**
     * Atomically add one member while the group is still forming and has a free slot.
     *
     * @param groupId Group ID
     * @param forming Status the group must have (FORMING)
     * @return Number of rows updated (0 if full or no longer forming)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BuyingGroup g SET " +
           "g.currentMembers = g.currentMembers + 1, " +
           "g.updatedAt = CURRENT_INSTANT " +
           "WHERE g.groupId = :groupId " +
           "AND g.currentMembers < g.maxMembers " +
           "AND g.status = :forming")
    int incrementMemberCount(@Param("groupId") String groupId, @Param("forming") GroupStatus forming);

    /**
     * Lock the group once its counter has reached capacity.
     *
     * @param groupId Group ID
     * @param forming Current status (FORMING)
     * @param locked Target status (LOCKED)
     * @return 1 if the group was locked by this call, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BuyingGroup g SET g.status = :locked, g.updatedAt = CURRENT_INSTANT " +
           "WHERE g.groupId = :groupId AND g.status = :forming AND g.currentMembers >= g.maxMembers")
    int lockIfFull(
            @Param("groupId") String groupId,
            @Param("forming") GroupStatus forming,
            @Param("locked") GroupStatus locked
    );

    /**
     * Atomically move a group from one status to the next.
     *
     * @param groupId Group ID
     * @param expected Status the group must currently have
     * @param target New status
     * @return Number of rows updated (0 if the group was not in the expected status)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BuyingGroup g SET g.status = :target, g.updatedAt = CURRENT_INSTANT " +
           "WHERE g.groupId = :groupId AND g.status = :expected")
    int transitionStatus(
            @Param("groupId") String groupId,
            @Param("expected") GroupStatus expected,
            @Param("target") GroupStatus target
    );

    /**
     * Atomically complete a negotiating group with its winning offer.
     *
     * @param groupId Group ID
     * @param winningOfferId Winning offer ID
     * @param negotiation Status the group must have (NEGOTIATION)
     * @param completed Target status (COMPLETED)
     * @return Number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BuyingGroup g SET g.status = :completed, g.winningOfferId = :winningOfferId, " +
           "g.updatedAt = CURRENT_INSTANT " +
           "WHERE g.groupId = :groupId AND g.status = :negotiation")
    int completeWithWinner(
            @Param("groupId") String groupId,
            @Param("winningOfferId") String winningOfferId,
            @Param("negotiation") GroupStatus negotiation,
            @Param("completed") GroupStatus completed
    );
}
