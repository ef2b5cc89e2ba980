package com.cred.freestyle.groupbuy.repository;

import com.cred.freestyle.groupbuy.domain.model.DealerOffer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for DealerOffer entity.
 * Vote tallies are only changed through the atomic updates below.
 *
 * @author Group Buy Team
 */
@Repository
public interface DealerOfferRepository extends JpaRepository<DealerOffer, String> {

    List<DealerOffer> findByGroupId(String groupId);

    boolean existsByOfferIdAndGroupId(String offerId, String groupId);

    /**
     * Atomically add one vote to an offer.
     *
     * @param offerId Offer ID
     * @return Number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DealerOffer o SET o.votes = o.votes + 1 WHERE o.offerId = :offerId")
    int incrementVotes(@Param("offerId") String offerId);

    /**
     * Atomically remove one vote from an offer. Never drops below zero.
     *
     * @param offerId Offer ID
     * @return Number of rows updated (0 if the tally was already zero)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DealerOffer o SET o.votes = o.votes - 1 WHERE o.offerId = :offerId AND o.votes > 0")
    int decrementVotes(@Param("offerId") String offerId);

    /**
     * Sum of all tallies for a group.
     *
     * @param groupId Group ID
     * @return Sum of votes (0 when the group has no offers)
     */
    @Query("SELECT COALESCE(SUM(o.votes), 0) FROM DealerOffer o WHERE o.groupId = :groupId")
    long sumVotesByGroupId(@Param("groupId") String groupId);
}
