package com.cred.freestyle.groupbuy.repository;

import com.cred.freestyle.groupbuy.domain.model.Vote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Vote entity.
 *
 * @author Group Buy Team
 */
@Repository
public interface VoteRepository extends JpaRepository<Vote, String> {

    Optional<Vote> findByUserIdAndGroupId(String userId, String groupId);

    long countByGroupId(String groupId);

    long countByOfferId(String offerId);
}
