package com.cred.freestyle.groupbuy.repository;

import com.cred.freestyle.groupbuy.domain.model.CarPreference;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for CarPreference entity.
 *
 * @author Group Buy Team
 */
@Repository
public interface CarPreferenceRepository extends JpaRepository<CarPreference, String> {

    List<CarPreference> findByGroupId(String groupId);

    Optional<CarPreference> findByUserIdAndGroupId(String userId, String groupId);
}
