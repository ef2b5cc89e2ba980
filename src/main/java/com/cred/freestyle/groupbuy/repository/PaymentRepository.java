package com.cred.freestyle.groupbuy.repository;

import com.cred.freestyle.groupbuy.domain.model.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Payment entity.
 *
 * @author Group Buy Team
 */
@Repository
public interface PaymentRepository extends JpaRepository<Payment, String> {

    Optional<Payment> findByUserIdAndGroupId(String userId, String groupId);

    boolean existsByUserIdAndGroupId(String userId, String groupId);
}
