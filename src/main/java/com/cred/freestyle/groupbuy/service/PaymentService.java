package com.cred.freestyle.groupbuy.service;

import com.cred.freestyle.groupbuy.domain.model.Payment;
import com.cred.freestyle.groupbuy.domain.model.VehicleChoice;
import com.cred.freestyle.groupbuy.exception.AlreadyPaidException;
import com.cred.freestyle.groupbuy.exception.ResourceNotFoundException;
import com.cred.freestyle.groupbuy.infrastructure.metrics.GroupBuyMetricsService;
import com.cred.freestyle.groupbuy.repository.BuyingGroupRepository;
import com.cred.freestyle.groupbuy.repository.PaymentRepository;
import com.cred.freestyle.groupbuy.security.UserIdentity;
import com.cred.freestyle.groupbuy.service.fee.FeeSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Records participation fee payments.
 *
 * A payment is the entry ticket to a group: at most one per (user, group),
 * and it carries the vehicle configuration the user picked at checkout.
 * Payment is allowed whatever the group status; joining is what checks capacity.
 *
 * @author Group Buy Team
 */
@Service
public class PaymentService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentService.class);

    private final PaymentRepository paymentRepository;
    private final BuyingGroupRepository groupRepository;
    private final FeeSchedule feeSchedule;
    private final GroupBuyMetricsService metricsService;

    public PaymentService(
            PaymentRepository paymentRepository,
            BuyingGroupRepository groupRepository,
            FeeSchedule feeSchedule,
            GroupBuyMetricsService metricsService
    ) {
        this.paymentRepository = paymentRepository;
        this.groupRepository = groupRepository;
        this.feeSchedule = feeSchedule;
        this.metricsService = metricsService;
    }

    /**
     * Charge the participation fee for a group.
     *
     * @param groupId Group ID
     * @param payer Authenticated user
     * @param choice Vehicle configuration picked at checkout
     * @return Stored payment
     * @throws ResourceNotFoundException if the group does not exist
     * @throws AlreadyPaidException if the user already paid for this group
     */
    @Transactional
    public Payment pay(String groupId, UserIdentity payer, VehicleChoice choice) {
        String userId = payer.getUserId();
        logger.info("Processing payment: userId={}, groupId={}, carModel={}", userId, groupId, choice.getCarModel());

        if (!groupRepository.existsById(groupId)) {
            throw new ResourceNotFoundException("Group", groupId);
        }

        if (paymentRepository.existsByUserIdAndGroupId(userId, groupId)) {
            throw new AlreadyPaidException(userId, groupId);
        }

        BigDecimal fee = feeSchedule.feeFor(choice.getOnRoadPrice());

        Payment payment = Payment.builder()
                .userId(userId)
                .groupId(groupId)
                .amount(fee)
                .carModel(choice.getCarModel())
                .variant(choice.getVariant())
                .transmission(choice.getTransmission())
                .onRoadPrice(choice.getOnRoadPrice())
                .build();

        try {
            // Unique (user_id, group_id) index catches a concurrent duplicate
            payment = paymentRepository.saveAndFlush(payment);
        } catch (DataIntegrityViolationException e) {
            logger.warn("Concurrent duplicate payment rejected: userId={}, groupId={}", userId, groupId);
            throw new AlreadyPaidException(userId, groupId);
        }

        metricsService.recordPayment(fee);
        logger.info("Payment recorded: paymentId={}, userId={}, groupId={}, amount={}, policy={}",
                payment.getPaymentId(), userId, groupId, fee, feeSchedule.policyName());

        return payment;
    }

    @Transactional(readOnly = true)
    public boolean hasPaid(String groupId, String userId) {
        return paymentRepository.existsByUserIdAndGroupId(userId, groupId);
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findPayment(String groupId, String userId) {
        return paymentRepository.findByUserIdAndGroupId(userId, groupId);
    }
}
