package com.cred.freestyle.groupbuy.service;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;
import com.cred.freestyle.groupbuy.domain.model.GroupMember;
import com.cred.freestyle.groupbuy.domain.model.Payment;
import com.cred.freestyle.groupbuy.exception.AlreadyMemberException;
import com.cred.freestyle.groupbuy.exception.GroupFullException;
import com.cred.freestyle.groupbuy.exception.PaymentRequiredException;
import com.cred.freestyle.groupbuy.exception.ResourceNotFoundException;
import com.cred.freestyle.groupbuy.infrastructure.messaging.GroupEventPublisher;
import com.cred.freestyle.groupbuy.infrastructure.messaging.events.GroupEvent;
import com.cred.freestyle.groupbuy.infrastructure.metrics.GroupBuyMetricsService;
import com.cred.freestyle.groupbuy.repository.BuyingGroupRepository;
import com.cred.freestyle.groupbuy.repository.GroupMemberRepository;
import com.cred.freestyle.groupbuy.security.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Group membership: the join flow and member listings.
 *
 * A join runs in one transaction under a pessimistic lock on the group row:
 * 1. Require a payment for (user, group)
 * 2. Lock the group and check it is FORMING with a free slot
 * 3. Insert the membership (unique per user and group)
 * 4. Copy the vehicle choice from the payment into the member's preference
 * 5. Increment the member counter with a conditional update
 * 6. Lock the group if that was the last slot
 *
 * Any failure rolls back every step, so the counter always equals the number of membership rows.
 *
 * @author Group Buy Team
 */
@Service
public class MembershipService {

    private static final Logger logger = LoggerFactory.getLogger(MembershipService.class);

    private final BuyingGroupRepository groupRepository;
    private final GroupMemberRepository memberRepository;
    private final PaymentService paymentService;
    private final PreferenceService preferenceService;
    private final GroupEventPublisher eventPublisher;
    private final GroupBuyMetricsService metricsService;

    public MembershipService(
            BuyingGroupRepository groupRepository,
            GroupMemberRepository memberRepository,
            PaymentService paymentService,
            PreferenceService preferenceService,
            GroupEventPublisher eventPublisher,
            GroupBuyMetricsService metricsService
    ) {
        this.groupRepository = groupRepository;
        this.memberRepository = memberRepository;
        this.paymentService = paymentService;
        this.preferenceService = preferenceService;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    /**
     * Join a group.
     *
     * @param groupId Group ID
     * @param user Authenticated user
     * @return Group state after the join
     * @throws PaymentRequiredException if the user has not paid for this group
     * @throws ResourceNotFoundException if the group does not exist
     * @throws GroupFullException if the group is full or no longer forming
     * @throws AlreadyMemberException if the user already joined
     */
    @Transactional
    public BuyingGroup join(String groupId, UserIdentity user) {
        long startTime = System.currentTimeMillis();
        String userId = user.getUserId();
        logger.info("Join requested: userId={}, groupId={}", userId, groupId);

        Payment payment = paymentService.findPayment(groupId, userId)
                .orElseThrow(() -> {
                    metricsService.recordJoinRejected("PAYMENT_REQUIRED");
                    return new PaymentRequiredException(userId, groupId);
                });

        BuyingGroup group = groupRepository.findByIdWithLock(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Group", groupId));

        if (!group.isAcceptingMembers()) {
            metricsService.recordJoinRejected("GROUP_FULL");
            logger.info("Join rejected, group not accepting members: groupId={}, status={}, members={}/{}",
                    groupId, group.getStatus(), group.getCurrentMembers(), group.getMaxMembers());
            throw new GroupFullException(groupId, group.getMaxMembers());
        }

        if (memberRepository.existsByGroupIdAndUserId(groupId, userId)) {
            metricsService.recordJoinRejected("ALREADY_MEMBER");
            throw new AlreadyMemberException(userId, groupId);
        }

        GroupMember member = GroupMember.builder()
                .groupId(groupId)
                .userId(userId)
                .userName(user.getName())
                .userEmail(user.getEmail())
                .build();

        try {
            memberRepository.saveAndFlush(member);
        } catch (DataIntegrityViolationException e) {
            metricsService.recordJoinRejected("ALREADY_MEMBER");
            throw new AlreadyMemberException(userId, groupId);
        }

        preferenceService.upsert(groupId, userId, user.getName(), payment.toVehicleChoice());

        if (groupRepository.incrementMemberCount(groupId, GroupStatus.FORMING) == 0) {
            // 0 rows: full or no longer forming
            metricsService.recordJoinRejected("GROUP_FULL");
            throw new GroupFullException(groupId, group.getMaxMembers());
        }

        boolean locked = groupRepository.lockIfFull(groupId, GroupStatus.FORMING, GroupStatus.LOCKED) > 0;

        BuyingGroup updated = groupRepository.findById(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Group", groupId));

        eventPublisher.publish(GroupEvent.memberJoined(
                groupId, userId, updated.getStatus(), updated.getCurrentMembers()));
        metricsService.recordJoinSuccess();

        if (locked) {
            eventPublisher.publish(GroupEvent.groupLocked(groupId, updated.getCurrentMembers()));
            metricsService.recordGroupLocked();
            logger.info("Group reached capacity and is now LOCKED: groupId={}, members={}",
                    groupId, updated.getCurrentMembers());
        }

        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordLatency("join", duration);
        logger.info("User joined group: userId={}, groupId={}, members={}/{}, duration={}ms",
                userId, groupId, updated.getCurrentMembers(), updated.getMaxMembers(), duration);

        return updated;
    }

    /**
     * @throws ResourceNotFoundException if the group does not exist
     */
    @Transactional(readOnly = true)
    public List<GroupMember> listMembers(String groupId) {
        if (!groupRepository.existsById(groupId)) {
            throw new ResourceNotFoundException("Group", groupId);
        }
        return memberRepository.findByGroupId(groupId);
    }

    @Transactional(readOnly = true)
    public boolean isMember(String groupId, String userId) {
        return memberRepository.existsByGroupIdAndUserId(groupId, userId);
    }
}
