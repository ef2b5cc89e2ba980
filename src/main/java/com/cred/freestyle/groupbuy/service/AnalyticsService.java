package com.cred.freestyle.groupbuy.service;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.DealerOffer;
import com.cred.freestyle.groupbuy.exception.ResourceNotFoundException;
import com.cred.freestyle.groupbuy.infrastructure.metrics.GroupBuyMetricsService;
import com.cred.freestyle.groupbuy.repository.BuyingGroupRepository;
import com.cred.freestyle.groupbuy.repository.DealerOfferRepository;
import com.cred.freestyle.groupbuy.repository.GroupMemberRepository;
import com.cred.freestyle.groupbuy.repository.VoteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Admin rollup of a group: stored rows counted and checked against the cached counters.
 *
 * @author Group Buy Team
 */
@Service
public class AnalyticsService {

    private static final Logger logger = LoggerFactory.getLogger(AnalyticsService.class);

    private final BuyingGroupRepository groupRepository;
    private final GroupMemberRepository memberRepository;
    private final DealerOfferRepository offerRepository;
    private final VoteRepository voteRepository;
    private final GroupBuyMetricsService metricsService;

    public AnalyticsService(
            BuyingGroupRepository groupRepository,
            GroupMemberRepository memberRepository,
            DealerOfferRepository offerRepository,
            VoteRepository voteRepository,
            GroupBuyMetricsService metricsService
    ) {
        this.groupRepository = groupRepository;
        this.memberRepository = memberRepository;
        this.offerRepository = offerRepository;
        this.voteRepository = voteRepository;
        this.metricsService = metricsService;
    }

    /**
     * Build a snapshot of one group. Runs REPEATABLE_READ so every count sees the same state.
     *
     * @param groupId Group ID
     * @return Snapshot with consistency flags
     * @throws ResourceNotFoundException if the group does not exist
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public GroupSnapshot groupSnapshot(String groupId) {
        BuyingGroup group = groupRepository.findById(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Group", groupId));

        long membersCount = memberRepository.countByGroupId(groupId);
        List<DealerOffer> offers = offerRepository.findByGroupId(groupId);
        long totalVotes = voteRepository.countByGroupId(groupId);

        GroupSnapshot snapshot = new GroupSnapshot(group, membersCount, offers, totalVotes);

        if (!snapshot.isCounterConsistent()) {
            metricsService.recordError("MEMBER_COUNTER_DRIFT", "groupSnapshot");
            logger.error("Member counter drift: groupId={}, currentMembers={}, memberRows={}",
                    groupId, group.getCurrentMembers(), membersCount);
        }
        if (!snapshot.isTallyConsistent()) {
            metricsService.recordError("VOTE_TALLY_DRIFT", "groupSnapshot");
            logger.error("Vote tally drift: groupId={}, tallySum={}, voteRows={}",
                    groupId, snapshot.getTallySum(), totalVotes);
        }

        return snapshot;
    }
}
