package com.cred.freestyle.groupbuy.service;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;
import com.cred.freestyle.groupbuy.domain.model.DealerOffer;
import com.cred.freestyle.groupbuy.domain.model.OfferTerms;
import com.cred.freestyle.groupbuy.domain.model.Vote;
import com.cred.freestyle.groupbuy.exception.InvalidGroupStateException;
import com.cred.freestyle.groupbuy.exception.NotGroupMemberException;
import com.cred.freestyle.groupbuy.exception.ResourceNotFoundException;
import com.cred.freestyle.groupbuy.infrastructure.messaging.GroupEventPublisher;
import com.cred.freestyle.groupbuy.infrastructure.messaging.events.GroupEvent;
import com.cred.freestyle.groupbuy.infrastructure.metrics.GroupBuyMetricsService;
import com.cred.freestyle.groupbuy.repository.BuyingGroupRepository;
import com.cred.freestyle.groupbuy.repository.DealerOfferRepository;
import com.cred.freestyle.groupbuy.repository.GroupMemberRepository;
import com.cred.freestyle.groupbuy.repository.VoteRepository;
import com.cred.freestyle.groupbuy.security.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Dealer offers, member votes and group completion.
 *
 * Offer creation, voting and completion all take the group row lock first, so a vote
 * can never land after the group was completed and tallies are never updated concurrently
 * for the same group.
 *
 * @author Group Buy Team
 */
@Service
public class OfferService {

    private static final Logger logger = LoggerFactory.getLogger(OfferService.class);

    private final DealerOfferRepository offerRepository;
    private final VoteRepository voteRepository;
    private final BuyingGroupRepository groupRepository;
    private final GroupMemberRepository memberRepository;
    private final GroupEventPublisher eventPublisher;
    private final GroupBuyMetricsService metricsService;

    public OfferService(
            DealerOfferRepository offerRepository,
            VoteRepository voteRepository,
            BuyingGroupRepository groupRepository,
            GroupMemberRepository memberRepository,
            GroupEventPublisher eventPublisher,
            GroupBuyMetricsService metricsService
    ) {
        this.offerRepository = offerRepository;
        this.voteRepository = voteRepository;
        this.groupRepository = groupRepository;
        this.memberRepository = memberRepository;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    @Transactional
    public DealerOffer createOffer(String groupId, OfferTerms terms, UserIdentity admin) {
        return createOffers(groupId, List.of(terms), admin).get(0);
    }

    /**
     * Submit dealer offers for a LOCKED group and move it to NEGOTIATION.
     * All offers are stored or none are.
     *
     * @param groupId Group ID
     * @param terms One or more offers
     * @param admin Admin submitting the offers
     * @return Stored offers with zero votes
     * @throws ResourceNotFoundException if the group does not exist
     * @throws InvalidGroupStateException if the group is not LOCKED
     */
    @Transactional
    public List<DealerOffer> createOffers(String groupId, List<OfferTerms> terms, UserIdentity admin) {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("At least one offer is required");
        }
        terms.forEach(OfferService::validate);

        BuyingGroup group = groupRepository.findByIdWithLock(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Group", groupId));

        if (group.getStatus() != GroupStatus.LOCKED) {
            throw new InvalidGroupStateException(groupId, group.getStatus(),
                    "Offers can only be added to a LOCKED group");
        }

        List<DealerOffer> offers = new ArrayList<>();
        for (OfferTerms term : terms) {
            offers.add(DealerOffer.builder()
                    .groupId(groupId)
                    .dealerName(term.getDealerName().trim())
                    .price(term.getPrice())
                    .deliveryTime(term.getDeliveryTime().trim())
                    .bonusItems(term.getBonusItems())
                    .votes(0)
                    .build());
        }
        List<DealerOffer> saved = offerRepository.saveAll(offers);

        if (groupRepository.transitionStatus(groupId, GroupStatus.LOCKED, GroupStatus.NEGOTIATION) == 0) {
            throw new InvalidGroupStateException(groupId, group.getStatus(),
                    "Group left LOCKED status while offers were being added");
        }

        eventPublisher.publish(GroupEvent.offersCreated(groupId, admin.getUserId()));
        metricsService.recordOffersCreated(saved.size());
        logger.info("Offers created: groupId={}, count={}, by={}, group now NEGOTIATION",
                groupId, saved.size(), admin.getUserId());

        return saved;
    }

    /**
     * Cast or move the caller's vote. A member holds at most one vote per group;
     * voting for another offer moves it, voting for the same offer changes nothing.
     *
     * @param offerId Offer to vote for
     * @param voter Authenticated user
     * @return Offer with its updated tally and the previous choice
     * @throws ResourceNotFoundException if the offer does not exist
     * @throws NotGroupMemberException if the caller has not joined the offer's group
     * @throws InvalidGroupStateException if the group is already COMPLETED
     */
    @Transactional
    public VoteResult vote(String offerId, UserIdentity voter) {
        long startTime = System.currentTimeMillis();
        String userId = voter.getUserId();

        DealerOffer offer = offerRepository.findById(offerId)
                .orElseThrow(() -> new ResourceNotFoundException("Offer", offerId));
        String groupId = offer.getGroupId();

        if (!memberRepository.existsByGroupIdAndUserId(groupId, userId)) {
            throw new NotGroupMemberException(userId, groupId);
        }

        BuyingGroup group = groupRepository.findByIdWithLock(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Group", groupId));

        if (group.getStatus() == GroupStatus.COMPLETED) {
            throw new InvalidGroupStateException(groupId, group.getStatus(),
                    "Voting is closed for completed groups");
        }

        Optional<Vote> existing = voteRepository.findByUserIdAndGroupId(userId, groupId);
        String previousOfferId = null;

        if (existing.isPresent()) {
            Vote vote = existing.get();
            if (offerId.equals(vote.getOfferId())) {
                logger.debug("Vote unchanged: userId={}, offerId={}", userId, offerId);
                return new VoteResult(offer, offerId, false);
            }

            previousOfferId = vote.getOfferId();
            vote.switchTo(offerId);
            voteRepository.save(vote);

            if (offerRepository.decrementVotes(previousOfferId) == 0) {
                metricsService.recordError("TALLY_UNDERFLOW", "vote");
                throw new IllegalStateException("Vote tally of offer " + previousOfferId + " is already zero");
            }
        } else {
            voteRepository.save(Vote.builder()
                    .userId(userId)
                    .groupId(groupId)
                    .offerId(offerId)
                    .build());
        }

        offerRepository.incrementVotes(offerId);

        DealerOffer updated = offerRepository.findById(offerId)
                .orElseThrow(() -> new ResourceNotFoundException("Offer", offerId));

        eventPublisher.publish(GroupEvent.voteCast(groupId, userId, offerId));
        metricsService.recordVote(previousOfferId != null);
        metricsService.recordLatency("vote", System.currentTimeMillis() - startTime);
        logger.info("Vote recorded: userId={}, groupId={}, offerId={}, previousOfferId={}, votes={}",
                userId, groupId, offerId, previousOfferId, updated.getVotes());

        return new VoteResult(updated, previousOfferId, true);
    }

    /**
     * @throws ResourceNotFoundException if the group does not exist
     */
    @Transactional(readOnly = true)
    public List<DealerOffer> listOffers(String groupId) {
        if (!groupRepository.existsById(groupId)) {
            throw new ResourceNotFoundException("Group", groupId);
        }
        return offerRepository.findByGroupId(groupId);
    }

    /**
     * Close a group with its winning offer. NEGOTIATION to COMPLETED only.
     *
     * @param groupId Group ID
     * @param winningOfferId Offer chosen as winner, must belong to the group
     * @param admin Admin completing the group
     * @return Completed group
     */
    @Transactional
    public BuyingGroup completeGroup(String groupId, String winningOfferId, UserIdentity admin) {
        BuyingGroup group = groupRepository.findByIdWithLock(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Group", groupId));

        if (group.getStatus() != GroupStatus.NEGOTIATION) {
            throw new InvalidGroupStateException(groupId, group.getStatus(),
                    "Only a group in NEGOTIATION can be completed");
        }

        if (winningOfferId == null || !offerRepository.existsByOfferIdAndGroupId(winningOfferId, groupId)) {
            throw new ResourceNotFoundException("Offer", winningOfferId);
        }

        if (groupRepository.completeWithWinner(groupId, winningOfferId,
                GroupStatus.NEGOTIATION, GroupStatus.COMPLETED) == 0) {
            throw new InvalidGroupStateException(groupId, group.getStatus(),
                    "Group left NEGOTIATION status during completion");
        }

        BuyingGroup completed = groupRepository.findById(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Group", groupId));

        eventPublisher.publish(GroupEvent.groupCompleted(groupId, admin.getUserId(), winningOfferId));
        metricsService.recordGroupCompleted();
        logger.info("Group completed: groupId={}, winningOfferId={}, by={}",
                groupId, winningOfferId, admin.getUserId());

        return completed;
    }

    private static void validate(OfferTerms terms) {
        if (terms.getDealerName() == null || terms.getDealerName().isBlank()) {
            throw new IllegalArgumentException("dealerName is required");
        }
        if (terms.getDeliveryTime() == null || terms.getDeliveryTime().isBlank()) {
            throw new IllegalArgumentException("deliveryTime is required");
        }
        if (terms.getPrice() == null || terms.getPrice().compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("price must be positive");
        }
    }
}
