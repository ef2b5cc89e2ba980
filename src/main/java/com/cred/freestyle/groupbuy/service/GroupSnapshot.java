package com.cred.freestyle.groupbuy.service;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.DealerOffer;

import java.util.List;

/**
 * Read-only rollup of one group for the admin dashboard.
 *
 * @author Group Buy Team
 */
public class GroupSnapshot {

    private final BuyingGroup group;
    private final long membersCount;
    private final List<DealerOffer> offers;
    private final long totalVotes;

    public GroupSnapshot(BuyingGroup group, long membersCount, List<DealerOffer> offers, long totalVotes) {
        this.group = group;
        this.membersCount = membersCount;
        this.offers = List.copyOf(offers);
        this.totalVotes = totalVotes;
    }

    public BuyingGroup getGroup() {
        return group;
    }

    /**
     * @return Number of stored membership rows
     */
    public long getMembersCount() {
        return membersCount;
    }

    public List<DealerOffer> getOffers() {
        return offers;
    }

    /**
     * @return Number of stored vote rows
     */
    public long getTotalVotes() {
        return totalVotes;
    }

    public long getTallySum() {
        return offers.stream().mapToLong(o -> o.getVotes() == null ? 0 : o.getVotes()).sum();
    }

    /**
     * @return true if the cached member counter matches the membership rows
     */
    public boolean isCounterConsistent() {
        return group.getCurrentMembers() != null && membersCount == group.getCurrentMembers();
    }

    /**
     * @return true if the offer tallies add up to the vote rows
     */
    public boolean isTallyConsistent() {
        return getTallySum() == totalVotes;
    }
}
