package com.cred.freestyle.groupbuy.service;

import com.cred.freestyle.groupbuy.domain.model.DealerOffer;

/**
 * Outcome of a vote: the chosen offer with its fresh tally and the offer the vote moved away from.
 *
 * @author Group Buy Team
 */
public class VoteResult {

    private final DealerOffer offer;
    private final String previousOfferId;
    private final boolean changed;

    public VoteResult(DealerOffer offer, String previousOfferId, boolean changed) {
        this.offer = offer;
        this.previousOfferId = previousOfferId;
        this.changed = changed;
    }

    public DealerOffer getOffer() {
        return offer;
    }

    /**
     * @return Offer the member previously voted for, or null for a first vote
     */
    public String getPreviousOfferId() {
        return previousOfferId;
    }

    /**
     * @return false when the member re-voted for the offer they already chose
     */
    public boolean isChanged() {
        return changed;
    }

    public boolean isSwitch() {
        return changed && previousOfferId != null;
    }
}
