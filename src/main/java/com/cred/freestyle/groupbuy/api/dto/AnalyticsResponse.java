package com.cred.freestyle.groupbuy.api.dto;

import com.cred.freestyle.groupbuy.service.GroupSnapshot;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for the admin analytics of a group.
 * membersCount and totalVotes are counted from stored rows and cross-checked against the cached counters.
 *
 * @author Group Buy Team
 */
public class AnalyticsResponse {

    private GroupResponse group;
    private long membersCount;
    private List<OfferResponse> offers;
    private long totalVotes;
    private long tallySum;
    private boolean counterConsistent;
    private boolean tallyConsistent;

    public AnalyticsResponse() {
    }

    public static AnalyticsResponse fromSnapshot(GroupSnapshot snapshot) {
        AnalyticsResponse response = new AnalyticsResponse();
        response.setGroup(GroupResponse.fromEntity(snapshot.getGroup()));
        response.setMembersCount(snapshot.getMembersCount());
        response.setOffers(snapshot.getOffers().stream()
                .map(OfferResponse::fromEntity)
                .collect(Collectors.toList()));
        response.setTotalVotes(snapshot.getTotalVotes());
        response.setTallySum(snapshot.getTallySum());
        response.setCounterConsistent(snapshot.isCounterConsistent());
        response.setTallyConsistent(snapshot.isTallyConsistent());
        return response;
    }

    public GroupResponse getGroup() {
        return group;
    }

    public void setGroup(GroupResponse group) {
        this.group = group;
    }

    public long getMembersCount() {
        return membersCount;
    }

    public void setMembersCount(long membersCount) {
        this.membersCount = membersCount;
    }

    public List<OfferResponse> getOffers() {
        return offers;
    }

    public void setOffers(List<OfferResponse> offers) {
        this.offers = offers;
    }

    public long getTotalVotes() {
        return totalVotes;
    }

    public void setTotalVotes(long totalVotes) {
        this.totalVotes = totalVotes;
    }

    public long getTallySum() {
        return tallySum;
    }

    public void setTallySum(long tallySum) {
        this.tallySum = tallySum;
    }

    public boolean isCounterConsistent() {
        return counterConsistent;
    }

    public void setCounterConsistent(boolean counterConsistent) {
        this.counterConsistent = counterConsistent;
    }

    public boolean isTallyConsistent() {
        return tallyConsistent;
    }

    public void setTallyConsistent(boolean tallyConsistent) {
        this.tallyConsistent = tallyConsistent;
    }
}
