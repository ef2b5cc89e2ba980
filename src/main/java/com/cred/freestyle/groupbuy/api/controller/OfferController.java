package com.cred.freestyle.groupbuy.api.controller;

import com.cred.freestyle.groupbuy.api.dto.VoteResponse;
import com.cred.freestyle.groupbuy.infrastructure.retry.StoreContentionRetrier;
import com.cred.freestyle.groupbuy.security.SecurityUtils;
import com.cred.freestyle.groupbuy.security.UserIdentity;
import com.cred.freestyle.groupbuy.service.OfferService;
import com.cred.freestyle.groupbuy.service.VoteResult;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for voting on dealer offers.
 *
 * @author Group Buy Team
 */
@RestController
@RequestMapping("/api/v1/offers")
public class OfferController {

    private final OfferService offerService;
    private final StoreContentionRetrier retrier;

    public OfferController(OfferService offerService, StoreContentionRetrier retrier) {
        this.offerService = offerService;
        this.retrier = retrier;
    }

    /**
     * Vote for an offer, or move an existing vote to it. Members only.
     */
    @PostMapping("/{offerId}/vote")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<VoteResponse> vote(@PathVariable String offerId) {
        UserIdentity voter = SecurityUtils.currentIdentity();
        VoteResult result = retrier.execute("vote", () -> offerService.vote(offerId, voter));
        return ResponseEntity.ok(VoteResponse.fromResult(result));
    }
}
