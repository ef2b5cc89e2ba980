package com.cred.freestyle.groupbuy.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request DTO for submitting several dealer offers for one group at once.
 *
 * @author Group Buy Team
 */
public class BatchOfferRequest {

    @NotEmpty(message = "At least one offer is required")
    @Valid
    private List<OfferRequest> offers;

    public BatchOfferRequest() {
    }

    public BatchOfferRequest(List<OfferRequest> offers) {
        this.offers = offers;
    }

    public List<OfferRequest> getOffers() {
        return offers;
    }

    public void setOffers(List<OfferRequest> offers) {
        this.offers = offers;
    }
}
