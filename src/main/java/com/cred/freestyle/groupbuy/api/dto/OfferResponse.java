package com.cred.freestyle.groupbuy.api.dto;

import com.cred.freestyle.groupbuy.domain.model.DealerOffer;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a dealer offer with its current tally.
 *
 * @author Group Buy Team
 */
public class OfferResponse {

    private String offerId;
    private String groupId;
    private String dealerName;
    private BigDecimal price;
    private String deliveryTime;
    private String bonusItems;
    private Integer votes;
    private Instant createdAt;

    public OfferResponse() {
    }

    public static OfferResponse fromEntity(DealerOffer offer) {
        OfferResponse response = new OfferResponse();
        response.setOfferId(offer.getOfferId());
        response.setGroupId(offer.getGroupId());
        response.setDealerName(offer.getDealerName());
        response.setPrice(offer.getPrice());
        response.setDeliveryTime(offer.getDeliveryTime());
        response.setBonusItems(offer.getBonusItems());
        response.setVotes(offer.getVotes());
        response.setCreatedAt(offer.getCreatedAt());
        return response;
    }

    public String getOfferId() {
        return offerId;
    }

    public void setOfferId(String offerId) {
        this.offerId = offerId;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getDealerName() {
        return dealerName;
    }

    public void setDealerName(String dealerName) {
        this.dealerName = dealerName;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public String getDeliveryTime() {
        return deliveryTime;
    }

    public void setDeliveryTime(String deliveryTime) {
        this.deliveryTime = deliveryTime;
    }

    public String getBonusItems() {
        return bonusItems;
    }

    public void setBonusItems(String bonusItems) {
        this.bonusItems = bonusItems;
    }

    public Integer getVotes() {
        return votes;
    }

    public void setVotes(Integer votes) {
        this.votes = votes;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
