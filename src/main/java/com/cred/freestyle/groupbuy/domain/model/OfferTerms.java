package com.cred.freestyle.groupbuy.domain.model;

import java.math.BigDecimal;

/**
 * Commercial terms of a dealer offer, as submitted by an admin.
 *
 * @author Group Buy Team
 */
public final class OfferTerms {

    private final String dealerName;
    private final BigDecimal price;
    private final String deliveryTime;
    private final String bonusItems;

    public OfferTerms(String dealerName, BigDecimal price, String deliveryTime, String bonusItems) {
        this.dealerName = dealerName;
        this.price = price;
        this.deliveryTime = deliveryTime;
        this.bonusItems = bonusItems;
    }

    public String getDealerName() {
        return dealerName;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public String getDeliveryTime() {
        return deliveryTime;
    }

    public String getBonusItems() {
        return bonusItems;
    }
}
