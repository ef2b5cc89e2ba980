package com.cred.freestyle.groupbuy.api.dto;

import com.cred.freestyle.groupbuy.domain.model.OfferTerms;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * Request DTO for a dealer offer.
 *
 * @author Group Buy Team
 */
public class OfferRequest {

    @NotBlank(message = "Dealer name is required")
    @Size(max = 200)
    private String dealerName;

    @NotNull(message = "Price is required")
    @Positive(message = "Price must be positive")
    private BigDecimal price;

    @NotBlank(message = "Delivery time is required")
    @Size(max = 100)
    private String deliveryTime;

    @Size(max = 1000)
    private String bonusItems;

    public OfferRequest() {
    }

    public OfferRequest(String dealerName, BigDecimal price, String deliveryTime, String bonusItems) {
        this.dealerName = dealerName;
        this.price = price;
        this.deliveryTime = deliveryTime;
        this.bonusItems = bonusItems;
    }

    public OfferTerms toOfferTerms() {
        return new OfferTerms(dealerName, price, deliveryTime, bonusItems);
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
}
