package com.cred.freestyle.groupbuy.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Model, variant, transmission and declared on-road price picked by a user.
 * Declared with a payment and carried into the member's car preference.
 *
 * @author Group Buy Team
 */
public final class VehicleChoice {

    private final String carModel;
    private final String variant;
    private final String transmission;
    private final BigDecimal onRoadPrice;

    public VehicleChoice(String carModel, String variant, String transmission, BigDecimal onRoadPrice) {
        this.carModel = carModel;
        this.variant = variant;
        this.transmission = transmission;
        this.onRoadPrice = onRoadPrice;
    }

    public String getCarModel() {
        return carModel;
    }

    public String getVariant() {
        return variant;
    }

    public String getTransmission() {
        return transmission;
    }

    public BigDecimal getOnRoadPrice() {
        return onRoadPrice;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VehicleChoice)) return false;
        VehicleChoice that = (VehicleChoice) o;
        return Objects.equals(carModel, that.carModel)
                && Objects.equals(variant, that.variant)
                && Objects.equals(transmission, that.transmission)
                && Objects.equals(onRoadPrice, that.onRoadPrice);
    }

    @Override
    public int hashCode() {
        return Objects.hash(carModel, variant, transmission, onRoadPrice);
    }

    @Override
    public String toString() {
        return carModel + " " + variant + " (" + transmission + ", " + onRoadPrice + ")";
    }
}
