package com.cred.freestyle.groupbuy.api.dto;

import com.cred.freestyle.groupbuy.domain.model.VehicleChoice;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * Request DTO for a declared vehicle choice.
 * Used when paying the participation fee and when saving a car preference.
 *
 * @author Group Buy Team
 */
public class VehicleChoiceRequest {

    @NotBlank(message = "Car model is required")
    @Size(max = 200)
    private String carModel;

    @NotBlank(message = "Variant is required")
    @Size(max = 100)
    private String variant;

    @NotBlank(message = "Transmission is required")
    @Size(max = 50)
    private String transmission;

    @NotNull(message = "On-road price is required")
    @DecimalMin(value = "0", message = "On-road price must not be negative")
    private BigDecimal onRoadPrice;

    public VehicleChoiceRequest() {
    }

    public VehicleChoiceRequest(String carModel, String variant, String transmission, BigDecimal onRoadPrice) {
        this.carModel = carModel;
        this.variant = variant;
        this.transmission = transmission;
        this.onRoadPrice = onRoadPrice;
    }

    public VehicleChoice toVehicleChoice() {
        return new VehicleChoice(carModel, variant, transmission, onRoadPrice);
    }

    public String getCarModel() {
        return carModel;
    }

    public void setCarModel(String carModel) {
        this.carModel = carModel;
    }

    public String getVariant() {
        return variant;
    }

    public void setVariant(String variant) {
        this.variant = variant;
    }

    public String getTransmission() {
        return transmission;
    }

    public void setTransmission(String transmission) {
        this.transmission = transmission;
    }

    public BigDecimal getOnRoadPrice() {
        return onRoadPrice;
    }

    public void setOnRoadPrice(BigDecimal onRoadPrice) {
        this.onRoadPrice = onRoadPrice;
    }
}
