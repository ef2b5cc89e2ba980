package com.cred.freestyle.groupbuy.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for creating a buying group.
 *
 * @author Group Buy Team
 */
public class CreateGroupRequest {

    @NotBlank(message = "Car model is required")
    @Size(max = 200)
    private String carModel;

    @NotBlank(message = "Brand is required")
    @Size(max = 100)
    private String brand;

    @NotBlank(message = "City is required")
    @Size(max = 100)
    private String city;

    @NotBlank(message = "Image URL is required")
    @Size(max = 1000)
    private String imageUrl;

    @NotNull(message = "Max members is required")
    @Min(value = 1, message = "Max members must be at least 1")
    private Integer maxMembers;

    public CreateGroupRequest() {
    }

    public CreateGroupRequest(String carModel, String brand, String city, String imageUrl, Integer maxMembers) {
        this.carModel = carModel;
        this.brand = brand;
        this.city = city;
        this.imageUrl = imageUrl;
        this.maxMembers = maxMembers;
    }

    public String getCarModel() {
        return carModel;
    }

    public void setCarModel(String carModel) {
        this.carModel = carModel;
    }

    public String getBrand() {
        return brand;
    }

    public void setBrand(String brand) {
        this.brand = brand;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public Integer getMaxMembers() {
        return maxMembers;
    }

    public void setMaxMembers(Integer maxMembers) {
        this.maxMembers = maxMembers;
    }
}
