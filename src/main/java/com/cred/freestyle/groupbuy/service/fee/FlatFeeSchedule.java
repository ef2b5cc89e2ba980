package com.cred.freestyle.groupbuy.service.fee;

import java.math.BigDecimal;

/**
 * Same fee for every vehicle.
 *
 * @author Group Buy Team
 */
public class FlatFeeSchedule implements FeeSchedule {

    public static final String POLICY_NAME = "flat";

    private final BigDecimal fee;

    public FlatFeeSchedule(BigDecimal fee) {
        if (fee == null || fee.signum() < 0) {
            throw new IllegalArgumentException("Flat fee must be a non-negative amount");
        }
        this.fee = fee;
    }

    @Override
    public BigDecimal feeFor(BigDecimal onRoadPrice) {
        if (onRoadPrice == null || onRoadPrice.signum() < 0) {
            throw new IllegalArgumentException("On-road price must be a non-negative amount");
        }
        return fee;
    }

    @Override
    public String policyName() {
        return POLICY_NAME;
    }
}
