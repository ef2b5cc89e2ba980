package com.cred.freestyle.groupbuy.service.fee;

import java.math.BigDecimal;

/**
 * Default fee policy. Fee grows with the price band of the vehicle:
 * - up to 10 lakh: 1000
 * - up to 20 lakh: 2000
 * - up to 30 lakh: 3000
 * - above: 5000
 *
 * @author Group Buy Team
 */
public class TieredFeeSchedule implements FeeSchedule {

    public static final String POLICY_NAME = "tiered";

    private static final BigDecimal TEN_LAKH = new BigDecimal("1000000");
    private static final BigDecimal TWENTY_LAKH = new BigDecimal("2000000");
    private static final BigDecimal THIRTY_LAKH = new BigDecimal("3000000");

    @Override
    public BigDecimal feeFor(BigDecimal onRoadPrice) {
        if (onRoadPrice == null || onRoadPrice.signum() < 0) {
            throw new IllegalArgumentException("On-road price must be a non-negative amount");
        }
        if (onRoadPrice.compareTo(TEN_LAKH) <= 0) {
            return new BigDecimal("1000");
        }
        if (onRoadPrice.compareTo(TWENTY_LAKH) <= 0) {
            return new BigDecimal("2000");
        }
        if (onRoadPrice.compareTo(THIRTY_LAKH) <= 0) {
            return new BigDecimal("3000");
        }
        return new BigDecimal("5000");
    }

    @Override
    public String policyName() {
        return POLICY_NAME;
    }
}
