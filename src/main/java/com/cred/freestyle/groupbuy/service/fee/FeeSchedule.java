package com.cred.freestyle.groupbuy.service.fee;

import java.math.BigDecimal;

/**
 * Participation fee policy: a pure function of the declared on-road price.
 *
 * @author Group Buy Team
 */
public interface FeeSchedule {

    /**
     * @param onRoadPrice Declared on-road price of the vehicle, non-negative
     * @return Fee to charge
     */
    BigDecimal feeFor(BigDecimal onRoadPrice);

    /**
     * @return Policy name, as used in configuration
     */
    String policyName();
}
