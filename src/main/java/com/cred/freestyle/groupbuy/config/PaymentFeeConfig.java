package com.cred.freestyle.groupbuy.config;

import com.cred.freestyle.groupbuy.service.fee.FeeSchedule;
import com.cred.freestyle.groupbuy.service.fee.FlatFeeSchedule;
import com.cred.freestyle.groupbuy.service.fee.TieredFeeSchedule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Participation fee policy selection.
 * groupbuy.payment.fee-policy picks the FeeSchedule: "tiered" (default) or "flat".
 *
 * @author Group Buy Team
 */
@Configuration
public class PaymentFeeConfig {

    @Bean
    @ConditionalOnProperty(name = "groupbuy.payment.fee-policy", havingValue = TieredFeeSchedule.POLICY_NAME,
            matchIfMissing = true)
    public FeeSchedule tieredFeeSchedule() {
        return new TieredFeeSchedule();
    }

    @Bean
    @ConditionalOnProperty(name = "groupbuy.payment.fee-policy", havingValue = FlatFeeSchedule.POLICY_NAME)
    public FeeSchedule flatFeeSchedule(@Value("${groupbuy.payment.flat-fee:1000}") BigDecimal flatFee) {
        return new FlatFeeSchedule(flatFee);
    }
}
