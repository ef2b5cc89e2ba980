package com.cred.freestyle.groupbuy.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.aPayment;
import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.aVote;
import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.choice;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for Vote, Payment and CarPreference behavior.
 */
@DisplayName("Vote and Preference Domain Model Tests")
class VoteTest {

    @Test
    @DisplayName("switchTo - Repoints the vote, keeps user and group")
    void switchTo_ChangesOfferOnly() {
        Vote vote = aVote("user-1", "group-1", "offer-x").build();

        vote.switchTo("offer-y");

        assertThat(vote.getOfferId()).isEqualTo("offer-y");
        assertThat(vote.getUserId()).isEqualTo("user-1");
        assertThat(vote.getGroupId()).isEqualTo("group-1");
    }

    @Test
    @DisplayName("Payment.toVehicleChoice - Carries the declared vehicle")
    void payment_ToVehicleChoice() {
        Payment payment = aPayment("user-1", "group-1").build();

        VehicleChoice choice = payment.toVehicleChoice();

        assertThat(choice).isEqualTo(new VehicleChoice("Nexon", "XZ+", "Manual", new BigDecimal("950000")));
    }

    @Test
    @DisplayName("CarPreference.applyChoice - Replaces vehicle fields in place")
    void preference_ApplyChoice() {
        CarPreference preference = CarPreference.builder()
                .preferenceId("pref-1")
                .userId("user-1")
                .groupId("group-1")
                .userName("Asha")
                .carModel("Punch")
                .variant("Pure")
                .transmission("Manual")
                .onRoadPrice(new BigDecimal("700000"))
                .build();

        preference.applyChoice(choice("1500000"));

        assertThat(preference.getPreferenceId()).isEqualTo("pref-1");
        assertThat(preference.getUserName()).isEqualTo("Asha");
        assertThat(preference.getCarModel()).isEqualTo("Nexon");
        assertThat(preference.getVariant()).isEqualTo("XZ+");
        assertThat(preference.getOnRoadPrice()).isEqualByComparingTo("1500000");
    }
}
