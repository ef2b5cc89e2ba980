package com.cred.freestyle.groupbuy.testutil;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;
import com.cred.freestyle.groupbuy.domain.model.DealerOffer;
import com.cred.freestyle.groupbuy.domain.model.GroupMember;
import com.cred.freestyle.groupbuy.domain.model.Payment;
import com.cred.freestyle.groupbuy.domain.model.User;
import com.cred.freestyle.groupbuy.domain.model.VehicleChoice;
import com.cred.freestyle.groupbuy.domain.model.Vote;
import com.cred.freestyle.groupbuy.security.UserIdentity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Test data with sensible defaults. Each method returns a Lombok builder
 * so tests only override the fields they care about.
 */
public class TestDataBuilder {

    public static BuyingGroup.BuyingGroupBuilder aGroup() {
        return BuyingGroup.builder()
                .groupId("group-" + UUID.randomUUID())
                .carModel("Nexon")
                .brand("Tata")
                .city("Pune")
                .imageUrl("https://img.example.com/nexon.png")
                .maxMembers(10)
                .currentMembers(0)
                .status(GroupStatus.FORMING)
                .createdAt(Instant.now());
    }

    public static DealerOffer.DealerOfferBuilder anOffer(String groupId) {
        return DealerOffer.builder()
                .offerId("offer-" + UUID.randomUUID())
                .groupId(groupId)
                .dealerName("Pune Motors")
                .price(new BigDecimal("950000"))
                .deliveryTime("2 weeks")
                .bonusItems("Floor mats")
                .votes(0)
                .createdAt(Instant.now());
    }

    public static Payment.PaymentBuilder aPayment(String userId, String groupId) {
        return Payment.builder()
                .paymentId("payment-" + UUID.randomUUID())
                .userId(userId)
                .groupId(groupId)
                .amount(new BigDecimal("1000"))
                .carModel("Nexon")
                .variant("XZ+")
                .transmission("Manual")
                .onRoadPrice(new BigDecimal("950000"))
                .createdAt(Instant.now());
    }

    public static GroupMember.GroupMemberBuilder aMember(String userId, String groupId) {
        return GroupMember.builder()
                .memberId("member-" + UUID.randomUUID())
                .userId(userId)
                .groupId(groupId)
                .userName("Member " + userId)
                .userEmail(userId + "@example.com")
                .joinedAt(Instant.now());
    }

    public static Vote.VoteBuilder aVote(String userId, String groupId, String offerId) {
        return Vote.builder()
                .voteId("vote-" + UUID.randomUUID())
                .userId(userId)
                .groupId(groupId)
                .offerId(offerId)
                .createdAt(Instant.now());
    }

    public static User.UserBuilder aUser() {
        String id = "user-" + UUID.randomUUID();
        return User.builder()
                .userId(id)
                .name("Asha")
                .email(id + "@example.com")
                .passwordHash("$2a$10$hash")
                .premium(false)
                .admin(false)
                .createdAt(Instant.now());
    }

    public static UserIdentity identity(String userId) {
        return new UserIdentity(userId, "Member " + userId, userId + "@example.com", false, false);
    }

    public static UserIdentity adminIdentity(String userId) {
        return new UserIdentity(userId, "Admin " + userId, userId + "@example.com", false, true);
    }

    public static VehicleChoice choice(String onRoadPrice) {
        return new VehicleChoice("Nexon", "XZ+", "Manual", new BigDecimal(onRoadPrice));
    }
}
