package com.cred.freestyle.groupbuy.api.controller;

import com.cred.freestyle.groupbuy.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;
import com.cred.freestyle.groupbuy.domain.model.CarPreference;
import com.cred.freestyle.groupbuy.domain.model.Payment;
import com.cred.freestyle.groupbuy.domain.model.VehicleChoice;
import com.cred.freestyle.groupbuy.exception.AlreadyMemberException;
import com.cred.freestyle.groupbuy.exception.AlreadyPaidException;
import com.cred.freestyle.groupbuy.exception.GroupFullException;
import com.cred.freestyle.groupbuy.exception.NotGroupMemberException;
import com.cred.freestyle.groupbuy.exception.PaymentRequiredException;
import com.cred.freestyle.groupbuy.exception.ResourceNotFoundException;
import com.cred.freestyle.groupbuy.infrastructure.retry.StoreContentionRetrier;
import com.cred.freestyle.groupbuy.security.UserIdentity;
import com.cred.freestyle.groupbuy.service.GroupService;
import com.cred.freestyle.groupbuy.service.MembershipService;
import com.cred.freestyle.groupbuy.service.OfferService;
import com.cred.freestyle.groupbuy.service.PaymentService;
import com.cred.freestyle.groupbuy.service.PreferenceService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import java.util.function.Supplier;

import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.aGroup;
import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.aMember;
import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.aPayment;
import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.anOffer;
import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.identity;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for GroupController using MockMvc.
 * Tests the HTTP layer in isolation with mocked service dependencies.
 */
@WebMvcTest(GroupController.class)
@AutoConfigureMockMvc(addFilters = false)
@ContextConfiguration(classes = {GroupController.class, GlobalExceptionHandler.class})
@DisplayName("GroupController Tests")
class GroupControllerTest {

    private static final String CHOICE_BODY = """
            {
                "carModel": "Nexon",
                "variant": "XZ+",
                "transmission": "Manual",
                "onRoadPrice": 950000
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GroupService groupService;

    @MockBean
    private PaymentService paymentService;

    @MockBean
    private MembershipService membershipService;

    @MockBean
    private PreferenceService preferenceService;

    @MockBean
    private OfferService offerService;

    @MockBean
    private StoreContentionRetrier retrier;

    private UserIdentity user;

    @BeforeEach
    void setUp() {
        user = identity("user-1");
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(user, null, user.getAuthorities()));
        when(retrier.execute(anyString(), any())).thenAnswer(inv -> ((Supplier<?>) inv.getArgument(1)).get());
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    // ========================================
    // Group creation and browsing
    // ========================================

    @Test
    @DisplayName("POST /groups - Valid request returns 201 Created")
    void createGroup_ValidRequest_Returns201() throws Exception {
        // Given
        BuyingGroup group = aGroup().groupId("g-1").maxMembers(5).build();
        when(groupService.create("Nexon", "Tata", "Pune", "https://img/n.png", 5, user)).thenReturn(group);

        // When / Then
        mockMvc.perform(post("/api/v1/groups")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "carModel": "Nexon",
                                    "brand": "Tata",
                                    "city": "Pune",
                                    "imageUrl": "https://img/n.png",
                                    "maxMembers": 5
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.groupId").value("g-1"))
                .andExpect(jsonPath("$.status").value("FORMING"))
                .andExpect(jsonPath("$.remainingSlots").value(5));
    }

    @Test
    @DisplayName("POST /groups - Zero capacity returns 400 with field errors")
    void createGroup_ZeroCapacity_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/groups")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "carModel": "Nexon",
                                    "brand": "Tata",
                                    "city": "Pune",
                                    "imageUrl": "https://img/n.png",
                                    "maxMembers": 0
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.fieldErrors.maxMembers").exists());

        verify(groupService, never()).create(any(), any(), any(), any(), anyInt(), any());
    }

    @Test
    @DisplayName("GET /groups - Filters are passed through")
    void listGroups_WithFilters() throws Exception {
        when(groupService.list("Tata", null, "nex")).thenReturn(Arrays.asList(
                aGroup().groupId("g-1").build(),
                aGroup().groupId("g-2").build()));

        mockMvc.perform(get("/api/v1/groups").param("brand", "Tata").param("search", "nex"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].groupId").value("g-2"));
    }

    @Test
    @DisplayName("GET /groups/{id} - Unknown group returns 404")
    void getGroup_Unknown_Returns404() throws Exception {
        when(groupService.get("missing")).thenThrow(new ResourceNotFoundException("Group", "missing"));

        mockMvc.perform(get("/api/v1/groups/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.details.resourceId").value("missing"));
    }

    // ========================================
    // Payment
    // ========================================

    @Test
    @DisplayName("POST /groups/{id}/payment - Returns 201 with the computed fee")
    void pay_Returns201() throws Exception {
        Payment payment = aPayment("user-1", "g-1").amount(new BigDecimal("1000")).build();
        when(paymentService.pay(eq("g-1"), eq(user), any(VehicleChoice.class))).thenReturn(payment);

        mockMvc.perform(post("/api/v1/groups/g-1/payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHOICE_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.groupId").value("g-1"))
                .andExpect(jsonPath("$.amount").value(1000));
    }

    @Test
    @DisplayName("POST /groups/{id}/payment - Second payment returns 409 ALREADY_PAID")
    void pay_Twice_Returns409() throws Exception {
        when(paymentService.pay(eq("g-1"), eq(user), any(VehicleChoice.class)))
                .thenThrow(new AlreadyPaidException("user-1", "g-1"));

        mockMvc.perform(post("/api/v1/groups/g-1/payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHOICE_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.code").value("ALREADY_PAID"));
    }

    @Test
    @DisplayName("POST /groups/{id}/payment - Negative price returns 400")
    void pay_NegativePrice_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/groups/g-1/payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "carModel": "Nexon",
                                    "variant": "XZ+",
                                    "transmission": "Manual",
                                    "onRoadPrice": -1
                                }
                                """))
                .andExpect(status().isBadRequest());

        verify(paymentService, never()).pay(any(), any(), any());
    }

    @Test
    @DisplayName("GET /groups/{id}/payment - Reports payment status")
    void paymentStatus() throws Exception {
        when(paymentService.hasPaid("g-1", "user-1")).thenReturn(true);

        mockMvc.perform(get("/api/v1/groups/g-1/payment"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasPaid").value(true));
    }

    // ========================================
    // Join
    // ========================================

    @Test
    @DisplayName("POST /groups/{id}/join - Last slot returns the locked group")
    void join_LastSlot_ReturnsLocked() throws Exception {
        BuyingGroup locked = aGroup().groupId("g-1").maxMembers(2).currentMembers(2)
                .status(GroupStatus.LOCKED).build();
        when(membershipService.join("g-1", user)).thenReturn(locked);

        mockMvc.perform(post("/api/v1/groups/g-1/join"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("LOCKED"))
                .andExpect(jsonPath("$.currentMembers").value(2));

        verify(retrier).execute(eq("join"), any());
    }

    @Test
    @DisplayName("POST /groups/{id}/join - Without payment returns 402")
    void join_Unpaid_Returns402() throws Exception {
        when(membershipService.join("g-1", user)).thenThrow(new PaymentRequiredException("user-1", "g-1"));

        mockMvc.perform(post("/api/v1/groups/g-1/join"))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.details.code").value("PAYMENT_REQUIRED"));
    }

    @Test
    @DisplayName("POST /groups/{id}/join - Full group returns 409 GROUP_FULL")
    void join_Full_Returns409() throws Exception {
        when(membershipService.join("g-1", user)).thenThrow(new GroupFullException("g-1", 2));

        mockMvc.perform(post("/api/v1/groups/g-1/join"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.code").value("GROUP_FULL"))
                .andExpect(jsonPath("$.details.maxMembers").value(2));
    }

    @Test
    @DisplayName("POST /groups/{id}/join - Repeat join returns 409 ALREADY_MEMBER")
    void join_Repeat_Returns409() throws Exception {
        when(membershipService.join("g-1", user)).thenThrow(new AlreadyMemberException("user-1", "g-1"));

        mockMvc.perform(post("/api/v1/groups/g-1/join"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.code").value("ALREADY_MEMBER"));
    }

    // ========================================
    // Members, preferences and offers
    // ========================================

    @Test
    @DisplayName("GET /groups/{id}/members - Lists members")
    void listMembers() throws Exception {
        when(membershipService.listMembers("g-1")).thenReturn(Collections.singletonList(
                aMember("user-1", "g-1").build()));

        mockMvc.perform(get("/api/v1/groups/g-1/members"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].userId").value("user-1"));
    }

    @Test
    @DisplayName("POST /groups/{id}/preferences - Non-member returns 403")
    void savePreference_NonMember_Returns403() throws Exception {
        when(preferenceService.save(eq("g-1"), eq(user), any(VehicleChoice.class)))
                .thenThrow(new NotGroupMemberException("user-1", "g-1"));

        mockMvc.perform(post("/api/v1/groups/g-1/preferences")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHOICE_BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.details.code").value("FORBIDDEN"));
    }

    @Test
    @DisplayName("POST /groups/{id}/preferences - Member saves preference")
    void savePreference_Member_Returns200() throws Exception {
        CarPreference preference = CarPreference.builder()
                .preferenceId("pref-1")
                .groupId("g-1")
                .userId("user-1")
                .userName("Member user-1")
                .carModel("Nexon")
                .variant("XZ+")
                .transmission("Manual")
                .onRoadPrice(new BigDecimal("950000"))
                .build();
        when(preferenceService.save(eq("g-1"), eq(user), any(VehicleChoice.class))).thenReturn(preference);

        mockMvc.perform(post("/api/v1/groups/g-1/preferences")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHOICE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.preferenceId").value("pref-1"))
                .andExpect(jsonPath("$.variant").value("XZ+"));
    }

    @Test
    @DisplayName("GET /groups/{id}/my-preference - No preference returns an empty body")
    void myPreference_None() throws Exception {
        when(preferenceService.getMine("g-1", "user-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/groups/g-1/my-preference"))
                .andExpect(status().isOk())
                .andExpect(content().string(""));
    }

    @Test
    @DisplayName("GET /groups/{id}/offers - Lists offers with tallies")
    void listOffers() throws Exception {
        when(offerService.listOffers("g-1")).thenReturn(Collections.singletonList(
                anOffer("g-1").offerId("o-1").votes(3).build()));

        mockMvc.perform(get("/api/v1/groups/g-1/offers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].offerId").value("o-1"))
                .andExpect(jsonPath("$[0].votes").value(3));
    }
}
