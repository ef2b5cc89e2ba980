package com.cred.freestyle.groupbuy.api.controller;

import com.cred.freestyle.groupbuy.api.dto.CreateGroupRequest;
import com.cred.freestyle.groupbuy.api.dto.GroupResponse;
import com.cred.freestyle.groupbuy.api.dto.JoinResponse;
import com.cred.freestyle.groupbuy.api.dto.MemberResponse;
import com.cred.freestyle.groupbuy.api.dto.OfferResponse;
import com.cred.freestyle.groupbuy.api.dto.PaymentResponse;
import com.cred.freestyle.groupbuy.api.dto.PaymentStatusResponse;
import com.cred.freestyle.groupbuy.api.dto.PreferenceResponse;
import com.cred.freestyle.groupbuy.api.dto.VehicleChoiceRequest;
import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.CarPreference;
import com.cred.freestyle.groupbuy.domain.model.Payment;
import com.cred.freestyle.groupbuy.infrastructure.retry.StoreContentionRetrier;
import com.cred.freestyle.groupbuy.security.SecurityUtils;
import com.cred.freestyle.groupbuy.security.UserIdentity;
import com.cred.freestyle.groupbuy.service.GroupService;
import com.cred.freestyle.groupbuy.service.MembershipService;
import com.cred.freestyle.groupbuy.service.OfferService;
import com.cred.freestyle.groupbuy.service.PaymentService;
import com.cred.freestyle.groupbuy.service.PreferenceService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * REST controller for buying groups and everything scoped to one group:
 * payment, joining, members, preferences and offers.
 *
 * @author Group Buy Team
 */
@RestController
@RequestMapping("/api/v1/groups")
public class GroupController {

    private static final Logger logger = LoggerFactory.getLogger(GroupController.class);

    private final GroupService groupService;
    private final PaymentService paymentService;
    private final MembershipService membershipService;
    private final PreferenceService preferenceService;
    private final OfferService offerService;
    private final StoreContentionRetrier retrier;

    public GroupController(
            GroupService groupService,
            PaymentService paymentService,
            MembershipService membershipService,
            PreferenceService preferenceService,
            OfferService offerService,
            StoreContentionRetrier retrier
    ) {
        this.groupService = groupService;
        this.paymentService = paymentService;
        this.membershipService = membershipService;
        this.preferenceService = preferenceService;
        this.offerService = offerService;
        this.retrier = retrier;
    }

    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<GroupResponse> createGroup(@Valid @RequestBody CreateGroupRequest request) {
        BuyingGroup group = groupService.create(
                request.getCarModel(),
                request.getBrand(),
                request.getCity(),
                request.getImageUrl(),
                request.getMaxMembers(),
                SecurityUtils.currentIdentity()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(GroupResponse.fromEntity(group));
    }

    /**
     * Search groups. All parameters are optional.
     *
     * @param brand Exact brand
     * @param city Exact city
     * @param search Case-insensitive substring of car model, brand or city
     */
    @GetMapping
    public ResponseEntity<List<GroupResponse>> listGroups(
            @RequestParam(required = false) String brand,
            @RequestParam(required = false) String city,
            @RequestParam(required = false) String search
    ) {
        List<GroupResponse> groups = groupService.list(brand, city, search).stream()
                .map(GroupResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(groups);
    }

    @GetMapping("/{groupId}")
    public ResponseEntity<GroupResponse> getGroup(@PathVariable String groupId) {
        return ResponseEntity.ok(GroupResponse.fromEntity(groupService.get(groupId)));
    }

    @PostMapping("/{groupId}/payment")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PaymentResponse> pay(
            @PathVariable String groupId,
            @Valid @RequestBody VehicleChoiceRequest request
    ) {
        Payment payment = paymentService.pay(groupId, SecurityUtils.currentIdentity(), request.toVehicleChoice());
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.fromEntity(payment));
    }

    @GetMapping("/{groupId}/payment")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PaymentStatusResponse> paymentStatus(@PathVariable String groupId) {
        boolean paid = paymentService.hasPaid(groupId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(new PaymentStatusResponse(groupId, paid));
    }

    /**
     * Join a group. Lock contention with concurrent joiners is retried with backoff.
     */
    @PostMapping("/{groupId}/join")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<JoinResponse> join(@PathVariable String groupId) {
        UserIdentity user = SecurityUtils.currentIdentity();
        BuyingGroup group = retrier.execute("join", () -> membershipService.join(groupId, user));
        logger.debug("Join completed: userId={}, groupId={}, status={}", user.getUserId(), groupId, group.getStatus());
        return ResponseEntity.ok(JoinResponse.fromEntity(group));
    }

    @GetMapping("/{groupId}/members")
    public ResponseEntity<List<MemberResponse>> listMembers(@PathVariable String groupId) {
        List<MemberResponse> members = membershipService.listMembers(groupId).stream()
                .map(MemberResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(members);
    }

    @PostMapping("/{groupId}/preferences")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PreferenceResponse> savePreference(
            @PathVariable String groupId,
            @Valid @RequestBody VehicleChoiceRequest request
    ) {
        CarPreference preference = preferenceService.save(
                groupId, SecurityUtils.currentIdentity(), request.toVehicleChoice());
        return ResponseEntity.ok(PreferenceResponse.fromEntity(preference));
    }

    @GetMapping("/{groupId}/preferences")
    public ResponseEntity<List<PreferenceResponse>> listPreferences(@PathVariable String groupId) {
        List<PreferenceResponse> preferences = preferenceService.getForGroup(groupId).stream()
                .map(PreferenceResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(preferences);
    }

    /**
     * The caller's own preference; an empty 200 body when there is none.
     */
    @GetMapping("/{groupId}/my-preference")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PreferenceResponse> myPreference(@PathVariable String groupId) {
        Optional<CarPreference> preference = preferenceService.getMine(groupId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(preference.map(PreferenceResponse::fromEntity).orElse(null));
    }

    @GetMapping("/{groupId}/offers")
    public ResponseEntity<List<OfferResponse>> listOffers(@PathVariable String groupId) {
        List<OfferResponse> offers = offerService.listOffers(groupId).stream()
                .map(OfferResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(offers);
    }
}
