package com.cred.freestyle.groupbuy.api.controller;

import com.cred.freestyle.groupbuy.api.dto.AnalyticsResponse;
import com.cred.freestyle.groupbuy.api.dto.BatchOfferRequest;
import com.cred.freestyle.groupbuy.api.dto.CompleteGroupRequest;
import com.cred.freestyle.groupbuy.api.dto.GroupResponse;
import com.cred.freestyle.groupbuy.api.dto.OfferRequest;
import com.cred.freestyle.groupbuy.api.dto.OfferResponse;
import com.cred.freestyle.groupbuy.api.dto.RoleUpdateRequest;
import com.cred.freestyle.groupbuy.api.dto.UserResponse;
import com.cred.freestyle.groupbuy.domain.model.DealerOffer;
import com.cred.freestyle.groupbuy.security.IdentityGate;
import com.cred.freestyle.groupbuy.security.SecurityUtils;
import com.cred.freestyle.groupbuy.security.UserIdentity;
import com.cred.freestyle.groupbuy.service.AnalyticsService;
import com.cred.freestyle.groupbuy.service.AuthService;
import com.cred.freestyle.groupbuy.service.GroupService;
import com.cred.freestyle.groupbuy.service.OfferService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for admin operations: offers, completion, analytics and roles.
 *
 * Authorization: ADMIN role, checked by method security and again against the
 * freshly resolved identity.
 *
 * @author Group Buy Team
 */
@RestController
@RequestMapping("/api/v1/admin")
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    private final GroupService groupService;
    private final OfferService offerService;
    private final AnalyticsService analyticsService;
    private final AuthService authService;
    private final IdentityGate identityGate;

    public AdminController(
            GroupService groupService,
            OfferService offerService,
            AnalyticsService analyticsService,
            AuthService authService,
            IdentityGate identityGate
    ) {
        this.groupService = groupService;
        this.offerService = offerService;
        this.analyticsService = analyticsService;
        this.authService = authService;
        this.identityGate = identityGate;
    }

    @GetMapping("/locked-groups")
    public ResponseEntity<List<GroupResponse>> lockedGroups() {
        admin();
        List<GroupResponse> groups = groupService.listLocked().stream()
                .map(GroupResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(groups);
    }

    @PostMapping("/groups/{groupId}/offers")
    public ResponseEntity<OfferResponse> createOffer(
            @PathVariable String groupId,
            @Valid @RequestBody OfferRequest request
    ) {
        DealerOffer offer = offerService.createOffer(groupId, request.toOfferTerms(), admin());
        return ResponseEntity.status(HttpStatus.CREATED).body(OfferResponse.fromEntity(offer));
    }

    @PostMapping("/groups/{groupId}/offers/batch")
    public ResponseEntity<List<OfferResponse>> createOffers(
            @PathVariable String groupId,
            @Valid @RequestBody BatchOfferRequest request
    ) {
        List<DealerOffer> offers = offerService.createOffers(
                groupId,
                request.getOffers().stream().map(OfferRequest::toOfferTerms).collect(Collectors.toList()),
                admin()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(offers.stream()
                .map(OfferResponse::fromEntity)
                .collect(Collectors.toList()));
    }

    @PostMapping("/groups/{groupId}/complete")
    public ResponseEntity<GroupResponse> completeGroup(
            @PathVariable String groupId,
            @Valid @RequestBody CompleteGroupRequest request
    ) {
        return ResponseEntity.ok(GroupResponse.fromEntity(
                offerService.completeGroup(groupId, request.getWinningOfferId(), admin())));
    }

    @GetMapping("/groups/{groupId}/analytics")
    public ResponseEntity<AnalyticsResponse> analytics(@PathVariable String groupId) {
        admin();
        return ResponseEntity.ok(AnalyticsResponse.fromSnapshot(analyticsService.groupSnapshot(groupId)));
    }

    @PutMapping("/users/{userId}/roles")
    public ResponseEntity<UserResponse> updateRoles(
            @PathVariable String userId,
            @RequestBody RoleUpdateRequest request
    ) {
        return ResponseEntity.ok(UserResponse.fromEntity(
                authService.updateRoles(userId, request.getPremium(), request.getAdmin(), admin())));
    }

    private UserIdentity admin() {
        return identityGate.requireAdmin(SecurityUtils.currentIdentity());
    }
}
