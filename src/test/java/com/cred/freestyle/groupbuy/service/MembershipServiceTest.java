package com.cred.freestyle.groupbuy.service;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;
import com.cred.freestyle.groupbuy.domain.model.GroupMember;
import com.cred.freestyle.groupbuy.domain.model.Payment;
import com.cred.freestyle.groupbuy.exception.AlreadyMemberException;
import com.cred.freestyle.groupbuy.exception.GroupFullException;
import com.cred.freestyle.groupbuy.exception.PaymentRequiredException;
import com.cred.freestyle.groupbuy.exception.ResourceNotFoundException;
import com.cred.freestyle.groupbuy.infrastructure.messaging.GroupEventPublisher;
import com.cred.freestyle.groupbuy.infrastructure.messaging.events.GroupEvent;
import com.cred.freestyle.groupbuy.infrastructure.messaging.events.GroupEvent.EventType;
import com.cred.freestyle.groupbuy.infrastructure.metrics.GroupBuyMetricsService;
import com.cred.freestyle.groupbuy.repository.BuyingGroupRepository;
import com.cred.freestyle.groupbuy.repository.GroupMemberRepository;
import com.cred.freestyle.groupbuy.security.UserIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.aGroup;
import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.aMember;
import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.aPayment;
import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.identity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for MembershipService.
 * Tests the join precondition order and the FORMING → LOCKED transition.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("MembershipService Unit Tests")
class MembershipServiceTest {

    @Mock
    private BuyingGroupRepository groupRepository;

    @Mock
    private GroupMemberRepository memberRepository;

    @Mock
    private PaymentService paymentService;

    @Mock
    private PreferenceService preferenceService;

    @Mock
    private GroupEventPublisher eventPublisher;

    @Mock
    private GroupBuyMetricsService metricsService;

    @InjectMocks
    private MembershipService membershipService;

    private String groupId;
    private UserIdentity user;
    private Payment payment;

    @BeforeEach
    void setUp() {
        groupId = "group-1";
        user = identity("user-1");
        payment = aPayment("user-1", groupId).build();
    }

    // ========================================
    // join() Tests
    // ========================================

    @Test
    @DisplayName("join - Success: member stored, preference seeded, counter incremented")
    void join_Success() {
        // Given
        BuyingGroup before = aGroup().groupId(groupId).maxMembers(3).currentMembers(1).build();
        BuyingGroup after = aGroup().groupId(groupId).maxMembers(3).currentMembers(2).build();
        when(paymentService.findPayment(groupId, "user-1")).thenReturn(Optional.of(payment));
        when(groupRepository.findByIdWithLock(groupId)).thenReturn(Optional.of(before));
        when(memberRepository.existsByGroupIdAndUserId(groupId, "user-1")).thenReturn(false);
        when(groupRepository.incrementMemberCount(groupId, GroupStatus.FORMING)).thenReturn(1);
        when(groupRepository.lockIfFull(groupId, GroupStatus.FORMING, GroupStatus.LOCKED)).thenReturn(0);
        when(groupRepository.findById(groupId)).thenReturn(Optional.of(after));

        // When
        BuyingGroup result = membershipService.join(groupId, user);

        // Then
        assertThat(result.getCurrentMembers()).isEqualTo(2);
        assertThat(result.getStatus()).isEqualTo(GroupStatus.FORMING);

        ArgumentCaptor<GroupMember> memberCaptor = ArgumentCaptor.forClass(GroupMember.class);
        verify(memberRepository).saveAndFlush(memberCaptor.capture());
        assertThat(memberCaptor.getValue().getUserId()).isEqualTo("user-1");
        assertThat(memberCaptor.getValue().getUserName()).isEqualTo(user.getName());

        verify(preferenceService).upsert(groupId, "user-1", user.getName(), payment.toVehicleChoice());
        verify(eventPublisher, times(1)).publish(any(GroupEvent.class));
        verify(metricsService).recordJoinSuccess();
        verify(metricsService, never()).recordGroupLocked();
    }

    @Test
    @DisplayName("join - Last slot locks the group and publishes GROUP_LOCKED")
    void join_LastSlotLocksGroup() {
        // Given
        BuyingGroup before = aGroup().groupId(groupId).maxMembers(2).currentMembers(1).build();
        BuyingGroup after = aGroup().groupId(groupId).maxMembers(2).currentMembers(2).status(GroupStatus.LOCKED).build();
        when(paymentService.findPayment(groupId, "user-1")).thenReturn(Optional.of(payment));
        when(groupRepository.findByIdWithLock(groupId)).thenReturn(Optional.of(before));
        when(groupRepository.incrementMemberCount(groupId, GroupStatus.FORMING)).thenReturn(1);
        when(groupRepository.lockIfFull(groupId, GroupStatus.FORMING, GroupStatus.LOCKED)).thenReturn(1);
        when(groupRepository.findById(groupId)).thenReturn(Optional.of(after));

        // When
        BuyingGroup result = membershipService.join(groupId, user);

        // Then
        assertThat(result.getStatus()).isEqualTo(GroupStatus.LOCKED);

        ArgumentCaptor<GroupEvent> eventCaptor = ArgumentCaptor.forClass(GroupEvent.class);
        verify(eventPublisher, times(2)).publish(eventCaptor.capture());
        assertThat(eventCaptor.getAllValues())
                .extracting(GroupEvent::getEventType)
                .containsExactly(EventType.MEMBER_JOINED, EventType.GROUP_LOCKED);
        verify(metricsService).recordGroupLocked();
    }

    @Test
    @DisplayName("join - No payment is PaymentRequired, checked before the group exists")
    void join_PaymentRequired() {
        when(paymentService.findPayment(groupId, "user-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> membershipService.join(groupId, user))
                .isInstanceOf(PaymentRequiredException.class);

        verify(groupRepository, never()).findByIdWithLock(anyString());
        verify(metricsService).recordJoinRejected("PAYMENT_REQUIRED");
    }

    @Test
    @DisplayName("join - Unknown group is NotFound")
    void join_GroupNotFound() {
        when(paymentService.findPayment(groupId, "user-1")).thenReturn(Optional.of(payment));
        when(groupRepository.findByIdWithLock(groupId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> membershipService.join(groupId, user))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("join - Full group is GroupFull, even for an existing member")
    void join_GroupFull() {
        BuyingGroup full = aGroup().groupId(groupId).maxMembers(2).currentMembers(2).status(GroupStatus.LOCKED).build();
        when(paymentService.findPayment(groupId, "user-1")).thenReturn(Optional.of(payment));
        when(groupRepository.findByIdWithLock(groupId)).thenReturn(Optional.of(full));

        assertThatThrownBy(() -> membershipService.join(groupId, user))
                .isInstanceOf(GroupFullException.class);

        verify(memberRepository, never()).existsByGroupIdAndUserId(anyString(), anyString());
        verify(memberRepository, never()).saveAndFlush(any());
        verify(metricsService).recordJoinRejected("GROUP_FULL");
    }

    @Test
    @DisplayName("join - Refused counter update is GroupFull and nothing is locked or published")
    void join_CounterRefused() {
        // Given
        BuyingGroup forming = aGroup().groupId(groupId).maxMembers(3).currentMembers(1).build();
        when(paymentService.findPayment(groupId, "user-1")).thenReturn(Optional.of(payment));
        when(groupRepository.findByIdWithLock(groupId)).thenReturn(Optional.of(forming));
        when(memberRepository.existsByGroupIdAndUserId(groupId, "user-1")).thenReturn(false);
        when(groupRepository.incrementMemberCount(groupId, GroupStatus.FORMING)).thenReturn(0);

        // When / Then
        assertThatThrownBy(() -> membershipService.join(groupId, user))
                .isInstanceOf(GroupFullException.class);

        verify(groupRepository, never()).lockIfFull(anyString(), any(), any());
        verify(eventPublisher, never()).publish(any());
        verify(metricsService).recordJoinRejected("GROUP_FULL");
        verify(metricsService, never()).recordJoinSuccess();
    }

    @Test
    @DisplayName("join - Group past FORMING with free slots is GroupFull")
    void join_NotForming() {
        BuyingGroup negotiating = aGroup().groupId(groupId).maxMembers(5).currentMembers(1)
                .status(GroupStatus.NEGOTIATION).build();
        when(paymentService.findPayment(groupId, "user-1")).thenReturn(Optional.of(payment));
        when(groupRepository.findByIdWithLock(groupId)).thenReturn(Optional.of(negotiating));

        assertThatThrownBy(() -> membershipService.join(groupId, user))
                .isInstanceOf(GroupFullException.class);
    }

    @Test
    @DisplayName("join - Existing member is AlreadyMember")
    void join_AlreadyMember() {
        BuyingGroup group = aGroup().groupId(groupId).maxMembers(5).currentMembers(1).build();
        when(paymentService.findPayment(groupId, "user-1")).thenReturn(Optional.of(payment));
        when(groupRepository.findByIdWithLock(groupId)).thenReturn(Optional.of(group));
        when(memberRepository.existsByGroupIdAndUserId(groupId, "user-1")).thenReturn(true);

        assertThatThrownBy(() -> membershipService.join(groupId, user))
                .isInstanceOf(AlreadyMemberException.class);

        verify(groupRepository, never()).incrementMemberCount(anyString(), any());
    }

    @Test
    @DisplayName("join - Unique index violation is AlreadyMember")
    void join_RacingDuplicate() {
        BuyingGroup group = aGroup().groupId(groupId).maxMembers(5).currentMembers(1).build();
        when(paymentService.findPayment(groupId, "user-1")).thenReturn(Optional.of(payment));
        when(groupRepository.findByIdWithLock(groupId)).thenReturn(Optional.of(group));
        when(memberRepository.saveAndFlush(any(GroupMember.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatThrownBy(() -> membershipService.join(groupId, user))
                .isInstanceOf(AlreadyMemberException.class);

        verify(groupRepository, never()).incrementMemberCount(anyString(), any());
    }

    @Test
    @DisplayName("join - Conditional increment touching no row aborts with GroupFull")
    void join_IncrementRejected() {
        BuyingGroup group = aGroup().groupId(groupId).maxMembers(5).currentMembers(1).build();
        when(paymentService.findPayment(groupId, "user-1")).thenReturn(Optional.of(payment));
        when(groupRepository.findByIdWithLock(groupId)).thenReturn(Optional.of(group));
        when(groupRepository.incrementMemberCount(groupId, GroupStatus.FORMING)).thenReturn(0);

        assertThatThrownBy(() -> membershipService.join(groupId, user))
                .isInstanceOf(GroupFullException.class);

        verify(groupRepository, never()).lockIfFull(anyString(), any(), any());
        verify(eventPublisher, never()).publish(any());
    }

    // ========================================
    // listMembers() Tests
    // ========================================

    @Test
    @DisplayName("listMembers - Returns members of an existing group")
    void listMembers_Success() {
        when(groupRepository.existsById(groupId)).thenReturn(true);
        when(memberRepository.findByGroupId(groupId)).thenReturn(List.of(
                aMember("user-1", groupId).build(),
                aMember("user-2", groupId).build()));

        List<GroupMember> members = membershipService.listMembers(groupId);

        assertThat(members).extracting(GroupMember::getUserId).containsExactlyInAnyOrder("user-1", "user-2");
    }

    @Test
    @DisplayName("listMembers - Unknown group is NotFound")
    void listMembers_GroupNotFound() {
        when(groupRepository.existsById(groupId)).thenReturn(false);

        assertThatThrownBy(() -> membershipService.listMembers(groupId))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(memberRepository, never()).findByGroupId(eq(groupId));
    }
}
