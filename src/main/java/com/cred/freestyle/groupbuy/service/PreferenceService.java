package com.cred.freestyle.groupbuy.service;

import com.cred.freestyle.groupbuy.domain.model.CarPreference;
import com.cred.freestyle.groupbuy.domain.model.GroupMember;
import com.cred.freestyle.groupbuy.domain.model.VehicleChoice;
import com.cred.freestyle.groupbuy.exception.NotGroupMemberException;
import com.cred.freestyle.groupbuy.exception.ResourceNotFoundException;
import com.cred.freestyle.groupbuy.repository.BuyingGroupRepository;
import com.cred.freestyle.groupbuy.repository.CarPreferenceRepository;
import com.cred.freestyle.groupbuy.repository.GroupMemberRepository;
import com.cred.freestyle.groupbuy.security.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Members' vehicle configurations within a group. One record per (user, group), last write wins.
 *
 * @author Group Buy Team
 */
@Service
public class PreferenceService {

    private static final Logger logger = LoggerFactory.getLogger(PreferenceService.class);

    private final CarPreferenceRepository preferenceRepository;
    private final GroupMemberRepository memberRepository;
    private final BuyingGroupRepository groupRepository;

    public PreferenceService(
            CarPreferenceRepository preferenceRepository,
            GroupMemberRepository memberRepository,
            BuyingGroupRepository groupRepository
    ) {
        this.preferenceRepository = preferenceRepository;
        this.memberRepository = memberRepository;
        this.groupRepository = groupRepository;
    }

    /**
     * Save a member's preference. The membership row is locked so that two
     * concurrent saves by the same member cannot both insert.
     *
     * @param groupId Group ID
     * @param member Authenticated user
     * @param choice Vehicle configuration
     * @return Stored preference
     * @throws NotGroupMemberException if the user has not joined the group
     */
    @Transactional
    public CarPreference save(String groupId, UserIdentity member, VehicleChoice choice) {
        GroupMember membership = memberRepository.findByGroupIdAndUserIdWithLock(groupId, member.getUserId())
                .orElseThrow(() -> new NotGroupMemberException(member.getUserId(), groupId));

        return upsert(groupId, membership.getUserId(), membership.getUserName(), choice);
    }

    /**
     * Insert or overwrite the preference of a user. Callers must hold either the
     * group lock (join) or the membership lock (save).
     */
    @Transactional
    public CarPreference upsert(String groupId, String userId, String userName, VehicleChoice choice) {
        Optional<CarPreference> existing = preferenceRepository.findByUserIdAndGroupId(userId, groupId);

        CarPreference preference;
        if (existing.isPresent()) {
            preference = existing.get();
            preference.applyChoice(choice);
            logger.debug("Updating preference: userId={}, groupId={}", userId, groupId);
        } else {
            preference = CarPreference.builder()
                    .userId(userId)
                    .groupId(groupId)
                    .userName(userName)
                    .carModel(choice.getCarModel())
                    .variant(choice.getVariant())
                    .transmission(choice.getTransmission())
                    .onRoadPrice(choice.getOnRoadPrice())
                    .build();
            logger.debug("Creating preference: userId={}, groupId={}", userId, groupId);
        }

        return preferenceRepository.save(preference);
    }

    @Transactional(readOnly = true)
    public List<CarPreference> getForGroup(String groupId) {
        if (!groupRepository.existsById(groupId)) {
            throw new ResourceNotFoundException("Group", groupId);
        }
        return preferenceRepository.findByGroupId(groupId);
    }

    @Transactional(readOnly = true)
    public Optional<CarPreference> getMine(String groupId, String userId) {
        return preferenceRepository.findByUserIdAndGroupId(userId, groupId);
    }
}
