package com.cred.freestyle.groupbuy.service;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;
import com.cred.freestyle.groupbuy.exception.ResourceNotFoundException;
import com.cred.freestyle.groupbuy.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.groupbuy.infrastructure.metrics.GroupBuyMetricsService;
import com.cred.freestyle.groupbuy.repository.BuyingGroupRepository;
import com.cred.freestyle.groupbuy.security.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Service for creating, searching and reading buying groups.
 * Single-group reads go through the Redis cache; every state change evicts it after commit.
 *
 * @author Group Buy Team
 */
@Service
public class GroupService {

    private static final Logger logger = LoggerFactory.getLogger(GroupService.class);

    private static final String CACHE_TYPE = "group";

    private final BuyingGroupRepository groupRepository;
    private final RedisCacheService cacheService;
    private final GroupBuyMetricsService metricsService;
    private final int listLimit;

    public GroupService(
            BuyingGroupRepository groupRepository,
            RedisCacheService cacheService,
            GroupBuyMetricsService metricsService,
            @Value("${groupbuy.groups.list-limit:1000}") int listLimit
    ) {
        this.groupRepository = groupRepository;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
        this.listLimit = listLimit;
    }

    /**
     * Create a new group in FORMING status with no members.
     *
     * @param carModel Car model the group is buying
     * @param brand Brand
     * @param city City
     * @param imageUrl Image shown on the group card
     * @param maxMembers Capacity, must be positive
     * @param creator Admin creating the group
     * @return Created group
     */
    @Transactional
    public BuyingGroup create(String carModel, String brand, String city, String imageUrl,
                              int maxMembers, UserIdentity creator) {
        if (isBlank(carModel) || isBlank(brand) || isBlank(city) || isBlank(imageUrl)) {
            throw new IllegalArgumentException("carModel, brand, city and imageUrl are required");
        }
        if (maxMembers < 1) {
            throw new IllegalArgumentException("maxMembers must be at least 1");
        }

        BuyingGroup group = BuyingGroup.builder()
                .carModel(carModel.trim())
                .brand(brand.trim())
                .city(city.trim())
                .imageUrl(imageUrl.trim())
                .maxMembers(maxMembers)
                .currentMembers(0)
                .status(GroupStatus.FORMING)
                .build();

        BuyingGroup saved = groupRepository.save(group);
        metricsService.recordGroupCreated();
        logger.info("Group created: groupId={}, carModel={}, city={}, maxMembers={}, by={}",
                saved.getGroupId(), saved.getCarModel(), saved.getCity(), maxMembers, creator.getUserId());
        return saved;
    }

    /**
     * Search groups. Brand and city are exact filters; search is a case-insensitive
     * substring match over car model, brand and city. Blank arguments are ignored.
     *
     * @return At most groupbuy.groups.list-limit groups
     */
    @Transactional(readOnly = true)
    public List<BuyingGroup> list(String brand, String city, String search) {
        String pattern = isBlank(search)
                ? null
                : "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%";

        List<BuyingGroup> groups = groupRepository.search(
                blankToNull(brand), blankToNull(city), pattern, PageRequest.of(0, listLimit));
        logger.debug("Listed {} groups: brand={}, city={}, search={}", groups.size(), brand, city, search);
        return groups;
    }

    /**
     * Get a group by ID, cache first.
     *
     * @throws ResourceNotFoundException if the group does not exist
     */
    @Transactional(readOnly = true)
    public BuyingGroup get(String groupId) {
        Optional<BuyingGroup> cached = cacheService.getGroup(groupId, BuyingGroup.class);
        if (cached.isPresent()) {
            metricsService.recordCacheHit(CACHE_TYPE);
            return cached.get();
        }

        metricsService.recordCacheMiss(CACHE_TYPE);
        BuyingGroup group = groupRepository.findById(groupId)
                .orElseThrow(() -> new ResourceNotFoundException("Group", groupId));
        cacheService.cacheGroup(groupId, group);
        return group;
    }

    @Transactional(readOnly = true)
    public List<BuyingGroup> listLocked() {
        return groupRepository.findByStatus(GroupStatus.LOCKED);
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
