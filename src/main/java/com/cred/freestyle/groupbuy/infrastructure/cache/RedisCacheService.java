package com.cred.freestyle.groupbuy.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis cache for the public group read path.
 *
 * Cache Keys:
 * - group:{group_id} -> Group snapshot (JSON)
 *
 * Every failure is logged and treated as a miss; the database stays the source of truth.
 *
 * @author Group Buy Team
 */
@Service
public class RedisCacheService {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheService.class);

    private static final String GROUP_PREFIX = "group:";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration groupTtl;

    public RedisCacheService(
            RedisTemplate<String, String> redisTemplate,
            ObjectMapper objectMapper,
            @Value("${groupbuy.cache.group-ttl-seconds:30}") long groupTtlSeconds
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.groupTtl = Duration.ofSeconds(groupTtlSeconds);
    }

    /**
     * Cache group data as JSON.
     *
     * @param groupId Group ID
     * @param groupData Group snapshot to cache
     */
    public <T> void cacheGroup(String groupId, T groupData) {
        try {
            String json = objectMapper.writeValueAsString(groupData);
            redisTemplate.opsForValue().set(GROUP_PREFIX + groupId, json, groupTtl);
            logger.debug("Cached group data for: {}", groupId);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing group data for group: {}", groupId, e);
        } catch (Exception e) {
            logger.error("Error caching group data for group: {}", groupId, e);
        }
    }

    /**
     * Get cached group data.
     *
     * @param groupId Group ID
     * @param clazz Snapshot class type
     * @return Optional containing the snapshot if cached
     */
    public <T> Optional<T> getGroup(String groupId, Class<T> clazz) {
        try {
            String json = redisTemplate.opsForValue().get(GROUP_PREFIX + groupId);
            if (json != null) {
                logger.debug("Cache hit for group: {}", groupId);
                return Optional.of(objectMapper.readValue(json, clazz));
            }
            logger.debug("Cache miss for group: {}", groupId);
            return Optional.empty();
        } catch (Exception e) {
            logger.error("Error getting group from cache for group: {}", groupId, e);
            return Optional.empty();
        }
    }

    /**
     * Invalidate the cached snapshot of a group.
     *
     * @param groupId Group ID
     */
    public void evictGroup(String groupId) {
        try {
            redisTemplate.delete(GROUP_PREFIX + groupId);
            logger.debug("Invalidated group cache for: {}", groupId);
        } catch (Exception e) {
            logger.error("Error invalidating group cache for group: {}", groupId, e);
        }
    }
}
