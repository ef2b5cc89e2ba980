package com.cred.freestyle.groupbuy.infrastructure.cache;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;
import com.cred.freestyle.groupbuy.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.groupbuy.repository.BuyingGroupRepository;
import com.cred.freestyle.groupbuy.service.GroupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.Optional;

import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.aGroup;
import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.identity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Integration tests for RedisCacheService against a real Redis container.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:cachedb",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "spring.data.redis.enabled=true",
    "cloud.aws.cloudwatch.enabled=false",
    "groupbuy.cache.group-ttl-seconds=2"
})
@Testcontainers
@DisplayName("Redis Cache Integration Tests")
class RedisCacheIT {

    @Container
    @SuppressWarnings("resource")
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379));
    }

    @Autowired
    private RedisCacheService redisCacheService;

    @Autowired
    private GroupService groupService;

    @Autowired
    private BuyingGroupRepository groupRepository;

    @Autowired
    private StringRedisTemplate redisTemplate;

    @MockBean
    private KafkaProducerService kafkaProducerService;

    @BeforeEach
    void setUp() {
        redisTemplate.getConnectionFactory().getConnection().serverCommands().flushAll();
        groupRepository.deleteAll();
    }

    // ========================================
    // Group snapshot
    // ========================================

    @Test
    @DisplayName("cacheGroup and getGroup - Snapshot survives the JSON round trip")
    void cacheAndGet() {
        // Given
        BuyingGroup group = aGroup().groupId("g-1").maxMembers(3).currentMembers(2)
                .status(GroupStatus.FORMING).build();

        // When
        redisCacheService.cacheGroup("g-1", group);
        Optional<BuyingGroup> cached = redisCacheService.getGroup("g-1", BuyingGroup.class);

        // Then
        assertThat(cached).isPresent();
        assertThat(cached.get().getCurrentMembers()).isEqualTo(2);
        assertThat(cached.get().getStatus()).isEqualTo(GroupStatus.FORMING);
    }

    @Test
    @DisplayName("evictGroup - Removes the snapshot")
    void evict() {
        redisCacheService.cacheGroup("g-1", aGroup().groupId("g-1").build());

        redisCacheService.evictGroup("g-1");

        assertThat(redisCacheService.getGroup("g-1", BuyingGroup.class)).isEmpty();
    }

    @Test
    @DisplayName("cacheGroup - Snapshot expires after the configured TTL")
    void expires() {
        redisCacheService.cacheGroup("g-1", aGroup().groupId("g-1").build());

        await().atMost(Duration.ofSeconds(5))
                .until(() -> redisCacheService.getGroup("g-1", BuyingGroup.class).isEmpty());
    }

    @Test
    @DisplayName("GroupService.get - Miss reads the database and fills the cache")
    void readThrough() {
        BuyingGroup group = groupService.create("Nexon", "Tata", "Pune", "https://img/n.png", 4, identity("creator"));

        groupService.get(group.getGroupId());

        assertThat(redisTemplate.hasKey("group:" + group.getGroupId())).isTrue();
    }
}
