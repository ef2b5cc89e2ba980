package com.cred.freestyle.groupbuy;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup;
import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;
import com.cred.freestyle.groupbuy.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.groupbuy.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.groupbuy.repository.BuyingGroupRepository;
import com.cred.freestyle.groupbuy.security.RestAccessDeniedHandler;
import com.cred.freestyle.groupbuy.security.RestAuthenticationEntryPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;

import static com.cred.freestyle.groupbuy.testutil.TestDataBuilder.aGroup;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the whole application over H2 so wiring and query validation run on every build.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:bootdb",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "spring.data.redis.enabled=false",
    "cloud.aws.cloudwatch.enabled=false"
})
@DisplayName("Group Buy Application Context Tests")
class GroupBuyApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private BuyingGroupRepository groupRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @MockBean
    private RedisCacheService redisCacheService;

    @MockBean
    private KafkaProducerService kafkaProducerService;

    @Test
    @DisplayName("Context starts with the security error writers registered")
    void contextLoads() {
        assertThat(context.getBean(RestAuthenticationEntryPoint.class)).isNotNull();
        assertThat(context.getBean(RestAccessDeniedHandler.class)).isNotNull();
        assertThat(context.getBean(BuyingGroupRepository.class)).isNotNull();
    }

    @Test
    @DisplayName("Filling the last slot stamps updatedAt and locks the group")
    void conditionalUpdates_StampUpdatedAt() {
        // Given
        Instant before = Instant.now();
        BuyingGroup group = groupRepository.save(aGroup().maxMembers(1).build());
        String groupId = group.getGroupId();

        // When
        Integer locked = transactionTemplate.execute(status -> {
            groupRepository.incrementMemberCount(groupId, GroupStatus.FORMING);
            return groupRepository.lockIfFull(groupId, GroupStatus.FORMING, GroupStatus.LOCKED);
        });

        // Then
        BuyingGroup reloaded = groupRepository.findById(groupId).orElseThrow();
        assertThat(locked).isEqualTo(1);
        assertThat(reloaded.getCurrentMembers()).isEqualTo(1);
        assertThat(reloaded.getStatus()).isEqualTo(GroupStatus.LOCKED);
        // The database clock may carry a zone offset relative to the JVM
        assertThat(reloaded.getUpdatedAt())
                .isBetween(before.minus(Duration.ofDays(1)), Instant.now().plus(Duration.ofDays(1)));
    }
}
