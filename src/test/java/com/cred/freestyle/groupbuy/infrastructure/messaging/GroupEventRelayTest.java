package com.cred.freestyle.groupbuy.infrastructure.messaging;

import com.cred.freestyle.groupbuy.domain.model.BuyingGroup.GroupStatus;
import com.cred.freestyle.groupbuy.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.groupbuy.infrastructure.messaging.events.GroupEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.inOrder;

/**
 * Unit tests for GroupEventRelay.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("GroupEventRelay Tests")
class GroupEventRelayTest {

    @Mock
    private RedisCacheService cacheService;

    @Mock
    private KafkaProducerService kafkaProducerService;

    @InjectMocks
    private GroupEventRelay relay;

    @Test
    @DisplayName("Committed event evicts the cached group, then publishes")
    void evictsThenPublishes() {
        GroupEvent event = GroupEvent.memberJoined("g-1", "user-1", GroupStatus.FORMING, 1);

        relay.onGroupEvent(event);

        InOrder order = inOrder(cacheService, kafkaProducerService);
        order.verify(cacheService).evictGroup("g-1");
        order.verify(kafkaProducerService).publishGroupEvent(event);
    }
}
