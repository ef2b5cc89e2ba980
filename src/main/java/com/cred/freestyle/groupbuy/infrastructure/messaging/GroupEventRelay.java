package com.cred.freestyle.groupbuy.infrastructure.messaging;

import com.cred.freestyle.groupbuy.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.groupbuy.infrastructure.messaging.events.GroupEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * After-commit side effects of group mutations: cache eviction and the Kafka event.
 *
 * @author Group Buy Team
 */
@Component
public class GroupEventRelay {

    private static final Logger logger = LoggerFactory.getLogger(GroupEventRelay.class);

    private final RedisCacheService cacheService;
    private final KafkaProducerService kafkaProducerService;

    public GroupEventRelay(RedisCacheService cacheService, KafkaProducerService kafkaProducerService) {
        this.cacheService = cacheService;
        this.kafkaProducerService = kafkaProducerService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onGroupEvent(GroupEvent event) {
        logger.debug("Relaying committed group event: {}", event);
        cacheService.evictGroup(event.getGroupId());
        kafkaProducerService.publishGroupEvent(event);
    }
}
