package com.cred.freestyle.groupbuy.infrastructure.messaging;

import com.cred.freestyle.groupbuy.infrastructure.messaging.events.GroupEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer service for publishing buying group lifecycle events.
 *
 * Topic partitioning strategy:
 * - Key: group_id (all events of one group land on the same partition, in order)
 *
 * Publishing is fire-and-forget: the state change is already committed, a failed send is logged.
 *
 * @author Group Buy Team
 */
@Service
public class KafkaProducerService {

    private static final Logger logger = LoggerFactory.getLogger(KafkaProducerService.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String groupEventsTopic;

    public KafkaProducerService(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${groupbuy.kafka.group-events-topic:group-buy-events}") String groupEventsTopic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.groupEventsTopic = groupEventsTopic;
    }

    /**
     * Publish a group lifecycle event.
     *
     * @param event Group event
     */
    public void publishGroupEvent(GroupEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing group event {} for group {}", event.getEventType(), event.getGroupId(), e);
            return;
        }

        try {
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    groupEventsTopic,
                    event.getGroupId(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Published {} event for group {}, partition: {}",
                            event.getEventType(), event.getGroupId(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} event for group {}",
                            event.getEventType(), event.getGroupId(), ex);
                }
            });
        } catch (Exception e) {
            logger.error("Kafka send rejected {} event for group {}", event.getEventType(), event.getGroupId(), e);
        }
    }
}
