package com.cred.freestyle.groupbuy.infrastructure.messaging;

import com.cred.freestyle.groupbuy.infrastructure.messaging.events.GroupEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Raises group events as Spring application events.
 * Delivery to Kafka happens in GroupEventRelay once the surrounding transaction commits,
 * so a rolled-back join or vote never produces an event.
 *
 * @author Group Buy Team
 */
@Component
public class GroupEventPublisher {

    private final ApplicationEventPublisher delegate;

    public GroupEventPublisher(ApplicationEventPublisher delegate) {
        this.delegate = delegate;
    }

    public void publish(GroupEvent event) {
        delegate.publishEvent(event);
    }
}
