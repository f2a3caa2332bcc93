package com.flowpilot.scheduler.flowrun;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.scheduler.pubsub.PubSub;
import com.flowpilot.scheduler.pubsub.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Listens on {@link FlowRunFinishedEvent#CHANNEL} and re-publishes each
 * message as a local Spring application event.
 */
public class FlowRunFinishedRelay implements InitializingBean, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(FlowRunFinishedRelay.class);

    private final PubSub                    pubSub;
    private final ObjectMapper              objectMapper;
    private final ApplicationEventPublisher eventPublisher;

    private Subscription subscription;

    public FlowRunFinishedRelay(PubSub pubSub, ObjectMapper objectMapper,
                                ApplicationEventPublisher eventPublisher) {
        this.pubSub         = pubSub;
        this.objectMapper   = objectMapper;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void afterPropertiesSet() {
        subscription = pubSub.subscribe(FlowRunFinishedEvent.CHANNEL, this::onMessage);
    }

    @Override
    public void destroy() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    void onMessage(String message) {
        try {
            eventPublisher.publishEvent(objectMapper.readValue(message, FlowRunFinishedEvent.class));
        } catch (Exception e) {
            log.warn("Failed to deserialize flow run finished event: {}", e.getMessage());
        }
    }
}
