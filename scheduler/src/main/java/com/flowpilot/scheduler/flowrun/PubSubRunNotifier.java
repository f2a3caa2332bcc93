package com.flowpilot.scheduler.flowrun;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.scheduler.model.FlowRun;
import com.flowpilot.scheduler.pubsub.PubSub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broadcasts finished runs so that every scheduler instance learns about
 * them, including the one holding a waiting synchronous caller.
 */
public class PubSubRunNotifier implements RunNotifier {

    private static final Logger log = LoggerFactory.getLogger(PubSubRunNotifier.class);

    private final PubSub       pubSub;
    private final ObjectMapper objectMapper;

    public PubSubRunNotifier(PubSub pubSub, ObjectMapper objectMapper) {
        this.pubSub       = pubSub;
        this.objectMapper = objectMapper;
    }

    @Override
    public void notifyRun(FlowRun flowRun) {
        try {
            String payload = objectMapper.writeValueAsString(FlowRunFinishedEvent.of(flowRun));
            pubSub.publish(FlowRunFinishedEvent.CHANNEL, payload);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize finished event of run {}", flowRun.id(), e);
        }
    }
}
