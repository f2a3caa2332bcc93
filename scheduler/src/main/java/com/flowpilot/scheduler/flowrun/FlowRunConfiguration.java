package com.flowpilot.scheduler.flowrun;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.scheduler.pubsub.PubSub;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Default collaborators of {@link FlowRunSideEffects}. The hosting
 * application replaces any of them by declaring its own bean.
 */
@Configuration
public class FlowRunConfiguration {

    @Bean
    @ConditionalOnMissingBean(FlowRunHooks.class)
    public FlowRunHooks flowRunHooks(MeterRegistry meterRegistry) {
        return new MeteredFlowRunHooks(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean(IssueTracker.class)
    public IssueTracker issueTracker(ApplicationEventPublisher eventPublisher, Clock clock) {
        return new ApplicationEventIssueTracker(eventPublisher, clock);
    }

    @Bean
    @ConditionalOnMissingBean(RunNotifier.class)
    public RunNotifier runNotifier(PubSub pubSub, ObjectMapper objectMapper) {
        return new PubSubRunNotifier(pubSub, objectMapper);
    }

    @Bean
    public FlowRunFinishedRelay flowRunFinishedRelay(PubSub pubSub, ObjectMapper objectMapper,
                                                     ApplicationEventPublisher eventPublisher) {
        return new FlowRunFinishedRelay(pubSub, objectMapper, eventPublisher);
    }
}
