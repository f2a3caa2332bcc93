package com.flowpilot.scheduler.flowrun;

import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;

/**
 * Hands failed production runs to whoever listens for {@link FlowIssueEvent}.
 */
public class ApplicationEventIssueTracker implements IssueTracker {

    private final ApplicationEventPublisher publisher;
    private final Clock                     clock;

    public ApplicationEventIssueTracker(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = publisher;
        this.clock     = clock;
    }

    @Override
    public void add(String flowId, String projectId) {
        publisher.publishEvent(new FlowIssueEvent(flowId, projectId, clock.instant()));
    }
}
