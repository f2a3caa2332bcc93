package com.flowpilot.scheduler.queue;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Counters shared by both queue backends.
 *
 * <pre>
 *   flowpilot.queue.jobs.added{type}
 *   flowpilot.queue.jobs.claimed{type}
 *   flowpilot.queue.jobs.failed{type}
 * </pre>
 */
public class QueueMetrics {

    private final MeterRegistry registry;
    private final String backend;

    public QueueMetrics(MeterRegistry registry, String backend) {
        this.registry = registry;
        this.backend  = backend;
    }

    public void added(JobType type)   { count("flowpilot.queue.jobs.added", type); }
    public void claimed(JobType type) { count("flowpilot.queue.jobs.claimed", type); }
    public void failed(JobType type)  { count("flowpilot.queue.jobs.failed", type); }

    private void count(String name, JobType type) {
        registry.counter(name, "type", type.name().toLowerCase(), "backend", backend).increment();
    }
}
