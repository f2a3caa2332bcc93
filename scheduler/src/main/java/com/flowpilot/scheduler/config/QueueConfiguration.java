package com.flowpilot.scheduler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.scheduler.queue.JobQueue;
import com.flowpilot.scheduler.queue.QueueMetrics;
import com.flowpilot.scheduler.queue.database.DatabaseJobQueue;
import com.flowpilot.scheduler.queue.database.QueuedJobRepository;
import com.flowpilot.scheduler.queue.memory.MemoryJobQueue;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the process-wide job queue once, from FP_QUEUE_MODE.
 *
 * An unknown mode fails here, at startup, rather than at the first enqueue.
 */
@Configuration
public class QueueConfiguration {

    private static final Logger log = LoggerFactory.getLogger(QueueConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobQueue jobQueue(SystemConfig config,
                             Clock clock,
                             MeterRegistry meterRegistry,
                             ObjectMapper objectMapper,
                             ObjectProvider<QueuedJobRepository> repository) {
        QueueMode mode = config.getQueueMode();
        log.info("Using {} job queue", mode);
        return switch (mode) {
            case MEMORY      -> new MemoryJobQueue(clock, new QueueMetrics(meterRegistry, "memory"));
            case DISTRIBUTED -> new DatabaseJobQueue(repository.getObject(), objectMapper, clock,
                    new QueueMetrics(meterRegistry, "database"));
        };
    }
}
