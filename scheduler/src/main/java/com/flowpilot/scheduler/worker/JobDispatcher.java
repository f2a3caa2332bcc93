package com.flowpilot.scheduler.worker;

import com.flowpilot.scheduler.config.SystemConfig;
import com.flowpilot.scheduler.config.SystemProp;
import com.flowpilot.scheduler.queue.ClaimedJob;
import com.flowpilot.scheduler.queue.JobData;
import com.flowpilot.scheduler.queue.JobQueue;
import com.flowpilot.scheduler.trigger.TriggerFailureThresholdPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background loop that drains the job queue.
 *
 * Every 500 ms it claims jobs until either the queue has nothing ready or
 * every worker thread is busy, and runs them on a fixed pool of
 * FP_FLOW_WORKER_CONCURRENCY threads. Claims never exceed free capacity, so a
 * claimed job never waits behind another one in the pool.
 *
 * Only runs in WORKER and WORKER_AND_APP containers that provide a
 * {@link JobConsumer}.
 */
@Component
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobQueue                      jobQueue;
    private final JobConsumer                   consumer;
    private final TriggerFailureThresholdPolicy thresholdPolicy;
    private final MeterRegistry                 meterRegistry;
    private final boolean                       enabled;
    private final int                           concurrency;
    private final Duration                      stallTimeout;
    private final String                        workerId;
    private final ExecutorService               workers;
    private final AtomicInteger                 inFlight = new AtomicInteger();

    public JobDispatcher(JobQueue jobQueue,
                         Optional<JobConsumer> consumer,
                         TriggerFailureThresholdPolicy thresholdPolicy,
                         MeterRegistry meterRegistry,
                         SystemConfig config) {
        this.jobQueue        = jobQueue;
        this.consumer        = consumer.orElse(null);
        this.thresholdPolicy = thresholdPolicy;
        this.meterRegistry   = meterRegistry;
        this.concurrency     = config.getNumberOrThrow(SystemProp.FLOW_WORKER_CONCURRENCY);
        // A job still unacknowledged after twice the flow timeout belongs to a dead worker.
        this.stallTimeout    = Duration.ofSeconds(2L * config.getNumberOrThrow(SystemProp.FLOW_TIMEOUT_SECONDS));
        this.enabled         = config.isWorker() && this.consumer != null;
        this.workerId        = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        this.workers         = enabled ? Executors.newFixedThreadPool(concurrency) : null;

        if (enabled) {
            log.info("Job dispatcher '{}' started with {} worker threads", workerId, concurrency);
        } else {
            log.info("Job dispatcher disabled (worker container={}, consumer present={})",
                    config.isWorker(), this.consumer != null);
        }
    }

    /**
     * Tick: claim as many ready jobs as there are idle worker threads.
     *
     * fixedDelay means the next tick starts 500 ms after this one returns, so
     * an empty queue is polled at a steady, low rate.
     */
    @Scheduled(fixedDelay = 500)
    public void tick() {
        if (!enabled) {
            return;
        }
        while (inFlight.get() < concurrency) {
            Optional<ClaimedJob> claimed = jobQueue.claimNext(workerId);
            if (claimed.isEmpty()) {
                return;
            }
            ClaimedJob job = claimed.get();
            inFlight.incrementAndGet();
            workers.submit(() -> run(job));
        }
    }

    /** Puts jobs of crashed workers back into the queue. */
    @Scheduled(fixedDelay = 60_000, initialDelay = 60_000)
    public void recoverStalledJobs() {
        if (!enabled) {
            return;
        }
        int recovered = jobQueue.recoverStalled(stallTimeout);
        if (recovered > 0) {
            log.warn("Recovered {} stalled job(s)", recovered);
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        if (workers == null) {
            return;
        }
        workers.shutdown();
        if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Worker threads still busy after 30 s, interrupting");
            workers.shutdownNow();
        }
    }

    boolean hasWorkerPool() {
        return workers != null;
    }

    // ------------------------------------------------------------------
    // Worker thread
    // ------------------------------------------------------------------

    private void run(ClaimedJob job) {
        MDC.put("jobId",    job.id());
        MDC.put("jobType",  job.type().name());
        MDC.put("workerId", workerId);
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            if (job.data().schemaVersion() > JobData.LATEST_SCHEMA_VERSION) {
                throw new IllegalStateException("Unsupported job data schema version "
                        + job.data().schemaVersion() + ", latest is " + JobData.LATEST_SCHEMA_VERSION);
            }
            consumer.consume(job);
            jobQueue.complete(job);
        } catch (Exception e) {
            status = "failed";
            log.error("Job {} ({}) failed: {}", job.id(), job.data().correlationId(), e.getMessage(), e);
            try {
                int failures = jobQueue.fail(job, String.valueOf(e.getMessage()));
                thresholdPolicy.onFailure(job, failures);
            } catch (RuntimeException ackError) {
                log.error("Could not acknowledge failure of job {}", job.id(), ackError);
            }
        } finally {
            sample.stop(Timer.builder("flowpilot.worker.job.duration")
                    .tag("type", job.type().name().toLowerCase())
                    .tag("status", status)
                    .register(meterRegistry));
            inFlight.decrementAndGet();
            MDC.clear();
        }
    }
}
