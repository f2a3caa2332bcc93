package com.flowpilot.scheduler.queue.memory;

import com.flowpilot.scheduler.queue.ClaimedJob;
import com.flowpilot.scheduler.queue.CronSchedule;
import com.flowpilot.scheduler.queue.Job;
import com.flowpilot.scheduler.queue.JobQueue;
import com.flowpilot.scheduler.queue.JobType;
import com.flowpilot.scheduler.queue.QueueMetrics;
import com.flowpilot.scheduler.queue.ScheduleOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-process job queue.
 *
 * All state lives in one map guarded by one lock, so the queue behaves like
 * an event loop: add, claim and acknowledgement never interleave. Eligibility
 * is evaluated against the injected {@link Clock} whenever a worker asks for
 * the next job. Nothing survives a restart.
 */
public class MemoryJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(MemoryJobQueue.class);

    private static final Comparator<Entry> DISPATCH_ORDER = Comparator
            .comparingInt((Entry e) -> e.job.priority().rank())
            .thenComparing(e -> e.availableAt)
            .thenComparingLong(e -> e.sequence);

    private final Clock clock;
    private final QueueMetrics metrics;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Entry> entries = new HashMap<>();

    private long sequence = 0;
    private long revision = 0;

    public MemoryJobQueue(Clock clock, QueueMetrics metrics) {
        this.clock   = clock;
        this.metrics = metrics;
    }

    @Override
    public void add(Job job) {
        // Parse before taking the lock so an invalid cron leaves the queue untouched.
        CronSchedule schedule = job.type() == JobType.REPEATING ? CronSchedule.of(job.scheduleOptions()) : null;
        Instant now = clock.instant();

        lock.lock();
        try {
            Instant availableAt = switch (job.type()) {
                case ONE_TIME  -> now;
                case DELAYED   -> now.plusMillis(job.delayMs());
                case REPEATING -> schedule.nextAfter(now);
            };
            Entry previous = entries.put(job.id(),
                    new Entry(job, job.scheduleOptions(), schedule, availableAt, ++sequence, ++revision));
            log.debug("{} job {} ({}), eligible at {}",
                    previous == null ? "Added" : "Replaced", job.id(), job.type(), availableAt);
        } finally {
            lock.unlock();
        }
        metrics.added(job.type());
    }

    @Override
    public boolean removeRepeatingJob(String jobId) {
        lock.lock();
        try {
            Entry entry = entries.get(jobId);
            if (entry == null || entry.job.type() != JobType.REPEATING) {
                return false;
            }
            entries.remove(jobId);
            log.info("Removed schedule {}", jobId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ClaimedJob> claimNext(String workerId) {
        Instant now = clock.instant();
        ClaimedJob claimed;

        lock.lock();
        try {
            Optional<Entry> next = entries.values().stream()
                    .filter(e -> !e.claimed && !e.availableAt.isAfter(now))
                    .min(DISPATCH_ORDER);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            Entry entry = next.get();
            claimed = new ClaimedJob(entry.job.id(), entry.job.type(), entry.job.priority(),
                    entry.job.data(), entry.scheduleOptions, entry.revision, workerId);

            if (entry.job.type() == JobType.REPEATING) {
                // Hand out this firing and re-arm; the schedule stays claimable.
                entry.availableAt = entry.schedule.nextAfter(now);
            } else {
                entry.claimed   = true;
                entry.claimedAt = now;
            }
        } finally {
            lock.unlock();
        }
        metrics.claimed(claimed.type());
        return Optional.of(claimed);
    }

    @Override
    public void complete(ClaimedJob job) {
        lock.lock();
        try {
            Entry entry = entries.get(job.id());
            if (entry == null || entry.revision != job.revision()) {
                return;
            }
            if (entry.job.type() == JobType.REPEATING) {
                entry.scheduleOptions = entry.scheduleOptions.withFailureCount(0);
            } else {
                entries.remove(job.id());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int fail(ClaimedJob job, String reason) {
        metrics.failed(job.type());
        lock.lock();
        try {
            Entry entry = entries.get(job.id());
            if (entry == null) {
                return 0;
            }
            if (entry.revision != job.revision()) {
                log.warn("Job {} revision {} failed after it was replaced: {}", job.id(), job.revision(), reason);
                return 0;
            }
            if (entry.job.type() == JobType.REPEATING) {
                int failures = entry.scheduleOptions.failureCount() + 1;
                entry.scheduleOptions = entry.scheduleOptions.withFailureCount(failures);
                log.warn("Repeating job {} failed ({} consecutive): {}", job.id(), failures, reason);
                return failures;
            }
            entries.remove(job.id());
            log.warn("Job {} ({}) failed: {}", job.id(), job.type(), reason);
            return 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ScheduleOptions> findScheduleOptions(String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(jobId))
                    .filter(e -> e.job.type() == JobType.REPEATING)
                    .map(e -> e.scheduleOptions);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int recoverStalled(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        int recovered = 0;
        lock.lock();
        try {
            for (Entry entry : entries.values()) {
                if (entry.claimed && entry.claimedAt.isBefore(cutoff)) {
                    log.warn("Job {} claimed at {} was never acknowledged, making it claimable again",
                            entry.job.id(), entry.claimedAt);
                    entry.claimed   = false;
                    entry.claimedAt = null;
                    recovered++;
                }
            }
        } finally {
            lock.unlock();
        }
        return recovered;
    }

    @Override
    public long size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    // Mutable only under the queue lock.
    private static final class Entry {
        final Job job;
        final CronSchedule schedule;
        final long sequence;
        final long revision;
        ScheduleOptions scheduleOptions;
        Instant availableAt;
        boolean claimed;
        Instant claimedAt;

        Entry(Job job, ScheduleOptions scheduleOptions, CronSchedule schedule,
              Instant availableAt, long sequence, long revision) {
            this.job             = job;
            this.scheduleOptions = scheduleOptions;
            this.schedule        = schedule;
            this.availableAt     = availableAt;
            this.sequence        = sequence;
            this.revision        = revision;
        }
    }
}
