package com.flowpilot.scheduler.queue.memory;

import com.flowpilot.scheduler.error.ErrorCode;
import com.flowpilot.scheduler.error.FlowPilotException;
import com.flowpilot.scheduler.queue.ClaimedJob;
import com.flowpilot.scheduler.queue.Job;
import com.flowpilot.scheduler.queue.JobPriority;
import com.flowpilot.scheduler.queue.JobType;
import com.flowpilot.scheduler.queue.QueueMetrics;
import com.flowpilot.scheduler.queue.ScheduleOptions;
import com.flowpilot.scheduler.support.MutableClock;
import com.flowpilot.scheduler.support.TestJobs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryJobQueueTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:30Z");

    MutableClock        clock;
    SimpleMeterRegistry registry;
    MemoryJobQueue      queue;

    @BeforeEach
    void setUp() {
        clock    = new MutableClock(START);
        registry = new SimpleMeterRegistry();
        queue    = new MemoryJobQueue(clock, new QueueMetrics(registry, "memory"));
    }

    private String claimId() {
        return queue.claimNext("w1").map(ClaimedJob::id).orElse(null);
    }

    // ------------------------------------------------------------------
    // Ordering
    // ------------------------------------------------------------------

    @Test
    void claimNext_highPriorityBeforeMedium() {
        queue.add(TestJobs.oneTime("medium", JobPriority.MEDIUM));
        queue.add(TestJobs.oneTime("high", JobPriority.HIGH));

        assertThat(claimId()).isEqualTo("high");
        assertThat(claimId()).isEqualTo("medium");
        assertThat(claimId()).isNull();
    }

    @Test
    void claimNext_samePriority_insertionOrder() {
        queue.add(TestJobs.oneTime("first", JobPriority.MEDIUM));
        queue.add(TestJobs.oneTime("second", JobPriority.MEDIUM));
        queue.add(TestJobs.oneTime("third", JobPriority.MEDIUM));

        assertThat(claimId()).isEqualTo("first");
        assertThat(claimId()).isEqualTo("second");
        assertThat(claimId()).isEqualTo("third");
    }

    @Test
    void claimNext_claimedJobIsNotHandedOutTwice() {
        queue.add(TestJobs.oneTime("run-1", JobPriority.MEDIUM));

        Optional<ClaimedJob> first = queue.claimNext("w1");

        assertThat(first).isPresent();
        assertThat(first.get().workerId()).isEqualTo("w1");
        assertThat(queue.claimNext("w2")).isEmpty();
        assertThat(queue.size()).isEqualTo(1);   // still owned until acknowledged
    }

    // ------------------------------------------------------------------
    // Delayed jobs
    // ------------------------------------------------------------------

    @Test
    void delayedJob_notEligibleBeforeDelay() {
        queue.add(TestJobs.delayed("run-1", 60_000));

        assertThat(claimId()).isNull();
        clock.advance(Duration.ofSeconds(59));
        assertThat(claimId()).isNull();
        clock.advance(Duration.ofSeconds(1));
        assertThat(claimId()).isEqualTo("run-1");
    }

    @Test
    void delayedJob_zeroDelay_isImmediatelyEligible() {
        queue.add(TestJobs.delayed("run-1", 0));

        assertThat(claimId()).isEqualTo("run-1");
    }

    // ------------------------------------------------------------------
    // Repeating jobs
    // ------------------------------------------------------------------

    @Test
    void repeatingJob_firesOnCronAndStaysScheduled() {
        queue.add(TestJobs.everyFiveMinutes("V1"));

        assertThat(claimId()).isNull();                       // 00:00:30, next firing 00:05
        clock.set(Instant.parse("2024-01-01T00:05:00Z"));
        assertThat(claimId()).isEqualTo("V1");
        assertThat(claimId()).isNull();                       // re-armed for 00:10
        clock.set(Instant.parse("2024-01-01T00:10:00Z"));
        assertThat(claimId()).isEqualTo("V1");
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void repeatingJob_addedTwice_keepsOneScheduleWithLatestOptions() {
        queue.add(TestJobs.everyFiveMinutes("V1"));
        queue.add(Job.repeating("V1", TestJobs.polling("V1"), ScheduleOptions.everyMinutes(15)));

        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.findScheduleOptions("V1"))
                .contains(new ScheduleOptions("*/15 * * * *", "UTC", 0));
    }

    @Test
    void repeatingJob_failureCountIncrementsAndResetsOnSuccess() {
        queue.add(TestJobs.everyFiveMinutes("V1"));
        clock.set(Instant.parse("2024-01-01T00:05:00Z"));
        ClaimedJob firing = queue.claimNext("w1").orElseThrow();

        assertThat(queue.fail(firing, "boom")).isEqualTo(1);
        assertThat(queue.fail(firing, "boom")).isEqualTo(2);
        assertThat(queue.findScheduleOptions("V1").orElseThrow().failureCount()).isEqualTo(2);

        queue.complete(firing);

        assertThat(queue.findScheduleOptions("V1").orElseThrow().failureCount()).isZero();
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void repeatingJob_failureOfReplacedScheduleIsNotCounted() {
        queue.add(TestJobs.everyFiveMinutes("V1"));
        clock.set(Instant.parse("2024-01-01T00:05:00Z"));
        ClaimedJob oldFiring = queue.claimNext("w1").orElseThrow();
        queue.add(Job.repeating("V1", TestJobs.polling("V1"), ScheduleOptions.everyMinutes(15)));

        assertThat(queue.fail(oldFiring, "boom")).isZero();
        assertThat(queue.findScheduleOptions("V1"))
                .contains(new ScheduleOptions("*/15 * * * *", "UTC", 0));
    }

    @Test
    void repeatingJob_successOfReplacedScheduleDoesNotResetNewCount() {
        queue.add(TestJobs.everyFiveMinutes("V1"));
        clock.set(Instant.parse("2024-01-01T00:05:00Z"));
        ClaimedJob oldFiring = queue.claimNext("w1").orElseThrow();
        queue.add(Job.repeating("V1", TestJobs.polling("V1"), ScheduleOptions.everyMinutes(5).withFailureCount(3)));

        queue.complete(oldFiring);

        assertThat(queue.findScheduleOptions("V1").orElseThrow().failureCount()).isEqualTo(3);
    }

    @Test
    void add_invalidCron_rejectedAndNothingStored() {
        Job broken = Job.repeating("V1", TestJobs.polling("V1"), ScheduleOptions.utc("not a cron"));

        assertThatThrownBy(() -> queue.add(broken))
                .isInstanceOf(FlowPilotException.class)
                .extracting(e -> ((FlowPilotException) e).getCode())
                .isEqualTo(ErrorCode.JOB_QUEUE_FAILURE);
        assertThat(queue.size()).isZero();
    }

    @Test
    void removeRepeatingJob_onlyRemovesSchedules() {
        queue.add(TestJobs.everyFiveMinutes("V1"));
        queue.add(TestJobs.oneTime("run-1", JobPriority.MEDIUM));

        assertThat(queue.removeRepeatingJob("run-1")).isFalse();
        assertThat(queue.removeRepeatingJob("V1")).isTrue();
        assertThat(queue.removeRepeatingJob("V1")).isFalse();
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.findScheduleOptions("V1")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Acknowledgement
    // ------------------------------------------------------------------

    @Test
    void complete_oneTimeJob_removesIt() {
        queue.add(TestJobs.oneTime("run-1", JobPriority.MEDIUM));
        ClaimedJob claimed = queue.claimNext("w1").orElseThrow();

        queue.complete(claimed);

        assertThat(queue.size()).isZero();
    }

    @Test
    void fail_oneTimeJob_removesItAndReturnsZero() {
        queue.add(TestJobs.oneTime("run-1", JobPriority.MEDIUM));
        ClaimedJob claimed = queue.claimNext("w1").orElseThrow();

        assertThat(queue.fail(claimed, "boom")).isZero();
        assertThat(queue.size()).isZero();
        assertThat(registry.counter("flowpilot.queue.jobs.failed", "type", "one_time", "backend", "memory").count())
                .isEqualTo(1.0);
    }

    @Test
    void complete_afterJobWasReplaced_keepsNewerEntry() {
        // A run pauses while its start job is still running: the DELAYED resume
        // job reuses the run id and must survive the start job's acknowledgement.
        queue.add(TestJobs.oneTime("run-1", JobPriority.MEDIUM));
        ClaimedJob start = queue.claimNext("w1").orElseThrow();
        queue.add(TestJobs.delayed("run-1", 1_000));

        queue.complete(start);

        assertThat(queue.size()).isEqualTo(1);
        clock.advance(Duration.ofSeconds(1));
        ClaimedJob resume = queue.claimNext("w1").orElseThrow();
        assertThat(resume.type()).isEqualTo(JobType.DELAYED);
    }

    @Test
    void recoverStalled_makesOldClaimsClaimableAgain() {
        queue.add(TestJobs.oneTime("run-1", JobPriority.MEDIUM));
        queue.claimNext("w1").orElseThrow();

        assertThat(queue.recoverStalled(Duration.ofMinutes(10))).isZero();
        clock.advance(Duration.ofMinutes(11));
        assertThat(queue.recoverStalled(Duration.ofMinutes(10))).isEqualTo(1);

        assertThat(claimId()).isEqualTo("run-1");
    }

    @Test
    void add_countsAddedJobsByType() {
        queue.add(TestJobs.oneTime("a", JobPriority.HIGH));
        queue.add(TestJobs.oneTime("b", JobPriority.MEDIUM));
        queue.add(TestJobs.everyFiveMinutes("V1"));

        assertThat(registry.counter("flowpilot.queue.jobs.added", "type", "one_time", "backend", "memory").count())
                .isEqualTo(2.0);
        assertThat(registry.counter("flowpilot.queue.jobs.added", "type", "repeating", "backend", "memory").count())
                .isEqualTo(1.0);
    }
}
