package com.flowpilot.scheduler.trigger;

import com.flowpilot.scheduler.config.SystemConfig;
import com.flowpilot.scheduler.queue.ClaimedJob;
import com.flowpilot.scheduler.queue.JobPriority;
import com.flowpilot.scheduler.queue.JobQueue;
import com.flowpilot.scheduler.queue.JobType;
import com.flowpilot.scheduler.queue.ScheduleOptions;
import com.flowpilot.scheduler.support.TestJobs;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TriggerFailureThresholdPolicyTest {

    @Mock JobQueue jobQueue;

    private TriggerFailureThresholdPolicy policy(String threshold) {
        MockEnvironment env = new MockEnvironment();
        if (threshold != null) {
            env.setProperty("FP_TRIGGER_FAILURES_THRESHOLD", threshold);
        }
        return new TriggerFailureThresholdPolicy(jobQueue, new SystemConfig(env));
    }

    private static ClaimedJob pollingFiring() {
        return new ClaimedJob("V1", JobType.REPEATING, JobPriority.MEDIUM, TestJobs.polling("V1"),
                ScheduleOptions.everyMinutes(5), 1L, "w1");
    }

    @Test
    void belowDefaultThreshold_keepsSchedule() {
        assertThat(policy(null).onFailure(pollingFiring(), 575)).isFalse();

        verify(jobQueue, never()).removeRepeatingJob("V1");
    }

    @Test
    void atDefaultThreshold_removesSchedule() {
        when(jobQueue.removeRepeatingJob("V1")).thenReturn(true);

        assertThat(policy(null).onFailure(pollingFiring(), 576)).isTrue();
    }

    @Test
    void configuredThreshold_isHonoured() {
        when(jobQueue.removeRepeatingJob("V1")).thenReturn(true);

        assertThat(policy("3").onFailure(pollingFiring(), 3)).isTrue();
    }

    @Test
    void oneTimeJobs_areIgnored() {
        ClaimedJob run = new ClaimedJob("run-1", JobType.ONE_TIME, JobPriority.MEDIUM,
                TestJobs.executeFlow("run-1"), null, 1L, "w1");

        assertThat(policy("1").onFailure(run, 0)).isFalse();
        verifyNoInteractions(jobQueue);
    }
}
