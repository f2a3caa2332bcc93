package com.flowpilot.scheduler.trigger;

import com.flowpilot.scheduler.config.SystemConfig;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PollingIntervalPolicyTest {

    @Test
    void configured_defaultsToFiveMinutes() {
        PollingIntervalPolicy policy = new ConfiguredPollingIntervalPolicy(new SystemConfig(new MockEnvironment()));

        assertThat(policy.pollingIntervalMinutes("proj-1")).isEqualTo(5);
    }

    @Test
    void configured_readsPollIntervalProperty() {
        PollingIntervalPolicy policy = new ConfiguredPollingIntervalPolicy(new SystemConfig(
                new MockEnvironment().withProperty("FP_TRIGGER_DEFAULT_POLL_INTERVAL", "10")));

        assertThat(policy.pollingIntervalMinutes("proj-1")).isEqualTo(10);
    }

    @Test
    void configured_unusableValueFallsBackToFive() {
        PollingIntervalPolicy zero = new ConfiguredPollingIntervalPolicy(new SystemConfig(
                new MockEnvironment().withProperty("FP_TRIGGER_DEFAULT_POLL_INTERVAL", "0")));
        PollingIntervalPolicy garbage = new ConfiguredPollingIntervalPolicy(new SystemConfig(
                new MockEnvironment().withProperty("FP_TRIGGER_DEFAULT_POLL_INTERVAL", "often")));

        assertThat(zero.pollingIntervalMinutes("proj-1")).isEqualTo(5);
        assertThat(garbage.pollingIntervalMinutes("proj-1")).isEqualTo(5);
    }

    @Test
    void plan_usesProjectMinimumPollingInterval() {
        PlanLimitsService planLimits = mock(PlanLimitsService.class);
        when(planLimits.getOrCreateDefaultPlan("proj-1")).thenReturn(new ProjectPlan("proj-1", 15));

        PollingIntervalPolicy configured = new ConfiguredPollingIntervalPolicy(new SystemConfig(new MockEnvironment()));

        assertThat(new PlanPollingIntervalPolicy(planLimits, configured).pollingIntervalMinutes("proj-1")).isEqualTo(15);
    }

    @Test
    void plan_withoutUsableMinimum_fallsBackToConfiguredInterval() {
        PlanLimitsService planLimits = mock(PlanLimitsService.class);
        when(planLimits.getOrCreateDefaultPlan("proj-1")).thenReturn(new ProjectPlan("proj-1", 0));
        when(planLimits.getOrCreateDefaultPlan("proj-2")).thenReturn(new ProjectPlan("proj-2", -3));
        PollingIntervalPolicy configured = new ConfiguredPollingIntervalPolicy(new SystemConfig(
                new MockEnvironment().withProperty("FP_TRIGGER_DEFAULT_POLL_INTERVAL", "10")));
        PollingIntervalPolicy unconfigured = new ConfiguredPollingIntervalPolicy(new SystemConfig(new MockEnvironment()));

        assertThat(new PlanPollingIntervalPolicy(planLimits, configured).pollingIntervalMinutes("proj-1")).isEqualTo(10);
        assertThat(new PlanPollingIntervalPolicy(planLimits, unconfigured).pollingIntervalMinutes("proj-2")).isEqualTo(5);
    }

    @Test
    void webhookUrl_simulateAddsSuffixAndTrailingSlashIsIgnored() {
        DefaultWebhookUrlResolver resolver = new DefaultWebhookUrlResolver(new SystemConfig(
                new MockEnvironment().withProperty("FP_WEBHOOK_URL", "https://flows.example.com/api/")));

        assertThat(resolver.getWebhookUrl("flow-1", false)).isEqualTo("https://flows.example.com/api/v1/webhooks/flow-1");
        assertThat(resolver.getWebhookUrl("flow-1", true)).isEqualTo("https://flows.example.com/api/v1/webhooks/flow-1/simulate");
    }
}
