package com.flowpilot.scheduler.trigger;

/**
 * How a WEBHOOK trigger keeps its registration alive on the third-party side.
 *
 * @param cronExpression renewal cadence, only meaningful for {@link WebhookRenewStrategy#CRON}
 */
public record WebhookRenewConfiguration(WebhookRenewStrategy strategy, String cronExpression) {

    public static WebhookRenewConfiguration cron(String cronExpression) {
        return new WebhookRenewConfiguration(WebhookRenewStrategy.CRON, cronExpression);
    }

    public static WebhookRenewConfiguration none() {
        return new WebhookRenewConfiguration(WebhookRenewStrategy.NONE, null);
    }
}
