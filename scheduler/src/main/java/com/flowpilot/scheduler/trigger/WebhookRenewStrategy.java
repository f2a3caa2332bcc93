package com.flowpilot.scheduler.trigger;

public enum WebhookRenewStrategy {
    CRON,
    NONE
}
