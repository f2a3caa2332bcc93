package com.flowpilot.scheduler.trigger;

/** Public URL third-party services call to deliver events for a flow. */
public interface WebhookUrlResolver {

    String getWebhookUrl(String flowId, boolean simulate);
}
