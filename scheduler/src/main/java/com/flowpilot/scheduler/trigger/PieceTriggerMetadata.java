package com.flowpilot.scheduler.trigger;

/**
 * What the piece declares about one of its triggers.
 *
 * @param renewConfiguration null when the trigger never renews its webhook
 */
public record PieceTriggerMetadata(
        String                    name,
        TriggerStrategy           strategy,
        WebhookRenewConfiguration renewConfiguration) {}
