package com.flowpilot.scheduler.queue;

/**
 * Kind of work a scheduled (non one-time) job performs.
 *
 * EXECUTE_TRIGGER: poll a trigger and start runs for new items.
 * RENEW_WEBHOOK  : refresh a third-party webhook subscription before it expires.
 * DELAYED_FLOW   : resume a run paused with a DELAY.
 */
public enum RepeatableJobType {
    EXECUTE_TRIGGER,
    RENEW_WEBHOOK,
    DELAYED_FLOW
}
