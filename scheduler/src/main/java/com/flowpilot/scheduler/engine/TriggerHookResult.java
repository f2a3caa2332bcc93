package com.flowpilot.scheduler.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flowpilot.scheduler.queue.ScheduleOptions;

import java.util.List;

/**
 * Result of a trigger hook.
 *
 * @param listeners       app event subscriptions, used by APP_WEBHOOK triggers
 * @param scheduleOptions polling schedule chosen by the trigger itself; null to use the default
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TriggerHookResult(List<AppEventListener> listeners, ScheduleOptions scheduleOptions) {

    public TriggerHookResult {
        listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public TriggerHookResult withScheduleOptions(ScheduleOptions options) {
        return new TriggerHookResult(listeners, options);
    }
}
