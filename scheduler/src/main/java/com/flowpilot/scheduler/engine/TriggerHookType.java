package com.flowpilot.scheduler.engine;

/** Trigger lifecycle hooks the engine can run inside its sandbox. */
public enum TriggerHookType {
    ON_ENABLE,
    ON_DISABLE
}
