package com.flowpilot.scheduler.model;

/**
 * When the engine reports step logs back for a run started with a hook.
 */
public enum RunHookType {
    BEFORE_LOG,
    AFTER_LOG
}
