package com.flowpilot.scheduler.model;

/**
 * Kind of trigger attached to a flow version. Only PIECE triggers are scheduled.
 */
public enum TriggerType {
    EMPTY,
    PIECE
}
