package com.flowpilot.scheduler.model;

public enum PauseType {
    DELAY,
    WEBHOOK
}
