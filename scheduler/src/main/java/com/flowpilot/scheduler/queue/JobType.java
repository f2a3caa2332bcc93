package com.flowpilot.scheduler.queue;

public enum JobType {
    ONE_TIME,
    REPEATING,
    DELAYED
}
