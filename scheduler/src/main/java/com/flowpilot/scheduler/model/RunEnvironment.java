package com.flowpilot.scheduler.model;

public enum RunEnvironment {
    PRODUCTION,
    TESTING
}
