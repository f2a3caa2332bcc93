package com.flowpilot.scheduler.engine;

public enum EngineResponseStatus {
    OK,
    ERROR,
    TIMEOUT
}
