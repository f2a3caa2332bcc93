package com.flowpilot.scheduler.config;

/**
 * Role of this process. Workers claim and execute queued jobs; apps produce them.
 */
public enum ContainerType {
    WORKER,
    APP,
    WORKER_AND_APP
}
