package com.flowpilot.scheduler.config;

/**
 * Selects the job queue and pub/sub backends for the whole process.
 *
 * MEMORY     : single process, nothing survives a restart.
 * DISTRIBUTED: Postgres job table shared by all workers, Redis pub/sub.
 */
public enum QueueMode {
    MEMORY,
    DISTRIBUTED
}
