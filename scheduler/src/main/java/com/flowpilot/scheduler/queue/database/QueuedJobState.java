package com.flowpilot.scheduler.queue.database;

/**
 * State of a row in queued_jobs.
 *
 * Transitions:
 *   PENDING → RUNNING (one-time/delayed job claimed by a worker)
 *   RUNNING → deleted (acknowledged)
 *   RUNNING → PENDING (re-added with the same id, or recovered after a worker crash)
 *
 * Repeating jobs never leave PENDING; a claim only moves available_at forward.
 */
public enum QueuedJobState {
    PENDING,
    RUNNING
}
