package com.flowpilot.scheduler.queue;

/**
 * Dispatch priority of a ONE_TIME job. Lower rank is dispatched first.
 */
public enum JobPriority {
    HIGH(0),
    MEDIUM(1);

    private final int rank;

    JobPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static JobPriority fromRank(int rank) {
        for (JobPriority p : values()) {
            if (p.rank == rank) return p;
        }
        throw new IllegalArgumentException("Unknown priority rank " + rank);
    }
}
