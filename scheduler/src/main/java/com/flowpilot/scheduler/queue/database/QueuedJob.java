package com.flowpilot.scheduler.queue.database;

import com.flowpilot.scheduler.queue.JobType;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * One queue entry of the distributed backend.
 *
 * The job id is the primary key, which is what makes add-by-id a replace.
 *
 * DB table: queued_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "queued_jobs")
public class QueuedJob {

    @Id
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobType type;

    // JobPriority rank: 0 = HIGH, 1 = MEDIUM.
    @Column(nullable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QueuedJobState state = QueuedJobState.PENDING;

    // JobData serialized with its "kind" discriminator.
    @Column(name = "data_json", nullable = false, columnDefinition = "TEXT")
    private String dataJson;

    // Earliest instant a worker may claim the row.
    @Column(name = "available_at", nullable = false)
    private Instant availableAt;

    // REPEATING jobs only.
    @Column(name = "cron_expression")
    private String cronExpression;

    @Column(name = "timezone")
    private String timezone;

    @Column(name = "failure_count", nullable = false)
    private int failureCount = 0;

    // Bumped on every re-add; acknowledgements only delete the revision they claimed.
    @Column(nullable = false)
    private long revision = 1;

    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    // Both timestamps come from the queue's Clock, never from the JVM time.
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected QueuedJob() {}   // required by JPA

    public QueuedJob(String id, JobType type, int priority, String dataJson,
                     Instant availableAt, Instant createdAt) {
        this.id          = id;
        this.type        = type;
        this.priority    = priority;
        this.dataJson    = dataJson;
        this.availableAt = availableAt;
        this.createdAt   = createdAt;
        this.updatedAt   = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String         getId()             { return id; }
    public JobType        getType()           { return type; }
    public int            getPriority()       { return priority; }
    public QueuedJobState getState()          { return state; }
    public String         getDataJson()       { return dataJson; }
    public Instant        getAvailableAt()    { return availableAt; }
    public String         getCronExpression() { return cronExpression; }
    public String         getTimezone()       { return timezone; }
    public int            getFailureCount()   { return failureCount; }
    public long           getRevision()       { return revision; }
    public String         getWorkerId()       { return workerId; }
    public Instant        getClaimedAt()      { return claimedAt; }
    public Instant        getCreatedAt()      { return createdAt; }
    public Instant        getUpdatedAt()      { return updatedAt; }

    public void setState(QueuedJobState state)        { this.state = state; }
    public void setAvailableAt(Instant availableAt)   { this.availableAt = availableAt; }
    public void setWorkerId(String workerId)          { this.workerId = workerId; }
    public void setClaimedAt(Instant claimedAt)       { this.claimedAt = claimedAt; }
    public void setFailureCount(int failureCount)     { this.failureCount = failureCount; }
    public void setRevision(long revision)            { this.revision = revision; }
    public void setUpdatedAt(Instant updatedAt)       { this.updatedAt = updatedAt; }

    public void setSchedule(String cronExpression, String timezone) {
        this.cronExpression = cronExpression;
        this.timezone       = timezone;
    }
}
