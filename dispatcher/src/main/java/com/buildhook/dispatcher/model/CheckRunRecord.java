package com.buildhook.dispatcher.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Maps one task of a task group to the GitHub check-run that shows its status.
 *
 * Written once by the job handler right after the check-run is opened,
 * read by the status handler to find the check-run to complete.
 * Never updated afterwards.
 *
 * DB table: check_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "check_runs")
@IdClass(CheckRunRecord.Pk.class)
public class CheckRunRecord implements Persistable<CheckRunRecord.Pk> {

    @Id
    @Column(name = "task_group_id", nullable = false, updatable = false)
    private String taskGroupId;

    @Id
    @Column(name = "task_id", nullable = false, updatable = false)
    private String taskId;

    // GitHub ids are numeric but stored as opaque strings.
    @Column(name = "check_suite_id", nullable = false)
    private String checkSuiteId;

    @Column(name = "check_run_id", nullable = false)
    private String checkRunId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Transient
    private boolean isNew = true;

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    protected CheckRunRecord() {}   // required by JPA

    public CheckRunRecord(String taskGroupId, String taskId, String checkSuiteId, String checkRunId) {
        this.taskGroupId  = taskGroupId;
        this.taskId       = taskId;
        this.checkSuiteId = checkSuiteId;
        this.checkRunId   = checkRunId;
    }

    @Override
    public Pk getId()                { return new Pk(taskGroupId, taskId); }

    @Override
    public boolean isNew()           { return isNew; }

    public CheckRunKey key()         { return new CheckRunKey(taskGroupId, taskId); }
    public String getTaskGroupId()   { return taskGroupId; }
    public String getTaskId()        { return taskId; }
    public String getCheckSuiteId()  { return checkSuiteId; }
    public String getCheckRunId()    { return checkRunId; }
    public Instant getCreatedAt()    { return createdAt; }

    /**
     * JPA id class. Field names must match the @Id fields above, so this is a
     * plain class rather than {@link CheckRunKey}.
     */
    public static class Pk implements Serializable {
        private String taskGroupId;
        private String taskId;

        public Pk() {}

        public Pk(String taskGroupId, String taskId) {
            this.taskGroupId = taskGroupId;
            this.taskId      = taskId;
        }

        public String getTaskGroupId() { return taskGroupId; }
        public String getTaskId()      { return taskId; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Pk other)) return false;
            return Objects.equals(taskGroupId, other.taskGroupId)
                    && Objects.equals(taskId, other.taskId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(taskGroupId, taskId);
        }
    }
}
