package com.buildhook.dispatcher.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * One submitted task group and the commit it was built for.
 *
 * The task-group id is assigned by the config compiler, not by the database,
 * so new rows are flagged through {@link Persistable#isNew()} and inserted
 * with a plain INSERT; a duplicate delivery then fails on the primary key
 * instead of silently merging over the existing row.
 *
 * DB table: builds  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "builds")
public class Build implements Persistable<String> {

    @Id
    @Column(name = "task_group_id", nullable = false, updatable = false)
    private String taskGroupId;

    @Column(nullable = false)
    private String organization;

    @Column(nullable = false)
    private String repository;

    @Column(nullable = false)
    private String sha;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BuildState state = BuildState.QUEUED;

    @Column(name = "installation_id", nullable = false)
    private long installationId;

    @Column(name = "event_type", nullable = false)
    private String eventType;

    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Column(nullable = false, updatable = false)
    private Instant created = Instant.now();

    @Column(nullable = false)
    private Instant updated = Instant.now();

    // Optimistic lock: concurrent modify() calls on the same build are
    // serialised by compare-and-swap on this column.
    @Version
    @Column(nullable = false)
    private long version;

    @Transient
    private boolean isNew = true;

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Build() {}   // required by JPA

    public Build(String taskGroupId,
                 String organization,
                 String repository,
                 String sha,
                 BuildState state,
                 long installationId,
                 String eventType,
                 String eventId,
                 Instant now) {
        this.taskGroupId    = taskGroupId;
        this.organization   = organization;
        this.repository     = repository;
        this.sha            = sha;
        this.state          = state;
        this.installationId = installationId;
        this.eventType      = eventType;
        this.eventId        = eventId;
        this.created        = now;
        this.updated        = now;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    @Override
    public String getId()               { return taskGroupId; }

    @Override
    public boolean isNew()              { return isNew; }

    public String     getTaskGroupId()    { return taskGroupId; }
    public String     getOrganization()   { return organization; }
    public String     getRepository()     { return repository; }
    public String     getSha()            { return sha; }
    public BuildState getState()          { return state; }
    public long       getInstallationId() { return installationId; }
    public String     getEventType()      { return eventType; }
    public String     getEventId()        { return eventId; }
    public Instant    getCreated()        { return created; }
    public Instant    getUpdated()        { return updated; }
    public long       getVersion()        { return version; }

    public void setState(BuildState state)  { this.state = state; }
    public void setUpdated(Instant updated) { this.updated = updated; }
}
