package com.featureforge.coordinator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An independently schedulable slice of a feature, covering a fixed file set.
 *
 * Chunks are created in one batch when a task is decomposed and are never
 * deleted. The id is namespaced by the owning task ("taskId_planId") so
 * chunks of different tasks can never collide.
 *
 * Status changes go through ChunkStore.updateStatus, which enforces
 * {@link ChunkStatus#canTransitionTo}.
 *
 * DB table: chunks
 */
@Entity
@Table(name = "chunks")
public class Chunk {

    @Id
    @Column(nullable = false, updatable = false)
    private String id;

    @Column(name = "task_id", nullable = false, updatable = false)
    private String taskId;

    @Column(nullable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChunkStatus status = ChunkStatus.PLANNED;

    // Relative paths inside the task's target location.
    @Convert(converter = StringListConverter.class)
    @Column(nullable = false)
    private List<String> files = new ArrayList<>();

    // Ids of chunks (same task) that must produce a result first.
    @Convert(converter = StringListConverter.class)
    @Column(nullable = false)
    private List<String> dependencies = new ArrayList<>();

    // Null while PLANNED.
    @Column(name = "assigned_worker")
    private String assignedWorker;

    // E.g. a pull request number. Set when the chunk reaches COMPLETE.
    @Column(name = "integration_handle")
    private String integrationHandle;

    // Failed attempts so far; compared against the configured retry budget.
    @Column(nullable = false)
    private int attempts = 0;

    // When the current IN_PROGRESS assignment began. Used by the stale sweep.
    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Chunk() {}   // required by JPA

    public Chunk(String id, String taskId, String description,
                 List<String> files, List<String> dependencies) {
        this.id           = id;
        this.taskId       = taskId;
        this.description  = description;
        this.files        = new ArrayList<>(files);
        this.dependencies = dependencies == null ? new ArrayList<>() : new ArrayList<>(dependencies);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String       getId()                { return id; }
    public String       getTaskId()            { return taskId; }
    public String       getDescription()       { return description; }
    public ChunkStatus  getStatus()            { return status; }
    // Read-only views; the lists are fixed when the chunk is created.
    public List<String> getFiles()             { return Collections.unmodifiableList(files); }
    public List<String> getDependencies()      { return Collections.unmodifiableList(dependencies); }
    public String       getAssignedWorker()    { return assignedWorker; }
    public String       getIntegrationHandle() { return integrationHandle; }
    public int          getAttempts()          { return attempts; }
    public Instant      getStartedAt()         { return startedAt; }
    public Instant      getCreatedAt()         { return createdAt; }

    public void setStatus(ChunkStatus status)            { this.status = status; }
    public void setAssignedWorker(String assignedWorker) { this.assignedWorker = assignedWorker; }
    public void setIntegrationHandle(String handle)      { this.integrationHandle = handle; }
    public void setStartedAt(Instant t)                  { this.startedAt = t; }
    public void incrementAttempts()                      { this.attempts++; }

    @Override
    public String toString() {
        return "Chunk[" + id + " " + status + "]";
    }
}
