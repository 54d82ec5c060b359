package com.featureforge.coordinator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * One feature request against a target repository.
 *
 * A Task is decomposed into Chunks (linked by task_id only) and advanced
 * through {@link TaskStatus} by the TaskCoordinator. Once terminal the row
 * is read-only; TaskService refuses further writes.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task {

    // UUID string, generated on construction so it is known before the insert.
    @Id
    @Column(nullable = false, updatable = false)
    private String id;

    // Directory of the repository the feature is built in.
    @Column(name = "target_location", nullable = false, updatable = false)
    private String targetLocation;

    @Column(name = "feature_description", nullable = false, updatable = false)
    private String featureDescription;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.QUEUED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Stamped on entry to COMPLETED, FAILED or CANCELLED.
    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "total_chunks", nullable = false)
    private int totalChunks = 0;

    // Only ever increases.
    @Column(name = "completed_chunks", nullable = false)
    private int completedChunks = 0;

    @Convert(converter = StringListConverter.class)
    @Column(name = "integration_handles", nullable = false)
    private List<String> integrationHandles = new ArrayList<>();

    // Called automatically by JPA before every UPDATE.
    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(String targetLocation, String featureDescription) {
        this.id                 = UUID.randomUUID().toString();
        this.targetLocation     = targetLocation;
        this.featureDescription = featureDescription;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String       getId()                 { return id; }
    public String       getTargetLocation()     { return targetLocation; }
    public String       getFeatureDescription() { return featureDescription; }
    public TaskStatus   getStatus()             { return status; }
    public Instant      getCreatedAt()          { return createdAt; }
    public Instant      getUpdatedAt()          { return updatedAt; }
    public Instant      getCompletedAt()        { return completedAt; }
    public String       getErrorMessage()       { return errorMessage; }
    public int          getTotalChunks()        { return totalChunks; }
    public int          getCompletedChunks()    { return completedChunks; }
    public List<String> getIntegrationHandles() { return Collections.unmodifiableList(integrationHandles); }

    public void setStatus(TaskStatus status)        { this.status = status; }
    public void setCompletedAt(Instant t)           { this.completedAt = t; }
    public void setErrorMessage(String message)     { this.errorMessage = message; }
    public void setTotalChunks(int totalChunks)     { this.totalChunks = totalChunks; }

    public void recordCompletedChunk(String handle) {
        this.completedChunks++;
        if (handle != null && !integrationHandles.contains(handle)) {
            // Replace the list so the converter sees a dirty attribute.
            List<String> handles = new ArrayList<>(integrationHandles);
            handles.add(handle);
            this.integrationHandles = handles;
        }
    }

    @Override
    public String toString() {
        return "Task[" + id + " " + status + "]";
    }
}
