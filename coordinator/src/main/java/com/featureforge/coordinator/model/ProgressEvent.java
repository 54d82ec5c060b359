package com.featureforge.coordinator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A user-facing progress notification for one task.
 *
 * The type is kept as a plain string: {@link ProgressEventType} lists the
 * values this service writes, but readers must tolerate others.
 *
 * DB table: progress_events
 */
@Entity
@Table(name = "progress_events")
public class ProgressEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_id", nullable = false, updatable = false)
    private String taskId;

    @Column(name = "event_type", nullable = false, updatable = false)
    private String type;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Convert(converter = PayloadConverter.class)
    @Column(nullable = false, updatable = false)
    private Map<String, Object> payload = new LinkedHashMap<>();

    @Column(updatable = false)
    private String message;

    protected ProgressEvent() {}   // required by JPA

    public ProgressEvent(String taskId, String type, Map<String, Object> payload, String message) {
        this.taskId  = taskId;
        this.type    = type;
        this.payload = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
        this.message = message;
    }

    public Long                getId()        { return id; }
    public String              getTaskId()    { return taskId; }
    public String              getType()      { return type; }
    public Instant             getCreatedAt() { return createdAt; }
    public Map<String, Object> getPayload()   { return payload; }
    public String              getMessage()   { return message; }
}
