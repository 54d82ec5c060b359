package com.featureforge.coordinator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the durable coordination log.
 *
 * Rows are only ever inserted by EventBus.publish and never updated or
 * deleted. The identity id is the log position: a higher id was persisted
 * later.
 *
 * DB table: events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "events")
public class Event {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false)
    private EventType type;

    // Worker, coordinator or service that published the event.
    @Column(nullable = false, updatable = false)
    private String actor;

    @Convert(converter = PayloadConverter.class)
    @Column(nullable = false, updatable = false)
    private Map<String, Object> payload = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Event() {}   // required by JPA

    public Event(EventType type, String actor, Map<String, Object> payload) {
        this.type    = type;
        this.actor   = actor;
        this.payload = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
    }

    public Long                getId()        { return id; }
    public EventType           getType()      { return type; }
    public String              getActor()     { return actor; }
    public Map<String, Object> getPayload()   { return payload; }
    public Instant             getCreatedAt() { return createdAt; }

    /** Payload value as a string, or null when absent. */
    public String payloadString(String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }

    /** Payload value as an int, or {@code fallback} when absent or not a number. */
    public int payloadInt(String key, int fallback) {
        Object value = payload.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    @Override
    public String toString() {
        return "Event[" + id + " " + type + " by " + actor + "]";
    }
}
