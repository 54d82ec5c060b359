package com.featureforge.coordinator.repository;

import com.featureforge.coordinator.model.Event;
import com.featureforge.coordinator.model.EventType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Append-only access to the events table.
 *
 * Nothing in the application updates or deletes an Event; the inherited
 * save() is only ever called on new instances. Every finder returns the
 * newest event first (highest id).
 */
public interface EventRepository extends JpaRepository<Event, Long> {

    List<Event> findAllByOrderByIdDesc();

    List<Event> findByTypeOrderByIdDesc(EventType type);

    List<Event> findByActorOrderByIdDesc(String actor);

    List<Event> findByTypeAndActorOrderByIdDesc(EventType type, String actor);
}
