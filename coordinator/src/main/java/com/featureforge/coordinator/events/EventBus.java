package com.featureforge.coordinator.events;

import com.featureforge.coordinator.model.Event;
import com.featureforge.coordinator.model.EventType;
import com.featureforge.coordinator.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Durable publish/subscribe over the events table.
 *
 * publish() first commits the event in its own transaction, then calls the
 * listeners registered for that type in registration order on the calling
 * thread. A listener therefore never sees an event that a crash could still
 * lose, and a failing listener cannot roll the event back.
 *
 * Listener registrations live in memory only; every process registers its
 * own on startup.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final EventRepository     eventRepo;
    private final TransactionTemplate requiresNew;

    // Pre-populated for every type so dispatch never needs to synchronise.
    private final Map<EventType, CopyOnWriteArrayList<EventListener>> listeners =
            new EnumMap<>(EventType.class);

    public EventBus(EventRepository eventRepo, PlatformTransactionManager txManager) {
        this.eventRepo   = eventRepo;
        this.requiresNew = new TransactionTemplate(txManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        for (EventType type : EventType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    // ------------------------------------------------------------------
    // Publish
    // ------------------------------------------------------------------

    /**
     * Persist an event, then notify listeners of its type.
     *
     * A storage failure propagates to the caller and no listener runs.
     *
     * @return the new event's id (its position in the log)
     */
    public long publish(EventType type, String actor, Map<String, Object> payload) {
        Event saved = requiresNew.execute(status -> eventRepo.save(new Event(type, actor, payload)));
        log.debug("Published {} by {} (id={})", type, actor, saved.getId());

        for (EventListener listener : listeners.get(type)) {
            try {
                listener.onEvent(saved);
            } catch (Exception e) {
                log.warn("Listener for {} failed on event {}: {}",
                        type, saved.getId(), e.getMessage(), e);
            }
        }
        return saved.getId();
    }

    // ------------------------------------------------------------------
    // Subscribe
    // ------------------------------------------------------------------

    /**
     * Register a listener for one event type. Registering the same listener
     * twice means it fires twice.
     *
     * @return a handle that removes exactly this registration
     */
    public Subscription subscribe(EventType type, EventListener listener) {
        CopyOnWriteArrayList<EventListener> registered = listeners.get(type);
        // Wrap so that unsubscribe removes this registration, not an equal one.
        EventListener registration = listener::onEvent;
        registered.add(registration);
        log.debug("Subscribed listener to {}", type);
        return () -> registered.remove(registration);
    }

    /** Number of listeners currently registered for a type. */
    public int listenerCount(EventType type) {
        return listeners.get(type).size();
    }

    // ------------------------------------------------------------------
    // Query
    // ------------------------------------------------------------------

    /**
     * Events matching the optional filters, newest first.
     *
     * @param type  null for any type
     * @param actor null for any actor
     */
    public List<Event> query(EventType type, String actor) {
        if (type != null && actor != null) return eventRepo.findByTypeAndActorOrderByIdDesc(type, actor);
        if (type != null)                  return eventRepo.findByTypeOrderByIdDesc(type);
        if (actor != null)                 return eventRepo.findByActorOrderByIdDesc(actor);
        return eventRepo.findAllByOrderByIdDesc();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
