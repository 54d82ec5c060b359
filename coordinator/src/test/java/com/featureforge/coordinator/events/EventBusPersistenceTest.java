package com.featureforge.coordinator.events;

import com.featureforge.coordinator.model.Event;
import com.featureforge.coordinator.model.EventType;
import com.featureforge.coordinator.repository.EventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * EventBus over a real database: a listener must find the event it is
 * handed already committed.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(EventBus.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class EventBusPersistenceTest {

    @Autowired EventBus        bus;
    @Autowired EventRepository eventRepo;

    @BeforeEach
    void cleanDatabase() {
        eventRepo.deleteAll();
    }

    @Test
    void publish_listenerSeesItsOwnEventInTheLog() {
        List<Long> seenByQuery       = new CopyOnWriteArrayList<>();
        List<Boolean> seenElsewhere  = new CopyOnWriteArrayList<>();
        EventBus.Subscription subscription = bus.subscribe(EventType.CHUNK_ASSIGNED, event -> {
            bus.query(EventType.CHUNK_ASSIGNED, null).forEach(e -> seenByQuery.add(e.getId()));
            // Another thread has its own connection, so it only sees committed rows.
            seenElsewhere.add(CompletableFuture
                    .supplyAsync(() -> eventRepo.findById(event.getId()).isPresent())
                    .orTimeout(10, TimeUnit.SECONDS)
                    .join());
        });

        long id;
        try {
            id = bus.publish(EventType.CHUNK_ASSIGNED, "coordinator",
                    Payloads.of("task_id", "t1", "chunk_id", "t1_a", "worker", "chunk-worker"));
        } finally {
            subscription.unsubscribe();
        }

        assertThat(seenByQuery).containsExactly(id);
        assertThat(seenElsewhere).containsExactly(true);
        assertThat(eventRepo.findById(id)).get()
                .extracting(Event::getActor).isEqualTo("coordinator");
    }

    @Test
    void query_newestFirstAndFilteredByActor() {
        long first  = bus.publish(EventType.FILE_LOCKED, "coordinator", Payloads.of("chunk_id", "a"));
        long second = bus.publish(EventType.FILE_LOCKED, "coordinator", Payloads.of("chunk_id", "b"));
        bus.publish(EventType.FILE_LOCKED, "chunk-worker", Payloads.of("chunk_id", "c"));

        assertThat(bus.query(EventType.FILE_LOCKED, "coordinator"))
                .extracting(Event::getId).containsExactly(second, first);
        assertThat(bus.query(null, null)).hasSize(3);
    }
}
