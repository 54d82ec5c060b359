package com.featureforge.coordinator.progress;

import com.featureforge.coordinator.events.EventBus;
import com.featureforge.coordinator.model.Event;
import com.featureforge.coordinator.model.EventType;
import com.featureforge.coordinator.model.ProgressEventType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns worker and merge events from the coordination log into
 * user-facing progress events for the task named in their payload.
 */
@Component
public class ProgressRelay {

    private static final Logger log = LoggerFactory.getLogger(ProgressRelay.class);

    private record Mapping(ProgressEventType type, Function<Event, String> message) {}

    private static final Map<EventType, Mapping> MAPPINGS = new EnumMap<>(EventType.class);

    static {
        MAPPINGS.put(EventType.CHUNK_STARTED, new Mapping(ProgressEventType.CHUNK_PROCESSING_STARTED,
                e -> "Started chunk " + e.payloadString("chunk_id")));
        MAPPINGS.put(EventType.CODE_GENERATION_STARTED, new Mapping(ProgressEventType.AGENT_CODE_GENERATION_STARTED,
                e -> "Generating code for chunk " + e.payloadString("chunk_id")));
        MAPPINGS.put(EventType.FILES_MODIFIED, new Mapping(ProgressEventType.AGENT_FILES_MODIFIED,
                e -> "Modified files for chunk " + e.payloadString("chunk_id") + ": " + e.payloadString("files")));
        MAPPINGS.put(EventType.INTEGRATION_OPENED, new Mapping(ProgressEventType.PR_CREATED,
                e -> "Opened pull request " + e.payloadString("handle") + " for chunk " + e.payloadString("chunk_id")));
        MAPPINGS.put(EventType.CHUNK_COMPLETED, new Mapping(ProgressEventType.CHUNK_PROCESSING_COMPLETED,
                e -> "Completed chunk " + e.payloadString("chunk_id")));
        MAPPINGS.put(EventType.CHUNK_MERGED, new Mapping(ProgressEventType.PR_MERGED,
                e -> "Merged pull request " + e.payloadString("handle") + " for chunk " + e.payloadString("chunk_id")));
        MAPPINGS.put(EventType.CHUNK_FAILED, new Mapping(ProgressEventType.ERROR_OCCURRED,
                e -> "Chunk " + e.payloadString("chunk_id") + " failed: " + e.payloadString("error")));
    }

    private final EventBus          bus;
    private final ProgressPublisher progress;

    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    public ProgressRelay(EventBus bus, ProgressPublisher progress) {
        this.bus      = bus;
        this.progress = progress;
    }

    @PostConstruct
    public void start() {
        MAPPINGS.keySet().forEach(type -> subscriptions.add(bus.subscribe(type, this::relay)));
    }

    @PreDestroy
    public void stop() {
        subscriptions.forEach(EventBus.Subscription::unsubscribe);
        subscriptions.clear();
    }

    void relay(Event event) {
        String taskId = event.payloadString("task_id");
        if (taskId == null) {
            log.debug("Not relaying {}: no task_id in payload", event);
            return;
        }
        Mapping mapping = MAPPINGS.get(event.getType());
        progress.publish(taskId, mapping.type(), event.getPayload(), mapping.message().apply(event));
    }
}
