package com.featureforge.coordinator.api;

import com.featureforge.coordinator.api.dto.ProgressEventResponse;
import com.featureforge.coordinator.model.ProgressEvent;
import com.featureforge.coordinator.model.ProgressEventType;
import com.featureforge.coordinator.progress.ProgressPublisher;
import com.featureforge.coordinator.progress.ProgressSubscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams a task's live progress events to an HTTP client as Server-Sent Events.
 *
 * Each emitter gets its own {@link ProgressSubscription}, drained by a pump
 * thread. The stream ends after a terminal event (task_completed,
 * task_failed, task_cancelled) or when the client goes away; in every case
 * the subscription is closed.
 *
 * A heartbeat comment is sent every 30 seconds so that idle connections
 * survive proxies with short idle timeouts.
 */
@Service
public class ProgressStreamService {

    private static final Logger log = LoggerFactory.getLogger(ProgressStreamService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(1);

    private static final Set<String> TERMINAL_EVENTS = Set.of(
            ProgressEventType.TASK_COMPLETED.wireName(),
            ProgressEventType.TASK_FAILED.wireName(),
            ProgressEventType.TASK_CANCELLED.wireName());

    private final ProgressPublisher progress;
    private final long              timeoutMs;

    private final CopyOnWriteArrayList<StreamRegistration> activeStreams = new CopyOnWriteArrayList<>();

    private final ExecutorService pumps = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-pump");
        t.setDaemon(true);
        return t;
    });

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public ProgressStreamService(ProgressPublisher progress) {
        this(progress, DEFAULT_TIMEOUT_MS);
    }

    ProgressStreamService(ProgressPublisher progress, long timeoutMs) {
        this.progress  = progress;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        activeStreams.forEach(this::cleanup);
        heartbeatScheduler.shutdownNow();
        pumps.shutdownNow();
    }

    /**
     * Open an SSE stream of the task's progress from now on.
     */
    public SseEmitter createEmitter(String taskId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        ProgressSubscription subscription = progress.subscribe(taskId);
        StreamRegistration registration = new StreamRegistration(taskId, emitter, subscription);
        activeStreams.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE stream timed out for task {}", taskId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE stream error for task {}: {}", taskId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for task {}: {}", taskId, e.getMessage());
        }

        pumps.execute(() -> pump(registration));
        log.info("SSE stream opened for task {}", taskId);
        return emitter;
    }

    public int activeStreamCount() {
        return activeStreams.size();
    }

    // Drains the subscription into the emitter until it is closed or a terminal event went out.
    private void pump(StreamRegistration registration) {
        ProgressSubscription subscription = registration.subscription();
        SseEmitter emitter = registration.emitter();
        try {
            while (!subscription.isClosed()) {
                Optional<ProgressEvent> next = subscription.poll(POLL_TIMEOUT);
                if (next.isEmpty()) continue;

                ProgressEvent event = next.get();
                emitter.send(SseEmitter.event()
                        .id(String.valueOf(event.getId()))
                        .name(event.getType())
                        .data(ProgressEventResponse.from(event)));

                if (TERMINAL_EVENTS.contains(event.getType())) {
                    emitter.complete();
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE stream for task {} ended: {}", registration.taskId(), e.getMessage());
            emitter.completeWithError(e);
        } finally {
            cleanup(registration);
        }
    }

    private void sendHeartbeats() {
        for (StreamRegistration registration : activeStreams) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // onError / onCompletion do the cleanup.
                log.debug("Heartbeat failed for task {}: {}", registration.taskId(), e.getMessage());
            }
        }
    }

    private void cleanup(StreamRegistration registration) {
        activeStreams.remove(registration);
        registration.subscription().close();
    }

    private record StreamRegistration(
            String taskId,
            SseEmitter emitter,
            ProgressSubscription subscription
    ) {}
}
