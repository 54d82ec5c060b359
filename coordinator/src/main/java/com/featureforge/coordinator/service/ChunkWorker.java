package com.featureforge.coordinator.service;

import com.featureforge.coordinator.collaborator.CodeGenerator;
import com.featureforge.coordinator.collaborator.CollaboratorException;
import com.featureforge.coordinator.collaborator.GeneratedChange;
import com.featureforge.coordinator.collaborator.IntegrationGateway;
import com.featureforge.coordinator.collaborator.RepositoryScanner;
import com.featureforge.coordinator.events.EventBus;
import com.featureforge.coordinator.events.Payloads;
import com.featureforge.coordinator.model.Chunk;
import com.featureforge.coordinator.model.ChunkStatus;
import com.featureforge.coordinator.model.Event;
import com.featureforge.coordinator.model.EventType;
import com.featureforge.coordinator.model.Task;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Carries out chunks assigned to this worker id.
 *
 * Listens for CHUNK_ASSIGNED and runs each chunk on its own thread pool:
 * read the chunk's current files, generate the change, open an integration
 * for it and report CHUNK_COMPLETED with the integration handle. Any
 * failure is reported as CHUNK_FAILED; the coordinator decides whether the
 * chunk is retried. The locks taken for the run are released in every case.
 *
 * Each assignment names the chunk attempt it is for. A run whose attempt
 * is no longer the chunk's current one (the coordinator recovered the
 * chunk and handed it out again) stops before opening an integration, and
 * every report it makes carries its attempt so the coordinator can ignore it.
 *
 * Every log line from a chunk run carries taskId, chunkId and worker in the MDC.
 */
@Component
public class ChunkWorker {

    private static final Logger log = LoggerFactory.getLogger(ChunkWorker.class);

    private final EventBus           bus;
    private final ChunkStore         chunkStore;
    private final TaskService        taskService;
    private final RepositoryScanner  scanner;
    private final CodeGenerator      generator;
    private final IntegrationGateway gateway;
    private final Executor           executor;
    private final String             workerId;

    private EventBus.Subscription subscription;

    @Autowired
    public ChunkWorker(EventBus bus,
                       ChunkStore chunkStore,
                       TaskService taskService,
                       RepositoryScanner scanner,
                       CodeGenerator generator,
                       IntegrationGateway gateway,
                       @Value("${featureforge.worker.id:chunk-worker}") String workerId,
                       @Value("${featureforge.worker.pool-size:4}") int poolSize) {
        this(bus, chunkStore, taskService, scanner, generator, gateway, workerId,
                Executors.newFixedThreadPool(poolSize));
    }

    public ChunkWorker(EventBus bus,
                       ChunkStore chunkStore,
                       TaskService taskService,
                       RepositoryScanner scanner,
                       CodeGenerator generator,
                       IntegrationGateway gateway,
                       String workerId,
                       Executor executor) {
        this.bus         = bus;
        this.chunkStore  = chunkStore;
        this.taskService = taskService;
        this.scanner     = scanner;
        this.generator   = generator;
        this.gateway     = gateway;
        this.workerId    = workerId;
        this.executor    = executor;
    }

    @PostConstruct
    public void start() {
        subscription = bus.subscribe(EventType.CHUNK_ASSIGNED, this::onChunkAssigned);
        log.info("Chunk worker '{}' listening for assignments", workerId);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
        if (executor instanceof ExecutorService pool) {
            pool.shutdown();
        }
    }

    public String workerId() {
        return workerId;
    }

    // ------------------------------------------------------------------
    // Assignment handling
    // ------------------------------------------------------------------

    void onChunkAssigned(Event event) {
        if (!workerId.equals(event.payloadString("worker"))) {
            return;
        }
        String chunkId = event.payloadString("chunk_id");
        String taskId  = event.payloadString("task_id");
        int attempt    = event.payloadInt("attempt", 0);
        executor.execute(() -> {
            try {
                process(taskId, chunkId, attempt);
            } catch (Exception e) {
                // Reached only if reporting the failure itself failed.
                log.error("Unhandled error while processing chunk {}: {}", chunkId, e.getMessage(), e);
            }
        });
    }

    /** Run one attempt of a chunk to completion or failure. Always releases that attempt's locks. */
    void process(String taskId, String chunkId, int attempt) {
        MDC.put("taskId",  taskId);
        MDC.put("chunkId", chunkId);
        MDC.put("worker",  workerId);
        try {
            Chunk chunk = chunkStore.getChunk(chunkId)
                    .orElseThrow(() -> new NoSuchElementException("Unknown chunk " + chunkId));
            Task task = taskService.findById(taskId)
                    .orElseThrow(() -> new NoSuchElementException("Unknown task " + taskId));
            if (task.getStatus().isTerminal()) {
                log.info("Skipping chunk {}: task is {}", chunkId, task.getStatus());
                return;
            }
            if (isSuperseded(chunk, attempt)) {
                log.info("Skipping chunk {}: attempt {} is no longer current", chunkId, attempt);
                return;
            }

            log.info("Starting chunk {} (attempt {}): {}", chunkId, attempt, chunk.getDescription());
            bus.publish(EventType.CHUNK_STARTED, workerId, payload(taskId, chunkId, attempt,
                    "description", chunk.getDescription(),
                    "files", chunk.getFiles()));

            Map<String, String> existing =
                    scanner.readExisting(Path.of(task.getTargetLocation()), chunk.getFiles());

            bus.publish(EventType.CODE_GENERATION_STARTED, workerId, payload(taskId, chunkId, attempt,
                    "existing_files", existing.size()));
            GeneratedChange change = generator.generate(chunk, existing);

            bus.publish(EventType.FILES_MODIFIED, workerId, payload(taskId, chunkId, attempt,
                    "files", new ArrayList<>(change.modifiedFiles().keySet())));

            Optional<Chunk> latest = chunkStore.getChunk(chunkId);
            if (latest.isEmpty() || isSuperseded(latest.get(), attempt)) {
                log.warn("Chunk {} attempt {} was superseded while generating; not opening an integration",
                        chunkId, attempt);
                return;
            }

            String handle = gateway.open(chunk, change.modifiedFiles(), change.commitMessage());
            bus.publish(EventType.INTEGRATION_OPENED, workerId, payload(taskId, chunkId, attempt,
                    "handle", handle));

            log.info("Chunk {} complete, integration {}", chunkId, handle);
            bus.publish(EventType.CHUNK_COMPLETED, workerId, payload(taskId, chunkId, attempt,
                    "handle", handle));

        } catch (CollaboratorException e) {
            log.warn("Chunk {} failed (retryable={}): {}", chunkId, e.isRetryable(), e.getMessage());
            reportFailure(taskId, chunkId, attempt, e.getMessage(), e.isRetryable());
        } catch (IllegalArgumentException | NoSuchElementException e) {
            log.error("Chunk {} cannot be processed: {}", chunkId, e.getMessage());
            reportFailure(taskId, chunkId, attempt, e.getMessage(), false);
        } catch (RuntimeException e) {
            log.error("Chunk {} failed unexpectedly: {}", chunkId, e.getMessage(), e);
            reportFailure(taskId, chunkId, attempt, e.getMessage(), true);
        } finally {
            int released = chunkStore.release(workerId, chunkId, attempt);
            if (released > 0) {
                bus.publish(EventType.FILE_UNLOCKED, workerId, payload(taskId, chunkId, attempt,
                        "released", released));
            }
            MDC.remove("taskId");
            MDC.remove("chunkId");
            MDC.remove("worker");
        }
    }

    private void reportFailure(String taskId, String chunkId, int attempt, String error, boolean retryable) {
        bus.publish(EventType.CHUNK_FAILED, workerId, payload(taskId, chunkId, attempt,
                "error", error == null ? "unknown error" : error,
                "retryable", retryable));
    }

    private static boolean isSuperseded(Chunk chunk, int attempt) {
        return chunk.getStatus() != ChunkStatus.IN_PROGRESS || chunk.getAttempts() != attempt;
    }

    private static Map<String, Object> payload(String taskId, String chunkId, int attempt, Object... extra) {
        Map<String, Object> payload = Payloads.of("task_id", taskId, "chunk_id", chunkId, "attempt", attempt);
        payload.putAll(Payloads.of(extra));
        return payload;
    }
}
