package com.featureforge.coordinator.service;

import com.featureforge.coordinator.collaborator.ChunkPlan;
import com.featureforge.coordinator.collaborator.CollaboratorException;
import com.featureforge.coordinator.collaborator.FeaturePlanner;
import com.featureforge.coordinator.collaborator.IntegrationGateway;
import com.featureforge.coordinator.collaborator.RepositoryScanner;
import com.featureforge.coordinator.events.EventBus;
import com.featureforge.coordinator.events.Payloads;
import com.featureforge.coordinator.model.Chunk;
import com.featureforge.coordinator.model.ChunkStatus;
import com.featureforge.coordinator.model.Event;
import com.featureforge.coordinator.model.EventType;
import com.featureforge.coordinator.model.ProgressEventType;
import com.featureforge.coordinator.model.Task;
import com.featureforge.coordinator.model.TaskStatus;
import com.featureforge.coordinator.progress.ProgressPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Drives one feature task at a time from QUEUED to COMPLETED.
 *
 * Every tick (fixed delay, {@code featureforge.coordinator.poll-interval}):
 *   1. With no current task: adopt an in-flight task left by a previous
 *      process, or take the oldest QUEUED task and plan it
 *      (ANALYZING → decompose → CHUNKING → PROCESSING_CHUNKS).
 *   2. Drop the current task if it was cancelled or failed meanwhile.
 *   3. Otherwise run one cycle: recover stale chunks, assign available
 *      chunks to the worker, merge chunks whose dependencies are merged,
 *      and advance to MERGING / COMPLETED when the chunks allow it.
 *
 * The database is the only shared state. Workers report back through
 * CHUNK_COMPLETED and CHUNK_FAILED events, which this class handles on
 * the publishing thread.
 *
 * A failure inside a cycle is logged and the cycle is retried on the next
 * tick; a failure while planning fails the task.
 */
@Component
@EnableScheduling
public class TaskCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TaskCoordinator.class);

    static final String ACTOR = "coordinator";

    private final TaskService        taskService;
    private final ChunkStore         chunkStore;
    private final EventBus           bus;
    private final ProgressPublisher  progress;
    private final FeaturePlanner     planner;
    private final IntegrationGateway gateway;
    private final RepositoryScanner  scanner;
    private final MeterRegistry      meters;
    private final String             workerId;
    private final int                maxChunkAttempts;
    private final Duration           staleAfter;

    private final Counter assignedCounter;
    private final Counter deferredCounter;
    private final Counter mergedCounter;
    private final Counter failedCounter;

    // The one task this coordinator is working on; null when idle.
    private final AtomicReference<String> currentTaskId = new AtomicReference<>();

    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    public TaskCoordinator(TaskService taskService,
                           ChunkStore chunkStore,
                           EventBus bus,
                           ProgressPublisher progress,
                           FeaturePlanner planner,
                           IntegrationGateway gateway,
                           RepositoryScanner scanner,
                           MeterRegistry meters,
                           @Value("${featureforge.worker.id:chunk-worker}") String workerId,
                           @Value("${featureforge.coordinator.max-chunk-attempts:3}") int maxChunkAttempts,
                           @Value("${featureforge.coordinator.stale-after:PT30M}") Duration staleAfter) {
        this.taskService      = taskService;
        this.chunkStore       = chunkStore;
        this.bus              = bus;
        this.progress         = progress;
        this.planner          = planner;
        this.gateway          = gateway;
        this.scanner          = scanner;
        this.meters           = meters;
        this.workerId         = workerId;
        this.maxChunkAttempts = maxChunkAttempts;
        this.staleAfter       = staleAfter;

        this.assignedCounter = meters.counter("featureforge.chunks.assigned");
        this.deferredCounter = meters.counter("featureforge.chunks.deferred");
        this.mergedCounter   = meters.counter("featureforge.chunks.merged");
        this.failedCounter   = meters.counter("featureforge.chunks.failed");
    }

    @PostConstruct
    public void start() {
        subscriptions.add(bus.subscribe(EventType.CHUNK_COMPLETED, this::onChunkCompleted));
        subscriptions.add(bus.subscribe(EventType.CHUNK_FAILED, this::onChunkFailed));
    }

    @PreDestroy
    public void stop() {
        subscriptions.forEach(EventBus.Subscription::unsubscribe);
        subscriptions.clear();
    }

    /** Id of the task being driven, if any. */
    public Optional<String> currentTaskId() {
        return Optional.ofNullable(currentTaskId.get());
    }

    // ------------------------------------------------------------------
    // Tick
    // ------------------------------------------------------------------

    @Scheduled(fixedDelayString = "${featureforge.coordinator.poll-interval:PT5S}")
    public void tick() {
        try {
            String taskId = currentTaskId.get();
            if (taskId == null) {
                taskId = pickTask();
                if (taskId == null) return;
            }
            MDC.put("taskId", taskId);

            Optional<Task> found = taskService.findById(taskId);
            if (found.isEmpty() || found.get().getStatus().isTerminal()) {
                log.info("Task {} is {}; stopping work on it", taskId,
                        found.map(t -> t.getStatus().name()).orElse("gone"));
                currentTaskId.set(null);
                return;
            }

            Task task = found.get();
            if (task.getStatus() == TaskStatus.QUEUED && !plan(task)) {
                return;
            }
            runCycle(taskId);
        } catch (Exception e) {
            log.error("Coordinator cycle failed, retrying next tick: {}", e.getMessage(), e);
        } finally {
            MDC.remove("taskId");
        }
    }

    /**
     * Choose the task to work on: an in-flight one first (resumed after a
     * restart), else the oldest QUEUED one. Returns null when idle.
     */
    private String pickTask() {
        for (Task task : taskService.inFlight()) {
            if (task.getStatus() == TaskStatus.ANALYZING || task.getStatus() == TaskStatus.CHUNKING) {
                // Planning is synchronous inside a tick, so no one is planning this task any more.
                taskService.fail(task.getId(), "Interrupted during " + task.getStatus().name().toLowerCase());
                meters.counter("featureforge.tasks.completed", "status", TaskStatus.FAILED.name()).increment();
                continue;
            }
            log.info("Resuming task {} in {}", task.getId(), task.getStatus());
            currentTaskId.set(task.getId());
            recoverOrphanedChunks(task.getId());
            return task.getId();
        }

        return taskService.nextQueued()
                .map(task -> {
                    log.info("Picked up queued task {}", task.getId());
                    currentTaskId.set(task.getId());
                    return task.getId();
                })
                .orElse(null);
    }

    // ------------------------------------------------------------------
    // Planning
    // ------------------------------------------------------------------

    /**
     * Decompose the task into chunks and store them.
     *
     * @return true when the task reached PROCESSING_CHUNKS; false when it failed
     */
    boolean plan(Task task) {
        String taskId = task.getId();
        try {
            taskService.transition(taskId, TaskStatus.ANALYZING);
            progress.publish(taskId, ProgressEventType.FEATURE_ANALYSIS_STARTED,
                    Payloads.of("target_location", task.getTargetLocation()), "Analyzing feature");

            String structure = scanner.structure(Path.of(task.getTargetLocation()));
            List<ChunkPlan> plans = planner.decompose(task.getFeatureDescription(), structure);

            bus.publish(EventType.FEATURE_ANALYZED, ACTOR,
                    Payloads.of("task_id", taskId, "chunk_count", plans.size()));
            progress.publish(taskId, ProgressEventType.FEATURE_ANALYSIS_COMPLETED,
                    Payloads.of("chunk_count", plans.size()),
                    "Feature analysed into " + plans.size() + " chunk(s)");

            taskService.transition(taskId, TaskStatus.CHUNKING);
            progress.publish(taskId, ProgressEventType.CHUNKING_STARTED, Payloads.of(), "Planning chunks");

            ChunkPlanValidator.validate(plans);
            List<Chunk> chunks = chunkStore.createChunks(toChunks(taskId, plans));
            taskService.setTotalChunks(taskId, chunks.size());

            List<String> chunkIds = chunks.stream().map(Chunk::getId).collect(Collectors.toList());
            bus.publish(EventType.CHUNKS_PLANNED, ACTOR, Payloads.of("task_id", taskId, "chunk_ids", chunkIds));
            progress.publish(taskId, ProgressEventType.CHUNKING_COMPLETED,
                    Payloads.of("total_chunks", chunks.size(), "chunk_ids", chunkIds),
                    "Planned " + chunks.size() + " chunk(s)");

            taskService.transition(taskId, TaskStatus.PROCESSING_CHUNKS);
            return true;
        } catch (Exception e) {
            log.error("Planning failed for task {}: {}", taskId, e.getMessage(), e);
            if (taskService.fail(taskId, "Planning failed: " + e.getMessage())) {
                meters.counter("featureforge.tasks.completed", "status", TaskStatus.FAILED.name()).increment();
            }
            currentTaskId.set(null);
            return false;
        }
    }

    /** Namespace plan ids with the task id so chunks of different tasks never collide. */
    static List<Chunk> toChunks(String taskId, List<ChunkPlan> plans) {
        return plans.stream()
                .map(p -> new Chunk(
                        chunkId(taskId, p.chunkId()),
                        taskId,
                        p.description() == null ? p.chunkId() : p.description(),
                        p.files(),
                        p.dependencies().stream().map(dep -> chunkId(taskId, dep)).collect(Collectors.toList())))
                .collect(Collectors.toList());
    }

    static String chunkId(String taskId, String planChunkId) {
        return taskId + "_" + planChunkId;
    }

    // ------------------------------------------------------------------
    // Cycle
    // ------------------------------------------------------------------

    private void runCycle(String taskId) {
        sweepStaleChunks(taskId);

        List<Chunk> chunks = chunkStore.listChunksForTask(taskId);
        if (chunks.isEmpty()) {
            taskService.fail(taskId, "Task has no chunks");
            currentTaskId.set(null);
            return;
        }

        assignAvailable(taskId, chunks);
        mergeReady(taskId);
        if (isTerminal(taskId)) return;

        chunks = chunkStore.listChunksForTask(taskId);
        Task task = taskService.findById(taskId).orElseThrow();

        if (ChunkScheduler.allMerged(chunks)) {
            complete(task);
        } else if (ChunkScheduler.nothingPending(chunks) && task.getStatus() == TaskStatus.PROCESSING_CHUNKS) {
            enterMerging(taskId);
        }
    }

    private void assignAvailable(String taskId, List<Chunk> chunks) {
        List<Chunk> available = ChunkScheduler.availableChunks(chunks, chunkStore.lockedFiles());
        for (Chunk chunk : available) {
            if (isTerminal(taskId)) return;
            AssignmentOutcome outcome = tryAssign(chunk);
            log.debug("Chunk {} assignment: {}", chunk.getId(), outcome);
        }
    }

    /**
     * Attempt to start one available chunk: take its locks as the worker,
     * mark it IN_PROGRESS and announce the assignment.
     */
    AssignmentOutcome tryAssign(Chunk chunk) {
        String chunkId = chunk.getId();
        int attempt = chunk.getAttempts();
        if (!chunkStore.acquire(workerId, chunkId, attempt, chunk.getFiles())) {
            deferredCounter.increment();
            return AssignmentOutcome.DEFERRED;
        }
        try {
            chunkStore.updateStatus(chunkId, ChunkStatus.IN_PROGRESS, workerId, null);
        } catch (RuntimeException e) {
            chunkStore.release(workerId, chunkId, attempt);
            throw e;
        }

        bus.publish(EventType.FILE_LOCKED, ACTOR, Payloads.of(
                "task_id", chunk.getTaskId(), "chunk_id", chunkId, "attempt", attempt,
                "worker", workerId, "files", chunk.getFiles()));
        assignedCounter.increment();
        log.info("Assigned chunk {} (attempt {}) to {}", chunkId, attempt, workerId);
        bus.publish(EventType.CHUNK_ASSIGNED, ACTOR, Payloads.of(
                "task_id", chunk.getTaskId(), "chunk_id", chunkId, "attempt", attempt,
                "worker", workerId, "description", chunk.getDescription(), "files", chunk.getFiles()));
        return AssignmentOutcome.ASSIGNED;
    }

    /**
     * Integrate every chunk whose dependencies are merged. A chunk merged in
     * this pass can make its dependents eligible, so eligibility is checked
     * again until nothing new merges. Each chunk is attempted at most once
     * per cycle.
     */
    private void mergeReady(String taskId) {
        Set<String> attempted = new HashSet<>();
        boolean mergedAny = true;
        while (mergedAny && !isTerminal(taskId)) {
            mergedAny = false;
            for (Chunk chunk : ChunkScheduler.mergeEligible(chunkStore.listChunksForTask(taskId))) {
                if (!attempted.add(chunk.getId())) continue;
                if (merge(chunk)) mergedAny = true;
            }
        }
    }

    private boolean merge(Chunk chunk) {
        String chunkId = chunk.getId();
        String handle  = chunk.getIntegrationHandle();
        bus.publish(EventType.MERGE_REQUESTED, ACTOR, Payloads.of(
                "task_id", chunk.getTaskId(), "chunk_id", chunkId, "handle", handle));

        boolean merged;
        try {
            merged = gateway.complete(handle);
        } catch (CollaboratorException e) {
            if (!e.isRetryable()) {
                failTask(chunk.getTaskId(), "Merging chunk " + chunkId + " failed: " + e.getMessage());
                return false;
            }
            log.warn("Merge of chunk {} ({}) failed, retrying next cycle: {}", chunkId, handle, e.getMessage());
            return false;
        }
        if (!merged) {
            log.warn("Integration {} for chunk {} not merged yet, retrying next cycle", handle, chunkId);
            return false;
        }

        chunkStore.updateStatus(chunkId, ChunkStatus.MERGED);
        mergedCounter.increment();
        log.info("Merged chunk {} ({})", chunkId, handle);
        bus.publish(EventType.CHUNK_MERGED, ACTOR, Payloads.of(
                "task_id", chunk.getTaskId(), "chunk_id", chunkId, "handle", handle));
        return true;
    }

    private void enterMerging(String taskId) {
        taskService.transition(taskId, TaskStatus.MERGING);
        progress.publish(taskId, ProgressEventType.MERGING_STARTED, Payloads.of(), "Merging pull requests");
    }

    private void complete(Task task) {
        String taskId = task.getId();
        if (task.getStatus() == TaskStatus.PROCESSING_CHUNKS) {
            enterMerging(taskId);
        }
        Task done = taskService.transition(taskId, TaskStatus.COMPLETED);
        meters.counter("featureforge.tasks.completed", "status", TaskStatus.COMPLETED.name()).increment();

        bus.publish(EventType.FEATURE_COMPLETED, ACTOR, Payloads.of(
                "task_id", taskId, "integration_handles", done.getIntegrationHandles()));
        progress.publish(taskId, ProgressEventType.MERGING_COMPLETED,
                Payloads.of("merged", done.getIntegrationHandles().size()), "All pull requests merged");
        progress.publish(taskId, ProgressEventType.TASK_COMPLETED,
                Payloads.of("integration_handles", done.getIntegrationHandles()), "Feature completed");
        log.info("Task {} COMPLETED", taskId);
        currentTaskId.set(null);
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    /** Chunks IN_PROGRESS for longer than stale-after lose their locks and count a failed attempt. */
    private void sweepStaleChunks(String taskId) {
        Instant cutoff = Instant.now().minus(staleAfter);
        for (Chunk chunk : chunkStore.findStaleInProgress(cutoff)) {
            if (!chunk.getTaskId().equals(taskId)) continue;
            log.warn("Chunk {} in progress since {}, recovering", chunk.getId(), chunk.getStartedAt());
            recover(chunk, "Worker did not finish within " + staleAfter);
        }
    }

    /** After a restart no worker is running the task's IN_PROGRESS chunks any more. */
    private void recoverOrphanedChunks(String taskId) {
        for (Chunk chunk : chunkStore.listChunksForTask(taskId)) {
            if (chunk.getStatus() == ChunkStatus.IN_PROGRESS) {
                log.warn("Chunk {} was in progress before restart, recovering", chunk.getId());
                recover(chunk, "Coordinator restarted while chunk was in progress");
            }
        }
    }

    /**
     * Take a chunk away from the run that holds it. The old run may still
     * finish later; its locks, completion and failure reports all carry its
     * attempt number and are ignored once the chunk has moved on.
     */
    private void recover(Chunk chunk, String reason) {
        int attempt = chunk.getAttempts();
        Optional<Chunk> retried = chunkStore.recordFailedAttempt(chunk.getId(), attempt);
        if (retried.isEmpty()) {
            return;   // the run reported back in the meantime
        }
        String holder = chunk.getAssignedWorker() == null ? workerId : chunk.getAssignedWorker();
        int released = chunkStore.release(holder, chunk.getId(), attempt);
        if (released > 0) {
            bus.publish(EventType.FILE_UNLOCKED, ACTOR, Payloads.of(
                    "task_id", chunk.getTaskId(), "chunk_id", chunk.getId(),
                    "attempt", attempt, "released", released));
        }
        applyRetryBudget(chunk.getTaskId(), retried.get(), reason, true);
    }

    // ------------------------------------------------------------------
    // Worker reports
    // ------------------------------------------------------------------

    /** Only the chunk's current run can complete it, and only once. */
    void onChunkCompleted(Event event) {
        String taskId  = event.payloadString("task_id");
        String chunkId = event.payloadString("chunk_id");
        String handle  = event.payloadString("handle");
        int attempt    = event.payloadInt("attempt", -1);
        if (!chunkStore.completeAttempt(chunkId, attempt, handle)) {
            return;
        }
        taskService.recordChunkCompleted(taskId, handle);
    }

    void onChunkFailed(Event event) {
        String taskId    = event.payloadString("task_id");
        String chunkId   = event.payloadString("chunk_id");
        String error     = event.payloadString("error");
        int attempt      = event.payloadInt("attempt", -1);
        boolean retryable = Boolean.parseBoolean(event.payloadString("retryable"));

        Optional<Chunk> retried = chunkStore.recordFailedAttempt(chunkId, attempt);
        if (retried.isEmpty()) {
            return;   // a superseded run; the current one decides the chunk's fate
        }
        applyRetryBudget(taskId, retried.get(), error, retryable);
    }

    /**
     * Leave a failed chunk in the schedule, or fail the whole task when the
     * failure is not retryable or the attempt budget is used up.
     */
    private void applyRetryBudget(String taskId, Chunk chunk, String error, boolean retryable) {
        String chunkId = chunk.getId();
        failedCounter.increment();
        if (!retryable) {
            failTask(taskId, "Chunk " + chunkId + " failed: " + error);
        } else if (chunk.getAttempts() >= maxChunkAttempts) {
            failTask(taskId, "Chunk " + chunkId + " failed after " + chunk.getAttempts()
                    + " attempt(s): " + error);
        }
    }

    private void failTask(String taskId, String message) {
        if (taskService.fail(taskId, message)) {
            meters.counter("featureforge.tasks.completed", "status", TaskStatus.FAILED.name()).increment();
        }
        currentTaskId.compareAndSet(taskId, null);
    }

    private boolean isTerminal(String taskId) {
        return taskService.findById(taskId).map(t -> t.getStatus().isTerminal()).orElse(true);
    }
}
