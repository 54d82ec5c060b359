package com.featureforge.coordinator.service;

import com.featureforge.coordinator.model.ProgressEventType;
import com.featureforge.coordinator.model.Task;
import com.featureforge.coordinator.model.TaskStatus;
import com.featureforge.coordinator.progress.ProgressPublisher;
import com.featureforge.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Lifecycle of feature tasks.
 *
 * Every status change goes through {@link #transition}, which enforces
 * {@link TaskStatus#canTransitionTo}. Terminal tasks are read-only: status
 * writes are rejected and counter updates are ignored.
 *
 * Writers run on the coordinator thread and on worker threads at the same
 * time. Each mutator locks the task row before checking it, so a check and
 * its write can never interleave with another writer.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private static final int DEFAULT_LIST_LIMIT = 50;

    private final TaskRepository    taskRepo;
    private final ProgressPublisher progress;

    public TaskService(TaskRepository taskRepo, ProgressPublisher progress) {
        this.taskRepo = taskRepo;
        this.progress = progress;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Queue a new feature task.
     *
     * @throws IllegalArgumentException if targetLocation is not an existing directory
     *                                  or the description is blank
     */
    @Transactional
    public Task submit(String targetLocation, String featureDescription) {
        if (targetLocation == null || targetLocation.isBlank()
                || !Files.isDirectory(Path.of(targetLocation))) {
            throw new IllegalArgumentException("Target location is not a directory: " + targetLocation);
        }
        if (featureDescription == null || featureDescription.isBlank()) {
            throw new IllegalArgumentException("Feature description must not be blank");
        }

        Task task = taskRepo.save(new Task(targetLocation, featureDescription));
        log.info("Task {} queued for {}", task.getId(), targetLocation);
        progress.publish(task.getId(), ProgressEventType.TASK_STARTED,
                Map.of("target_location", targetLocation, "feature_description", featureDescription),
                "Task queued: " + abbreviate(featureDescription));
        return task;
    }

    // ------------------------------------------------------------------
    // State changes
    // ------------------------------------------------------------------

    /**
     * Move a task to {@code next}.
     *
     * @throws NoSuchElementException         if the task does not exist
     * @throws IllegalTaskTransitionException if the move is not allowed
     */
    @Transactional
    public Task transition(String taskId, TaskStatus next) {
        Task task = requireForUpdate(taskId);
        TaskStatus current = task.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new IllegalTaskTransitionException(taskId, current, next);
        }
        task.setStatus(next);
        if (next.isTerminal()) {
            task.setCompletedAt(Instant.now());
        }
        log.info("Task {}: {} -> {}", taskId, current, next);
        return taskRepo.save(task);
    }

    /**
     * Mark a task FAILED with a reason and emit task_failed.
     *
     * @return false if the task was already terminal (nothing changed)
     */
    @Transactional
    public boolean fail(String taskId, String message) {
        Task task = requireForUpdate(taskId);
        if (task.getStatus().isTerminal()) {
            log.warn("Not failing task {}: already {}", taskId, task.getStatus());
            return false;
        }
        TaskStatus previous = task.getStatus();
        task.setStatus(TaskStatus.FAILED);
        task.setErrorMessage(message);
        task.setCompletedAt(Instant.now());
        taskRepo.save(task);
        log.error("Task {} FAILED (was {}): {}", taskId, previous, message);
        progress.publish(taskId, ProgressEventType.TASK_FAILED,
                Map.of("error", message == null ? "" : message, "previous_status", previous.name()),
                "Task failed: " + message);
        return true;
    }

    /**
     * Cancel a task that has not finished yet.
     *
     * @return true if the task was cancelled; false if it is unknown or already terminal
     */
    @Transactional
    public boolean cancel(String taskId) {
        Optional<Task> found = taskRepo.findByIdForUpdate(taskId);
        if (found.isEmpty() || found.get().getStatus().isTerminal()) {
            return false;
        }
        Task task = found.get();
        TaskStatus previous = task.getStatus();
        task.setStatus(TaskStatus.CANCELLED);
        task.setCompletedAt(Instant.now());
        taskRepo.save(task);
        log.info("Task {} cancelled (was {})", taskId, previous);
        progress.publish(taskId, ProgressEventType.TASK_CANCELLED,
                Map.of("previous_status", previous.name()), "Task cancelled");
        return true;
    }

    /** Record how many chunks the task was split into. Ignored for terminal tasks. */
    @Transactional
    public void setTotalChunks(String taskId, int total) {
        Task task = requireForUpdate(taskId);
        if (task.getStatus().isTerminal()) {
            log.debug("Ignoring total chunk count for terminal task {}", taskId);
            return;
        }
        task.setTotalChunks(total);
        taskRepo.save(task);
    }

    /**
     * Count one more completed chunk and remember its integration handle.
     * Ignored for terminal tasks.
     */
    @Transactional
    public void recordChunkCompleted(String taskId, String integrationHandle) {
        Task task = requireForUpdate(taskId);
        if (task.getStatus().isTerminal()) {
            log.debug("Ignoring chunk completion for terminal task {}", taskId);
            return;
        }
        task.recordCompletedChunk(integrationHandle);
        taskRepo.save(task);
        log.info("Task {}: {}/{} chunk(s) complete", taskId, task.getCompletedChunks(), task.getTotalChunks());
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Task> findById(String taskId) {
        return taskRepo.findById(taskId);
    }

    /** Oldest QUEUED task; tasks are started strictly in submission order. */
    @Transactional(readOnly = true)
    public Optional<Task> nextQueued() {
        return taskRepo.findFirstByStatusOrderByCreatedAtAsc(TaskStatus.QUEUED);
    }

    /** Tasks a coordinator had started but not finished, oldest first. */
    @Transactional(readOnly = true)
    public List<Task> inFlight() {
        return taskRepo.findByStatusInOrderByCreatedAtAsc(TaskStatus.inFlight());
    }

    /** Every non-terminal task (QUEUED included), oldest first. */
    @Transactional(readOnly = true)
    public List<Task> activeTasks() {
        return taskRepo.findByStatusInOrderByCreatedAtAsc(TaskStatus.active());
    }

    /**
     * Most recent tasks first.
     *
     * @param status null for any status
     * @param limit  null or non-positive for the default of 50
     */
    @Transactional(readOnly = true)
    public List<Task> list(TaskStatus status, Integer limit) {
        PageRequest page = PageRequest.of(0, limit == null || limit <= 0 ? DEFAULT_LIST_LIMIT : limit);
        return status == null
                ? taskRepo.findAllByOrderByCreatedAtDesc(page)
                : taskRepo.findByStatusOrderByCreatedAtDesc(status, page);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Load a task for writing; the row stays locked until the caller's transaction ends. */
    private Task requireForUpdate(String taskId) {
        return taskRepo.findByIdForUpdate(taskId)
                .orElseThrow(() -> new NoSuchElementException("Unknown task " + taskId));
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }
}
