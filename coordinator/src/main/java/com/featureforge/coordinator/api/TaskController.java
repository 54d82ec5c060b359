package com.featureforge.coordinator.api;

import com.featureforge.coordinator.api.dto.ChunkResponse;
import com.featureforge.coordinator.api.dto.ProgressEventResponse;
import com.featureforge.coordinator.api.dto.SubmitTaskRequest;
import com.featureforge.coordinator.api.dto.TaskResponse;
import com.featureforge.coordinator.model.Task;
import com.featureforge.coordinator.model.TaskStatus;
import com.featureforge.coordinator.progress.ProgressPublisher;
import com.featureforge.coordinator.progress.TaskSummary;
import com.featureforge.coordinator.service.ChunkStore;
import com.featureforge.coordinator.service.TaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST API for feature tasks.
 *
 * POST /tasks                - queue a new feature task
 * GET  /tasks                - list tasks, newest first (?status=&limit=)
 * GET  /tasks/{id}           - current state of a task
 * GET  /tasks/{id}/chunks    - the task's chunks
 * GET  /tasks/{id}/summary   - progress summary (phase, percentage, chunks)
 * GET  /tasks/{id}/events    - stored progress events, newest first (?limit=)
 * GET  /tasks/{id}/stream    - live progress as Server-Sent Events
 * POST /tasks/{id}/cancel    - cancel a task that has not finished
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final TaskService           taskService;
    private final ChunkStore            chunkStore;
    private final ProgressPublisher     progress;
    private final ProgressStreamService streams;

    public TaskController(TaskService taskService,
                          ChunkStore chunkStore,
                          ProgressPublisher progress,
                          ProgressStreamService streams) {
        this.taskService = taskService;
        this.chunkStore  = chunkStore;
        this.progress    = progress;
        this.streams     = streams;
    }

    /**
     * Queue a new feature task.
     *
     * Example:
     *   curl -X POST http://localhost:8080/tasks \
     *     -H "Content-Type: application/json" \
     *     -d '{"targetLocation":"/srv/repos/shop","featureDescription":"Add a wishlist"}'
     *
     * Returns 400 if the target is not an existing directory.
     */
    @PostMapping
    public ResponseEntity<TaskResponse> submit(@RequestBody SubmitTaskRequest req) {
        try {
            Task task = taskService.submit(req.targetLocation(), req.featureDescription());
            return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(task));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @GetMapping
    public List<TaskResponse> list(@RequestParam(required = false) TaskStatus status,
                                   @RequestParam(required = false) Integer limit) {
        return taskService.list(status, limit).stream()
                .map(TaskResponse::from)
                .toList();
    }

    /**
     * Current state of a task. Returns 404 if the id is not found.
     */
    @GetMapping("/{id}")
    public TaskResponse getTask(@PathVariable String id) {
        return TaskResponse.from(requireTask(id));
    }

    @GetMapping("/{id}/chunks")
    public List<ChunkResponse> getChunks(@PathVariable String id) {
        requireTask(id);
        return chunkStore.listChunksForTask(id).stream()
                .map(ChunkResponse::from)
                .toList();
    }

    @GetMapping("/{id}/summary")
    public TaskSummary getSummary(@PathVariable String id) {
        return progress.summarize(id).orElseThrow(() -> notFound(id));
    }

    @GetMapping("/{id}/events")
    public List<ProgressEventResponse> getEvents(@PathVariable String id,
                                                 @RequestParam(required = false) Integer limit) {
        requireTask(id);
        return progress.events(id, limit).stream()
                .map(ProgressEventResponse::from)
                .toList();
    }

    /**
     * Live progress stream. Ends after the task completes, fails or is cancelled.
     */
    @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String id) {
        requireTask(id);
        return streams.createEmitter(id);
    }

    /**
     * Cancel a task.
     *
     * HTTP 200 - {"cancelled": true}
     * HTTP 404 - task ID not found
     * HTTP 409 - task already completed, failed or cancelled
     */
    @PostMapping("/{id}/cancel")
    public Map<String, Object> cancel(@PathVariable String id) {
        Task task = requireTask(id);
        if (!taskService.cancel(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Task " + id + " is already " + task.getStatus());
        }
        return Map.of("taskId", id, "cancelled", true);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Task requireTask(String id) {
        return taskService.findById(id).orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found: " + id);
    }
}
