package com.featureforge.coordinator.api;

import com.featureforge.coordinator.model.Chunk;
import com.featureforge.coordinator.model.ProgressEvent;
import com.featureforge.coordinator.model.Task;
import com.featureforge.coordinator.model.TaskStatus;
import com.featureforge.coordinator.progress.ProgressPublisher;
import com.featureforge.coordinator.progress.TaskSummary;
import com.featureforge.coordinator.service.ChunkStore;
import com.featureforge.coordinator.service.TaskService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for TaskController.
 *
 * @WebMvcTest starts only the web layer (no DB, no scheduler, no agent
 * service). Every collaborator of the controller is a mock.
 */
@WebMvcTest(TaskController.class)
class TaskControllerTest {

    @Autowired MockMvc mockMvc;

    @MockitoBean TaskService           taskService;
    @MockitoBean ChunkStore            chunkStore;
    @MockitoBean ProgressPublisher     progress;
    @MockitoBean ProgressStreamService streams;

    // ------------------------------------------------------------------
    // POST /tasks
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_returns201WithTask() throws Exception {
        Task task = fakeTask(TaskStatus.QUEUED);
        when(taskService.submit("/srv/shop", "Add a wishlist")).thenReturn(task);

        mockMvc.perform(post("/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"targetLocation":"/srv/shop","featureDescription":"Add a wishlist"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(task.getId()))
                .andExpect(jsonPath("$.status").value("QUEUED"))
                .andExpect(jsonPath("$.integrationHandles").isArray());
    }

    @Test
    void submit_targetNotADirectory_returns400() throws Exception {
        when(taskService.submit(any(), any()))
                .thenThrow(new IllegalArgumentException("Target location is not a directory: /nope"));

        mockMvc.perform(post("/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"targetLocation":"/nope","featureDescription":"Add a wishlist"}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /tasks, /tasks/{id}
    // ------------------------------------------------------------------

    @Test
    void list_passesFiltersThrough() throws Exception {
        when(taskService.list(TaskStatus.FAILED, 5)).thenReturn(List.of(fakeTask(TaskStatus.FAILED)));

        mockMvc.perform(get("/tasks").param("status", "FAILED").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("FAILED"));
    }

    @Test
    void getTask_existingId_returns200() throws Exception {
        Task task = fakeTask(TaskStatus.PROCESSING_CHUNKS);
        when(taskService.findById(task.getId())).thenReturn(Optional.of(task));

        mockMvc.perform(get("/tasks/{id}", task.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSING_CHUNKS"))
                .andExpect(jsonPath("$.featureDescription").value("Add a wishlist"));
    }

    @Test
    void getTask_unknownId_returns404() throws Exception {
        when(taskService.findById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/tasks/nope"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Sub-resources
    // ------------------------------------------------------------------

    @Test
    void getChunks_returnsTaskChunks() throws Exception {
        Task task = fakeTask(TaskStatus.PROCESSING_CHUNKS);
        when(taskService.findById(task.getId())).thenReturn(Optional.of(task));
        when(chunkStore.listChunksForTask(task.getId())).thenReturn(List.of(
                new Chunk(task.getId() + "_models", task.getId(), "Wishlist model",
                        List.of("models.py"), List.of())));

        mockMvc.perform(get("/tasks/{id}/chunks", task.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("PLANNED"))
                .andExpect(jsonPath("$[0].files[0]").value("models.py"));
    }

    @Test
    void getSummary_returnsPhase() throws Exception {
        Task task = fakeTask(TaskStatus.MERGING);
        when(progress.summarize(task.getId())).thenReturn(Optional.of(TaskSummary.of(task, List.of())));

        mockMvc.perform(get("/tasks/{id}/summary", task.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("Merging Pull Requests"));
    }

    @Test
    void getSummary_unknownId_returns404() throws Exception {
        when(progress.summarize("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/tasks/nope/summary"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getEvents_returnsStoredEvents() throws Exception {
        Task task = fakeTask(TaskStatus.PROCESSING_CHUNKS);
        when(taskService.findById(task.getId())).thenReturn(Optional.of(task));
        when(progress.events(task.getId(), 10)).thenReturn(List.of(
                new ProgressEvent(task.getId(), "pr_created", Map.of("handle", "pr-4"), "Opened pull request pr-4")));

        mockMvc.perform(get("/tasks/{id}/events", task.getId()).param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("pr_created"))
                .andExpect(jsonPath("$[0].payload.handle").value("pr-4"));
    }

    @Test
    void stream_existingTask_startsAsyncResponse() throws Exception {
        Task task = fakeTask(TaskStatus.PROCESSING_CHUNKS);
        when(taskService.findById(task.getId())).thenReturn(Optional.of(task));
        when(streams.createEmitter(task.getId())).thenReturn(new SseEmitter());

        mockMvc.perform(get("/tasks/{id}/stream", task.getId()).accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted());
        verify(streams).createEmitter(task.getId());
    }

    // ------------------------------------------------------------------
    // POST /tasks/{id}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_activeTask_returns200() throws Exception {
        Task task = fakeTask(TaskStatus.PROCESSING_CHUNKS);
        when(taskService.findById(task.getId())).thenReturn(Optional.of(task));
        when(taskService.cancel(task.getId())).thenReturn(true);

        mockMvc.perform(post("/tasks/{id}/cancel", task.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(true));
    }

    @Test
    void cancel_finishedTask_returns409() throws Exception {
        Task task = fakeTask(TaskStatus.COMPLETED);
        when(taskService.findById(task.getId())).thenReturn(Optional.of(task));
        when(taskService.cancel(task.getId())).thenReturn(false);

        mockMvc.perform(post("/tasks/{id}/cancel", task.getId()))
                .andExpect(status().isConflict());
    }

    @Test
    void cancel_unknownTask_returns404() throws Exception {
        when(taskService.findById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(post("/tasks/nope/cancel"))
                .andExpect(status().isNotFound());
        verify(taskService, never()).cancel(any());
    }

    private static Task fakeTask(TaskStatus status) {
        Task task = new Task("/srv/shop", "Add a wishlist");
        task.setStatus(status);
        return task;
    }
}
