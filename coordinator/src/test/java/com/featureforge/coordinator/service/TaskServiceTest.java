package com.featureforge.coordinator.service;

import com.featureforge.coordinator.model.ProgressEventType;
import com.featureforge.coordinator.model.Task;
import com.featureforge.coordinator.model.TaskStatus;
import com.featureforge.coordinator.progress.ProgressPublisher;
import com.featureforge.coordinator.repository.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TaskService with the repository and publisher mocked.
 */
@ExtendWith(MockitoExtension.class)
class TaskServiceTest {

    @Mock TaskRepository    taskRepo;
    @Mock ProgressPublisher progress;

    @TempDir Path targetDir;

    TaskService service;

    @BeforeEach
    void setUp() {
        service = new TaskService(taskRepo, progress);
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_existingDirectory_queuesTaskAndEmitsTaskStarted() {
        when(taskRepo.save(any(Task.class))).thenAnswer(inv -> inv.getArgument(0));

        Task task = service.submit(targetDir.toString(), "Add a wishlist");

        assertThat(task.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(task.getId()).isNotBlank();
        verify(progress).publish(eq(task.getId()), eq(ProgressEventType.TASK_STARTED), anyMap(), anyString());
    }

    @Test
    void submit_missingDirectory_isRejected() {
        String missing = targetDir.resolve("does-not-exist").toString();

        assertThatThrownBy(() -> service.submit(missing, "Add a wishlist"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a directory");
        verifyNoInteractions(taskRepo, progress);
    }

    @Test
    void submit_blankDescription_isRejected() {
        assertThatThrownBy(() -> service.submit(targetDir.toString(), "  "))
                .isInstanceOf(IllegalArgumentException.class);
        verify(taskRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // transition()
    // ------------------------------------------------------------------

    @Test
    void transition_allowedMove_saves() {
        Task task = taskIn(TaskStatus.QUEUED);
        when(taskRepo.save(any(Task.class))).thenAnswer(inv -> inv.getArgument(0));

        Task result = service.transition(task.getId(), TaskStatus.ANALYZING);

        assertThat(result.getStatus()).isEqualTo(TaskStatus.ANALYZING);
        assertThat(result.getCompletedAt()).isNull();
    }

    @Test
    void transition_intoTerminal_stampsCompletedAt() {
        Task task = taskIn(TaskStatus.MERGING);
        when(taskRepo.save(any(Task.class))).thenAnswer(inv -> inv.getArgument(0));

        Task result = service.transition(task.getId(), TaskStatus.COMPLETED);

        assertThat(result.getCompletedAt()).isNotNull();
    }

    @Test
    void transition_fromTerminal_isRejected() {
        Task task = taskIn(TaskStatus.CANCELLED);

        assertThatThrownBy(() -> service.transition(task.getId(), TaskStatus.ANALYZING))
                .isInstanceOf(IllegalTaskTransitionException.class);
        verify(taskRepo, never()).save(any());
    }

    @Test
    void transition_unknownTask_throws() {
        when(taskRepo.findByIdForUpdate("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.transition("nope", TaskStatus.ANALYZING))
                .isInstanceOf(NoSuchElementException.class);
    }

    // ------------------------------------------------------------------
    // fail() / cancel()
    // ------------------------------------------------------------------

    @Test
    void fail_activeTask_recordsErrorAndEmitsTaskFailed() {
        Task task = taskIn(TaskStatus.PROCESSING_CHUNKS);

        boolean failed = service.fail(task.getId(), "chunk exploded");

        assertThat(failed).isTrue();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getErrorMessage()).isEqualTo("chunk exploded");
        assertThat(task.getCompletedAt()).isNotNull();
        verify(progress).publish(eq(task.getId()), eq(ProgressEventType.TASK_FAILED), anyMap(), contains("chunk exploded"));
    }

    @Test
    void fail_alreadyCancelled_changesNothing() {
        Task task = taskIn(TaskStatus.CANCELLED);

        assertThat(service.fail(task.getId(), "late failure")).isFalse();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.CANCELLED);
        verifyNoInteractions(progress);
    }

    @Test
    void cancel_activeTask_emitsTaskCancelled() {
        Task task = taskIn(TaskStatus.ANALYZING);

        assertThat(service.cancel(task.getId())).isTrue();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.CANCELLED);
        verify(progress).publish(eq(task.getId()), eq(ProgressEventType.TASK_CANCELLED), anyMap(), anyString());
    }

    @Test
    void cancel_terminalOrUnknown_returnsFalse() {
        Task done = taskIn(TaskStatus.COMPLETED);
        when(taskRepo.findByIdForUpdate("nope")).thenReturn(Optional.empty());

        assertThat(service.cancel(done.getId())).isFalse();
        assertThat(service.cancel("nope")).isFalse();
        verify(taskRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // Counters
    // ------------------------------------------------------------------

    @Test
    void recordChunkCompleted_activeTask_countsAndKeepsHandle() {
        Task task = taskIn(TaskStatus.PROCESSING_CHUNKS);

        service.recordChunkCompleted(task.getId(), "pr-1");
        service.recordChunkCompleted(task.getId(), "pr-2");

        assertThat(task.getCompletedChunks()).isEqualTo(2);
        assertThat(task.getIntegrationHandles()).containsExactly("pr-1", "pr-2");
    }

    @Test
    void recordChunkCompleted_terminalTask_isIgnored() {
        Task task = taskIn(TaskStatus.FAILED);

        service.recordChunkCompleted(task.getId(), "pr-1");
        service.setTotalChunks(task.getId(), 4);

        assertThat(task.getCompletedChunks()).isZero();
        assertThat(task.getTotalChunks()).isZero();
        verify(taskRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Test
    void list_noLimit_usesDefaultPageOfFifty() {
        service.list(null, null);
        service.list(TaskStatus.QUEUED, 5);

        verify(taskRepo).findAllByOrderByCreatedAtDesc(PageRequest.of(0, 50));
        verify(taskRepo).findByStatusOrderByCreatedAtDesc(TaskStatus.QUEUED, PageRequest.of(0, 5));
    }

    @Test
    void inFlight_asksForNonQueuedActiveStatuses() {
        when(taskRepo.findByStatusInOrderByCreatedAtAsc(TaskStatus.inFlight())).thenReturn(List.of());

        assertThat(service.inFlight()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Task taskIn(TaskStatus status) {
        Task task = new Task(targetDir.toString(), "Add a wishlist");
        task.setStatus(status);
        lenient().when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));
        lenient().when(taskRepo.findByIdForUpdate(task.getId())).thenReturn(Optional.of(task));
        return task;
    }
}
