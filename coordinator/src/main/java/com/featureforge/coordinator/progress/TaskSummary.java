package com.featureforge.coordinator.progress;

import com.featureforge.coordinator.model.Chunk;
import com.featureforge.coordinator.model.Task;
import com.featureforge.coordinator.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Point-in-time view of a task and its chunks, for display.
 *
 * @param totalChunks     the task's recorded total, or the number of chunks
 *                        when no total was recorded yet
 * @param percentage      completedChunks / totalChunks * 100; 0 when there are no chunks
 * @param phase           human-readable phase, e.g. "Processing Chunks (2/5)"
 */
public record TaskSummary(
        String taskId,
        TaskStatus status,
        String phase,
        String targetLocation,
        String featureDescription,
        int totalChunks,
        int completedChunks,
        double percentage,
        List<String> integrationHandles,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        List<ChunkProgress> chunks
) {

    public static TaskSummary of(Task task, List<Chunk> chunks) {
        int total     = task.getTotalChunks() > 0 ? task.getTotalChunks() : chunks.size();
        int completed = task.getCompletedChunks();
        double percentage = total > 0 ? completed * 100.0 / total : 0.0;

        return new TaskSummary(
                task.getId(),
                task.getStatus(),
                phaseOf(task.getStatus(), chunks),
                task.getTargetLocation(),
                task.getFeatureDescription(),
                total,
                completed,
                percentage,
                List.copyOf(task.getIntegrationHandles()),
                task.getErrorMessage(),
                task.getCreatedAt(),
                task.getUpdatedAt(),
                task.getCompletedAt(),
                chunks.stream().map(ChunkProgress::from).collect(Collectors.toList())
        );
    }

    static String phaseOf(TaskStatus status, List<Chunk> chunks) {
        return switch (status) {
            case QUEUED            -> "Queued";
            case ANALYZING         -> "Analyzing Feature";
            case CHUNKING          -> "Planning Chunks";
            case PROCESSING_CHUNKS -> {
                long done = chunks.stream().filter(c -> c.getStatus().hasResult()).count();
                yield "Processing Chunks (" + done + "/" + chunks.size() + ")";
            }
            case MERGING           -> "Merging Pull Requests";
            case COMPLETED         -> "Completed";
            case FAILED            -> "Failed";
            case CANCELLED         -> "Cancelled";
        };
    }
}
