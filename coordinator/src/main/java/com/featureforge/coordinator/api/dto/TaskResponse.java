package com.featureforge.coordinator.api.dto;

import com.featureforge.coordinator.model.Task;
import com.featureforge.coordinator.model.TaskStatus;

import java.time.Instant;
import java.util.List;

/**
 * Response body for POST /tasks, GET /tasks and GET /tasks/{id}.
 */
public record TaskResponse(
        String       id,
        TaskStatus   status,
        String       targetLocation,
        String       featureDescription,
        int          totalChunks,
        int          completedChunks,
        List<String> integrationHandles,
        String       errorMessage,
        Instant      createdAt,
        Instant      updatedAt,
        Instant      completedAt
) {
    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.getId(),
                task.getStatus(),
                task.getTargetLocation(),
                task.getFeatureDescription(),
                task.getTotalChunks(),
                task.getCompletedChunks(),
                List.copyOf(task.getIntegrationHandles()),
                task.getErrorMessage(),
                task.getCreatedAt(),
                task.getUpdatedAt(),
                task.getCompletedAt()
        );
    }
}
