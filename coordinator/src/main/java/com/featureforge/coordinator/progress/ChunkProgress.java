package com.featureforge.coordinator.progress;

import com.featureforge.coordinator.model.Chunk;
import com.featureforge.coordinator.model.ChunkStatus;

import java.util.List;

/**
 * Read-only view of one chunk inside a {@link TaskSummary}.
 */
public record ChunkProgress(
        String chunkId,
        String description,
        ChunkStatus status,
        List<String> files,
        List<String> dependencies,
        String assignedWorker,
        String integrationHandle,
        int attempts
) {
    public static ChunkProgress from(Chunk chunk) {
        return new ChunkProgress(
                chunk.getId(),
                chunk.getDescription(),
                chunk.getStatus(),
                List.copyOf(chunk.getFiles()),
                List.copyOf(chunk.getDependencies()),
                chunk.getAssignedWorker(),
                chunk.getIntegrationHandle(),
                chunk.getAttempts()
        );
    }
}
