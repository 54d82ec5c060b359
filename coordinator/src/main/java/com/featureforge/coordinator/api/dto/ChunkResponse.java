package com.featureforge.coordinator.api.dto;

import com.featureforge.coordinator.model.Chunk;
import com.featureforge.coordinator.model.ChunkStatus;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a chunk returned by GET /tasks/{id}/chunks.
 */
public record ChunkResponse(
        String       id,
        String       description,
        ChunkStatus  status,
        List<String> files,
        List<String> dependencies,
        String       assignedWorker,
        String       integrationHandle,
        int          attempts,
        Instant      startedAt
) {
    public static ChunkResponse from(Chunk c) {
        return new ChunkResponse(
                c.getId(),
                c.getDescription(),
                c.getStatus(),
                List.copyOf(c.getFiles()),
                List.copyOf(c.getDependencies()),
                c.getAssignedWorker(),
                c.getIntegrationHandle(),
                c.getAttempts(),
                c.getStartedAt()
        );
    }
}
