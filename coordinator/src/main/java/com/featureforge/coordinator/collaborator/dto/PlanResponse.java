package com.featureforge.coordinator.collaborator.dto;

import com.featureforge.coordinator.collaborator.ChunkPlan;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response from POST /plan.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanResponse(List<PlannedChunk> chunks) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlannedChunk(
            String chunk_id,
            String description,
            List<String> files,
            List<String> dependencies,
            Integer estimated_effort
    ) {
        public ChunkPlan toChunkPlan() {
            return new ChunkPlan(chunk_id, description, files, dependencies,
                    estimated_effort == null ? 5 : estimated_effort);
        }
    }
}
