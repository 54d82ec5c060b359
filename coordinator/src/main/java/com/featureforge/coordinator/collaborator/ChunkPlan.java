package com.featureforge.coordinator.collaborator;

import java.util.List;

/**
 * One chunk as proposed by a {@link FeaturePlanner}, before it is stored.
 *
 * Ids and dependency ids are local to the plan; the coordinator namespaces
 * them with the task id when it creates the Chunk rows.
 *
 * @param estimatedEffort planner's estimate on a 1-10 scale (informational)
 */
public record ChunkPlan(
        String chunkId,
        String description,
        List<String> files,
        List<String> dependencies,
        int estimatedEffort
) {
    public ChunkPlan {
        files        = files == null ? List.of() : List.copyOf(files);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public ChunkPlan(String chunkId, String description, List<String> files, List<String> dependencies) {
        this(chunkId, description, files, dependencies, 5);
    }
}
