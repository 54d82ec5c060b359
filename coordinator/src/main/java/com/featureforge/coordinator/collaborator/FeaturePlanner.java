package com.featureforge.coordinator.collaborator;

import java.util.List;

/**
 * Splits a feature request into chunks.
 */
public interface FeaturePlanner {

    /**
     * @param featureDescription what the user asked for
     * @param repositoryStructure newline-separated relative file paths of the target
     * @return proposed chunks; validated by the coordinator before use
     * @throws CollaboratorException if the planner cannot be reached or fails
     */
    List<ChunkPlan> decompose(String featureDescription, String repositoryStructure);
}
