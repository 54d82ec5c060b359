package com.featureforge.coordinator.service;

import java.util.List;

/**
 * Thrown when a decomposition cannot be scheduled: duplicate ids, chunks
 * without files, unknown or circular dependencies.
 */
public class ChunkPlanValidationException extends RuntimeException {

    private final List<String> problems;

    public ChunkPlanValidationException(List<String> problems) {
        super("Invalid chunk plan: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
