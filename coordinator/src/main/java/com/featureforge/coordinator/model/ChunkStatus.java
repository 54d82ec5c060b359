package com.featureforge.coordinator.model;

/**
 * Lifecycle of a single chunk.
 *
 * Transitions:
 *   PLANNED     → IN_PROGRESS (file locks acquired, assigned to a worker)
 *   IN_PROGRESS → COMPLETE    (worker opened an integration for it)
 *   IN_PROGRESS → PLANNED     (attempt failed, will be scheduled again)
 *   COMPLETE    → MERGED      (integration completed)
 */
public enum ChunkStatus {
    PLANNED,
    IN_PROGRESS,
    COMPLETE,
    MERGED;

    public boolean canTransitionTo(ChunkStatus next) {
        return switch (this) {
            case PLANNED     -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == COMPLETE || next == PLANNED;
            case COMPLETE    -> next == MERGED;
            case MERGED      -> false;
        };
    }

    /** COMPLETE or MERGED: the chunk has produced an integratable result. */
    public boolean hasResult() {
        return this == COMPLETE || this == MERGED;
    }
}
