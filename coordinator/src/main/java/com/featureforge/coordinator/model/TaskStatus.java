package com.featureforge.coordinator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a feature task.
 *
 * Transitions (happy path):
 *   QUEUED → ANALYZING → CHUNKING → PROCESSING_CHUNKS → MERGING → COMPLETED
 *
 * Any non-terminal state can move to FAILED or CANCELLED.
 * COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum TaskStatus {
    QUEUED,
    ANALYZING,
    CHUNKING,
    PROCESSING_CHUNKS,
    MERGING,
    COMPLETED,
    FAILED,
    CANCELLED;

    private static final Set<TaskStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(TaskStatus next) {
        if (isTerminal()) return false;
        if (next == FAILED || next == CANCELLED) return true;
        return switch (this) {
            case QUEUED            -> next == ANALYZING;
            case ANALYZING         -> next == CHUNKING;
            case CHUNKING          -> next == PROCESSING_CHUNKS;
            case PROCESSING_CHUNKS -> next == MERGING;
            case MERGING           -> next == COMPLETED;
            default                -> false;
        };
    }

    /** Non-terminal states other than QUEUED: a coordinator was working on the task. */
    public static Set<TaskStatus> inFlight() {
        return EnumSet.of(ANALYZING, CHUNKING, PROCESSING_CHUNKS, MERGING);
    }

    public static Set<TaskStatus> active() {
        return EnumSet.complementOf(EnumSet.copyOf(TERMINAL));
    }
}
