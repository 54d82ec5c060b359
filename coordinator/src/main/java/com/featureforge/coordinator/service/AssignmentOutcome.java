package com.featureforge.coordinator.service;

/**
 * Result of one attempt to start an available chunk.
 *
 * While the attempt runs the chunk is ATTEMPTING: still PLANNED in the
 * store, with the coordinator trying to take its file locks. The attempt
 * always ends in one of these two outcomes; ATTEMPTING itself is never
 * stored.
 */
public enum AssignmentOutcome {
    /** Locks taken, chunk IN_PROGRESS and handed to a worker. */
    ASSIGNED,
    /** A file was locked in the meantime; the chunk stays PLANNED for a later cycle. */
    DEFERRED
}
