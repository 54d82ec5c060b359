package com.featureforge.coordinator.service;

import com.featureforge.coordinator.model.ChunkStatus;

/**
 * Thrown when a chunk status change is not one of the legal lifecycle moves.
 */
public class IllegalChunkTransitionException extends RuntimeException {

    public IllegalChunkTransitionException(String chunkId, ChunkStatus from, ChunkStatus to) {
        super("Chunk " + chunkId + " cannot move from " + from + " to " + to);
    }
}
