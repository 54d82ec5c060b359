package com.featureforge.coordinator.model;

/**
 * Closed set of coordination events written to the durable event log.
 *
 * Every chunk-scoped event carries {@code taskId} and {@code chunkId}
 * in its payload.
 */
public enum EventType {
    FEATURE_ANALYZED,
    CHUNKS_PLANNED,
    CHUNK_ASSIGNED,
    FILE_LOCKED,
    FILE_UNLOCKED,
    CHUNK_STARTED,
    CODE_GENERATION_STARTED,
    FILES_MODIFIED,
    INTEGRATION_OPENED,
    CHUNK_COMPLETED,
    CHUNK_FAILED,
    MERGE_REQUESTED,
    CHUNK_MERGED,
    FEATURE_COMPLETED
}
