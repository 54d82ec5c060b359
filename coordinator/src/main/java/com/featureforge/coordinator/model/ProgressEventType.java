package com.featureforge.coordinator.model;

import java.util.Locale;

/**
 * Well-known progress phases.
 *
 * The progress_events.event_type column is an open set of strings; these
 * are the values this service writes itself.
 */
public enum ProgressEventType {
    TASK_STARTED,
    FEATURE_ANALYSIS_STARTED,
    FEATURE_ANALYSIS_COMPLETED,
    CHUNKING_STARTED,
    CHUNKING_COMPLETED,
    CHUNK_PROCESSING_STARTED,
    CHUNK_PROCESSING_COMPLETED,
    AGENT_CODE_GENERATION_STARTED,
    AGENT_FILES_MODIFIED,
    PR_CREATED,
    PR_MERGED,
    MERGING_STARTED,
    MERGING_COMPLETED,
    TASK_COMPLETED,
    TASK_FAILED,
    TASK_CANCELLED,
    ERROR_OCCURRED;

    /** Stored form, e.g. {@code chunk_processing_started}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
