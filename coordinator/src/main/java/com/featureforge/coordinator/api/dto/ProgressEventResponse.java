package com.featureforge.coordinator.api.dto;

import com.featureforge.coordinator.model.ProgressEvent;

import java.time.Instant;
import java.util.Map;

/**
 * A stored or streamed progress event.
 */
public record ProgressEventResponse(
        Long                id,
        String              taskId,
        String              type,
        Instant             timestamp,
        Map<String, Object> payload,
        String              message
) {
    public static ProgressEventResponse from(ProgressEvent e) {
        return new ProgressEventResponse(
                e.getId(),
                e.getTaskId(),
                e.getType(),
                e.getCreatedAt(),
                e.getPayload(),
                e.getMessage()
        );
    }
}
