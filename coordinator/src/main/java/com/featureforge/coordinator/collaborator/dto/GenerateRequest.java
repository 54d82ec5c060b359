package com.featureforge.coordinator.collaborator.dto;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /generate.
 *
 * existing_files holds the current content of those chunk files that
 * already exist in the target.
 */
public record GenerateRequest(
        String chunk_id,
        String description,
        List<String> files,
        Map<String, String> existing_files
) {}
