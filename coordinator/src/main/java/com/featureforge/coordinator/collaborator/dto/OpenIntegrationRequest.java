package com.featureforge.coordinator.collaborator.dto;

import java.util.Map;

/**
 * Request body for POST /integrations.
 */
public record OpenIntegrationRequest(
        String chunk_id,
        String description,
        Map<String, String> changed_files,
        String commit_message
) {}
