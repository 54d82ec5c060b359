package com.featureforge.coordinator.collaborator.dto;

/**
 * Request body for POST /plan on the agent service.
 */
public record PlanRequest(
        String feature_description,
        String repository_structure
) {}
