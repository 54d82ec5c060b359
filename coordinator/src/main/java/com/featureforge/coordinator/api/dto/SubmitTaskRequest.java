package com.featureforge.coordinator.api.dto;

/**
 * Request body for POST /tasks.
 *
 * targetLocation must name an existing directory on the coordinator's host.
 */
public record SubmitTaskRequest(String targetLocation, String featureDescription) {}
