package com.featureforge.coordinator.collaborator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /integrations and POST /integrations/{handle}/complete.
 * {@code merged} is only present on the latter.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntegrationResponse(String handle, Boolean merged) {}
