package com.featureforge.coordinator.collaborator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Response from POST /generate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerateResponse(
        Map<String, String> modified_files,
        String commit_message
) {}
